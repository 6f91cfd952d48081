package com.fvr.recommendation.moderation;

import com.fvr.recommendation.video.CandidateRow;
import java.util.List;

public class ModerationResult {
    private final List<CandidateRow> rows;
    private final ModerationFilterStats stats;

    public ModerationResult(List<CandidateRow> rows, ModerationFilterStats stats) {
        this.rows = rows;
        this.stats = stats;
    }

    public List<CandidateRow> getRows() {
        return rows;
    }

    public ModerationFilterStats getStats() {
        return stats;
    }
}
