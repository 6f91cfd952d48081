package com.fvr.recommendation.scoring;

import com.fvr.recommendation.video.CandidateRow;
import java.util.Collection;

/**
 * Min and max finite similarity over a candidate pool; both null when no row has one.
 */
public record PoolBounds(Double min, Double max, int count) {

    public static PoolBounds of(Collection<CandidateRow> rows) {
        Double min = null;
        Double max = null;
        int count = 0;
        for (CandidateRow row : rows) {
            Double similarity = row.getSimilarityScore();
            if (similarity == null || !Double.isFinite(similarity)) {
                continue;
            }
            count++;
            min = min == null ? similarity : Math.min(min, similarity);
            max = max == null ? similarity : Math.max(max, similarity);
        }
        return new PoolBounds(min, max, count);
    }

    public void applyTo(Collection<CandidateRow> rows) {
        for (CandidateRow row : rows) {
            row.setPoolMin(min);
            row.setPoolMax(max);
        }
    }
}
