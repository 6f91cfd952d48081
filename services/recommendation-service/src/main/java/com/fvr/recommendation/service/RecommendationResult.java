package com.fvr.recommendation.service;

import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class RecommendationResult {
    private final List<CandidateRow> rows;
    private final Map<String, Object> seed;
    private final boolean includeDebug;
    private final long generatedAt;
    private final Long total;

    public RecommendationResult(
        List<CandidateRow> rows,
        Map<String, Object> seed,
        boolean includeDebug,
        long generatedAt,
        Long total
    ) {
        this.rows = rows;
        this.seed = seed;
        this.includeDebug = includeDebug;
        this.generatedAt = generatedAt;
        this.total = total;
    }

    public List<CandidateRow> getRows() {
        return rows;
    }

    public Map<String, Object> getSeed() {
        return seed;
    }

    public Map<String, Object> toResponse() {
        List<Map<String, Object>> body = new ArrayList<>(rows.size());
        for (CandidateRow row : rows) {
            body.add(row.toResponse(includeDebug));
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("generated_at", generatedAt);
        if (total != null) {
            response.put("total", total);
        }
        response.put("count", body.size());
        response.put("seed", seed);
        response.put("rows", body);
        return response;
    }
}
