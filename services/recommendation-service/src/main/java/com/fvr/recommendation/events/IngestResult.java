package com.fvr.recommendation.events;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class IngestResult {
    private final int ingested;
    private final int duplicates;
    private final List<Map<String, Object>> results;

    public IngestResult(int ingested, int duplicates, List<Map<String, Object>> results) {
        this.ingested = ingested;
        this.duplicates = duplicates;
        this.results = results;
    }

    public int getIngested() {
        return ingested;
    }

    public int getDuplicates() {
        return duplicates;
    }

    public List<Map<String, Object>> getResults() {
        return results;
    }

    public Map<String, Object> toResponse() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("count", results.size());
        response.put("ingested", ingested);
        response.put("duplicates", duplicates);
        response.put("results", results);
        return response;
    }
}
