package com.fvr.recommendation.api;

import com.fvr.recommendation.ann.AnnSimilaritySource;
import com.fvr.recommendation.common.RequestContext;
import com.fvr.recommendation.common.RequestContextHolder;
import java.util.HashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
    private final AnnSimilaritySource annSource;

    public HealthController(AnnSimilaritySource annSource) {
        this.annSource = annSource;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        RequestContext context = RequestContextHolder.get();
        Map<String, Object> response = new HashMap<>();
        response.put("status", "ok");
        response.put("embeddings", annSource.size());
        response.put("dimension", annSource.dimension());
        response.put("trace_id", context == null ? null : context.getTraceId());
        response.put("request_id", context == null ? null : context.getRequestId());
        return response;
    }
}
