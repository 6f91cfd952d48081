package com.fvr.recommendation.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fvr.recommendation.service.ClientLike;
import com.fvr.recommendation.service.RecommendationQuery;
import com.fvr.recommendation.service.RecommendationService;
import com.fvr.recommendation.service.RelatedQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RecommendationController {
    private final RecommendationService recommendationService;

    public RecommendationController(RecommendationService recommendationService) {
        this.recommendationService = recommendationService;
    }

    @PostMapping("/recommendations")
    public Map<String, Object> recommend(@RequestBody(required = false) RecommendationRequest request) {
        RecommendationRequest body = request == null ? new RecommendationRequest() : request;
        RecommendationQuery query = new RecommendationQuery(
            body.userId,
            body.mode,
            body.limit,
            toClientLikes(body.likes),
            Boolean.TRUE.equals(body.refreshCache),
            Boolean.TRUE.equals(body.debug)
        );
        return recommendationService.recommend(query).toResponse();
    }

    @GetMapping("/videos/{videoId}/similar")
    public Map<String, Object> similarById(
        @PathVariable String videoId,
        @RequestParam(name = "host", required = false) String host,
        @RequestParam(name = "user_id", required = false) String userId,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "refresh_cache", required = false) String refreshCache,
        @RequestParam(name = "debug", required = false) String debug
    ) {
        RelatedQuery query = new RelatedQuery(
            videoId,
            null,
            host,
            null,
            userId,
            limit,
            List.of(),
            parseFlag(refreshCache),
            parseFlag(debug)
        );
        return recommendationService.related(query).toResponse();
    }

    @PostMapping("/videos/similar")
    public Map<String, Object> similar(@RequestBody(required = false) SimilarRequest request) {
        SimilarRequest body = request == null ? new SimilarRequest() : request;
        RelatedQuery query = new RelatedQuery(
            body.videoId,
            body.uuid,
            body.host,
            toVector(body.vector),
            body.userId,
            body.limit,
            toClientLikes(body.likes),
            Boolean.TRUE.equals(body.refreshCache),
            Boolean.TRUE.equals(body.debug)
        );
        return recommendationService.related(query).toResponse();
    }

    static boolean parseFlag(String value) {
        if (value == null) {
            return false;
        }
        String normalized = value.trim().toLowerCase();
        return normalized.equals("1") || normalized.equals("true") || normalized.equals("yes") || normalized.equals("on");
    }

    private static List<ClientLike> toClientLikes(List<LikeRequest> likes) {
        List<ClientLike> result = new ArrayList<>();
        if (likes == null) {
            return result;
        }
        for (LikeRequest like : likes) {
            if (like != null) {
                result.add(new ClientLike(like.uuid, like.host));
            }
        }
        return result;
    }

    private static float[] toVector(List<Double> values) {
        if (values == null) {
            return null;
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = values.get(i);
            vector[i] = value == null ? Float.NaN : value.floatValue();
        }
        return vector;
    }

    public static class RecommendationRequest {
        @JsonProperty("user_id")
        public String userId;
        public String mode;
        public Integer limit;
        public List<LikeRequest> likes;
        @JsonProperty("refresh_cache")
        public Boolean refreshCache;
        public Boolean debug;
    }

    public static class SimilarRequest {
        @JsonProperty("video_id")
        public String videoId;
        public String uuid;
        public String host;
        public List<Double> vector;
        @JsonProperty("user_id")
        public String userId;
        public Integer limit;
        public List<LikeRequest> likes;
        @JsonProperty("refresh_cache")
        public Boolean refreshCache;
        public Boolean debug;
    }

    public static class LikeRequest {
        public String uuid;
        public String host;
    }
}
