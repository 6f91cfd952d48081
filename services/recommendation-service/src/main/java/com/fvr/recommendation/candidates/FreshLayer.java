package com.fvr.recommendation.candidates;

import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoRepository;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Newest published videos. The pool is {@code fresh-pool-size}, or
 * {@code similar-per-like} when that is unset.
 */
@Component
public class FreshLayer implements CandidateLayer {
    public static final String NAME = "fresh";

    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final RecommendationProperties properties;
    private final SimilarityProperties similarityProperties;

    public FreshLayer(
        VideoRepository videoRepository,
        ResourceLocks locks,
        RecommendationProperties properties,
        SimilarityProperties similarityProperties
    ) {
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.properties = properties;
        this.similarityProperties = similarityProperties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<CandidateRow> getCandidates(LayerRequest request, int limit, Layer settings) {
        if (limit <= 0) {
            return List.of();
        }
        int configured = properties.getFreshPoolSize() > 0 ? properties.getFreshPoolSize() : properties.getSimilarPerLike();
        int poolSize = Math.max(Math.max(configured, settings.getPoolSize()), limit);
        int threshold = similarityProperties.getVideoErrorThreshold();
        List<CandidateRow> pool = locks.withMetadata(() -> videoRepository.findRecent(poolSize, threshold));
        return CandidateSampling.capped(pool, settings, limit);
    }
}
