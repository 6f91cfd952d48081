package com.fvr.recommendation.candidates;

import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.video.CandidateRow;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Videos similar to the user's likes through the configured source and its
 * fallback chain.
 */
@Component
public class ExploitLayer implements CandidateLayer {
    public static final String NAME = "exploit";

    private final SimilarFromLikesSourceFactory sourceFactory;
    private final RandomVideoPool randomPool;
    private final RecommendationProperties properties;

    public ExploitLayer(
        SimilarFromLikesSourceFactory sourceFactory,
        RandomVideoPool randomPool,
        RecommendationProperties properties
    ) {
        this.sourceFactory = sourceFactory;
        this.randomPool = randomPool;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<CandidateRow> getCandidates(LayerRequest request, int limit, Layer settings) {
        List<CandidateRow> rows = generatorFor(request.getSimilarSource())
            .getCandidates(request.getScope(), request.getUserId(), limit, request.isRefreshCache());
        return CandidateSampling.capped(rows, settings, limit);
    }

    SimilarFromLikesGenerator generatorFor(String requestedSource) {
        String sourceName = requestedSource != null ? requestedSource : properties.getSimilarSource();
        SimilarFromLikesSource source = sourceFactory.create(sourceName);
        String fallbackName = JdbcUtils.trimToNull(properties.getFallbackSource());
        SimilarFromLikesSource fallback = fallbackName == null || fallbackName.equals(source.name())
            ? null
            : sourceFactory.create(fallbackName);
        return new SimilarFromLikesGenerator(source, fallback, randomPool);
    }
}
