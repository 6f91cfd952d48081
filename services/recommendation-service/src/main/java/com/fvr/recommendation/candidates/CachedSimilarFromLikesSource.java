package com.fvr.recommendation.candidates;

import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.likes.LikesService;
import com.fvr.recommendation.similarity.SimilarCandidatesService;
import com.fvr.recommendation.similarity.SimilarityCandidatesPolicy;
import com.fvr.recommendation.video.VideoRepository;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Serves from the similarity cache; ANN search on a miss only when
 * {@code similarity.allow-ann-on-cache-miss} is set.
 */
@Component
public class CachedSimilarFromLikesSource extends AbstractSimilarFromLikesSource {
    public static final String NAME = "cache-optimized";

    private final SimilarityProperties similarityProperties;

    public CachedSimilarFromLikesSource(
        LikesService likesService,
        VideoRepository videoRepository,
        SimilarCandidatesService similarCandidatesService,
        ResourceLocks locks,
        RecommendationProperties properties,
        SimilarityProperties similarityProperties,
        Random random
    ) {
        super(likesService, videoRepository, similarCandidatesService, locks, properties, random);
        this.similarityProperties = similarityProperties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected SimilarityCandidatesPolicy policy(boolean refreshCache) {
        return new SimilarityCandidatesPolicy(
            refreshCache,
            true,
            similarityProperties.isRequireFullCache(),
            true,
            similarityProperties.isAllowAnnOnCacheMiss()
        );
    }
}
