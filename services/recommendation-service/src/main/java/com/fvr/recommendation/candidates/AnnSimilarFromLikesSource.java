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
 * Reads the similarity cache and always falls back to ANN search on a miss.
 */
@Component
public class AnnSimilarFromLikesSource extends AbstractSimilarFromLikesSource {
    public static final String NAME = "ann";

    private final SimilarityProperties similarityProperties;

    public AnnSimilarFromLikesSource(
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
            refreshCache, true, similarityProperties.isRequireFullCache(), true, true);
    }
}
