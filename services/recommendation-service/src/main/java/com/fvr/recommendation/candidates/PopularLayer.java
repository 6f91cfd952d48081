package com.fvr.recommendation.candidates;

import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.popularity.PopularVideosSource;
import com.fvr.recommendation.video.CandidateRow;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * A random draw from the current popularity ranking. With likes, rows also
 * carry their affinity as the similarity score so scoring can favour them.
 */
@Component
public class PopularLayer implements CandidateLayer {
    public static final String NAME = "popular";

    private final PopularVideosSource popularSource;
    private final LikeAffinity likeAffinity;
    private final Random random;

    public PopularLayer(PopularVideosSource popularSource, LikeAffinity likeAffinity, Random random) {
        this.popularSource = popularSource;
        this.likeAffinity = likeAffinity;
        this.random = random;
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
        List<CandidateRow> pool = CandidateSampling.capped(
            popularSource.topPopular(CandidateSampling.poolSize(settings, limit)), settings, 0);
        if (request.hasLikes()) {
            likeAffinity.annotate(pool, likeAffinity.likedVectors(request.getLikes()));
        }
        return CandidateSampling.sample(pool, limit, random);
    }
}
