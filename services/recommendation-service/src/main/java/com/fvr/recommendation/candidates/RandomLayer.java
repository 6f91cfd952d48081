package com.fvr.recommendation.candidates;

import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.diversify.DiversificationState;
import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Uniformly random videos. With {@code below-explore-min} set and likes
 * present, only videos less similar than {@code explore-min} are kept, falling
 * back to the unfiltered pool when none qualify.
 */
@Component
public class RandomLayer implements CandidateLayer {
    public static final String NAME = "random";
    static final int CAPPED_ATTEMPTS = 5;

    private final RandomVideoPool randomPool;
    private final LikeAffinity likeAffinity;
    private final Random random;

    public RandomLayer(RandomVideoPool randomPool, LikeAffinity likeAffinity, Random random) {
        this.randomPool = randomPool;
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
        int poolSize = CandidateSampling.poolSize(settings, limit);
        int attempts = CandidateSampling.hasCaps(settings) ? CAPPED_ATTEMPTS : 1;
        DiversificationState state = new DiversificationState();
        List<CandidateRow> pool = new ArrayList<>();
        for (int attempt = 0; attempt < attempts && pool.size() < poolSize; attempt++) {
            List<CandidateRow> drawn = randomPool.sample(poolSize);
            if (drawn.isEmpty()) {
                break;
            }
            pool.addAll(CandidateSampling.capped(drawn, settings, poolSize - pool.size(), state));
        }
        if (settings.isBelowExploreMin() && request.hasLikes()) {
            List<float[]> liked = likeAffinity.likedVectors(request.getLikes());
            if (!liked.isEmpty()) {
                likeAffinity.annotate(pool, liked);
                List<CandidateRow> below = new ArrayList<>();
                for (CandidateRow row : pool) {
                    if (row.getAffinity() != null && row.getAffinity() < settings.getExploreMin()) {
                        below.add(row);
                    }
                }
                if (!below.isEmpty()) {
                    return CandidateSampling.sample(below, limit, random);
                }
            }
        }
        return CandidateSampling.sample(pool, limit, random);
    }
}
