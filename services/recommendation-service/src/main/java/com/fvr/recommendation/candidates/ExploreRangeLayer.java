package com.fvr.recommendation.candidates;

import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Random videos whose affinity to the user's likes falls inside
 * {@code [similarity-min, similarity-max)}: related enough to be relevant,
 * far enough to widen the feed.
 */
@Component
public class ExploreRangeLayer implements CandidateLayer {
    private static final Logger log = LoggerFactory.getLogger(ExploreRangeLayer.class);

    public static final String NAME = "explore";

    private final RandomVideoPool randomPool;
    private final LikeAffinity likeAffinity;
    private final Random random;

    public ExploreRangeLayer(RandomVideoPool randomPool, LikeAffinity likeAffinity, Random random) {
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
        if (limit <= 0 || !request.hasLikes()) {
            return List.of();
        }
        List<CandidateRow> pool = CandidateSampling.capped(
            randomPool.sample(CandidateSampling.poolSize(settings, limit)), settings, 0);
        List<float[]> liked = likeAffinity.likedVectors(request.getLikes());
        if (liked.isEmpty()) {
            return CandidateSampling.sample(pool, limit, random);
        }
        likeAffinity.annotate(pool, liked);
        List<CandidateRow> inRange = new ArrayList<>();
        for (CandidateRow row : pool) {
            double affinity = row.getAffinity() == null ? 0.0 : row.getAffinity();
            if (affinity >= settings.getSimilarityMin() && affinity < settings.getSimilarityMax()) {
                inRange.add(row);
            }
        }
        for (CandidateRow row : inRange) {
            row.setExplorePoolSize(pool.size());
            row.setExploreInRange(inRange.size());
        }
        log.debug("explore_layer pool={} in_range={} limit={}", pool.size(), inRange.size(), limit);
        if (inRange.size() > limit) {
            return CandidateSampling.sample(inRange, limit, random);
        }
        inRange.sort(Comparator.comparingDouble((CandidateRow row) -> -row.getAffinity()));
        return inRange;
    }
}
