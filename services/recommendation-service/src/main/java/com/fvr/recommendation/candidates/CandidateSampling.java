package com.fvr.recommendation.candidates;

import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.diversify.DiversificationFilter;
import com.fvr.recommendation.diversify.DiversificationState;
import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

final class CandidateSampling {
    private CandidateSampling() {
    }

    /**
     * Uniform sample without replacement. Lists already within the limit come
     * back unchanged in order.
     */
    static List<CandidateRow> sample(List<CandidateRow> rows, int limit, Random random) {
        if (limit <= 0 || rows.isEmpty()) {
            return List.of();
        }
        if (rows.size() <= limit) {
            return new ArrayList<>(rows);
        }
        List<CandidateRow> shuffled = new ArrayList<>(rows);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, limit));
    }

    static List<CandidateRow> capped(List<CandidateRow> rows, Layer settings, int limit, DiversificationState state) {
        return DiversificationFilter.apply(
            rows, settings.getMaxPerAuthor(), settings.getMaxPerInstance(), true, limit, state);
    }

    static List<CandidateRow> capped(List<CandidateRow> rows, Layer settings, int limit) {
        return capped(rows, settings, limit, new DiversificationState());
    }

    static boolean hasCaps(Layer settings) {
        return settings.getMaxPerAuthor() > 0 || settings.getMaxPerInstance() > 0;
    }

    static int poolSize(Layer settings, int limit) {
        return Math.max(settings.getPoolSize(), limit);
    }
}
