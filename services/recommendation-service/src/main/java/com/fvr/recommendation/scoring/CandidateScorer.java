package com.fvr.recommendation.scoring;

import com.fvr.recommendation.config.RecommendationProperties.Scoring;
import com.fvr.recommendation.video.CandidateRow;

/**
 * Weighted blend of similarity, freshness, popularity and a per-layer bonus.
 * Each component is in {@code [0, 1]}; the bonus is added as configured.
 */
public final class CandidateScorer {
    static final double MS_PER_DAY = 1000.0 * 60 * 60 * 24;

    private CandidateScorer() {
    }

    /**
     * Scores the row in place. A non-null {@code layer} also becomes the row's layer.
     */
    public static double score(CandidateRow row, Scoring settings, String layer, long nowMs) {
        double similarity = extractSimilarity(row);
        double freshness = freshness(row.getMetadata().get("published_at"), nowMs, settings);
        double popularity = popularity(row.getMetadata().get("views"), row.getMetadata().get("likes"), settings);
        double bonus = settings.getLayerWeights().getOrDefault(layer == null ? "" : layer, 0.0);
        double score = settings.getSimilarityWeight() * similarity
            + settings.getFreshnessWeight() * freshness
            + settings.getPopularityWeight() * popularity
            + bonus;
        row.setSimilarityScore(similarity);
        row.setScore(score);
        row.setFreshnessScore(freshness);
        row.setPopularityScore(popularity);
        if (layer != null) {
            row.setLayer(layer);
        }
        return score;
    }

    /**
     * The row's similarity, or its score when no similarity was recorded,
     * clamped to {@code [0, 1]}.
     */
    static double extractSimilarity(CandidateRow row) {
        Double raw = row.getSimilarityScore() != null ? row.getSimilarityScore() : row.getScore();
        if (raw == null || !Double.isFinite(raw) || raw < 0) {
            return 0.0;
        }
        return Math.min(raw, 1.0);
    }

    /**
     * Exponential decay on age in days; a video exactly one half-life old scores 0.5.
     */
    static double freshness(Object publishedAt, long nowMs, Scoring settings) {
        if (!(publishedAt instanceof Number number) || number.longValue() == 0L) {
            return 0.0;
        }
        double halfLife = settings.getFreshnessHalfLifeDays();
        if (halfLife <= 0) {
            return 0.0;
        }
        long ageMs = Math.max(nowMs - number.longValue(), 0L);
        return Math.pow(0.5, (ageMs / MS_PER_DAY) / halfLife);
    }

    static double popularity(Object views, Object likes, Scoring settings) {
        double weighted = settings.getPopularityViews() * count(views) + settings.getPopularityLikes() * count(likes);
        if (weighted <= 0) {
            return 0.0;
        }
        double scaled = Math.log1p(weighted);
        return scaled / (scaled + 1.0);
    }

    private static long count(Object value) {
        return value instanceof Number number ? Math.max(number.longValue(), 0L) : 0L;
    }
}
