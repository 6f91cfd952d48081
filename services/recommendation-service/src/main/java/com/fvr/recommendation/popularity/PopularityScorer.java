package com.fvr.recommendation.popularity;

public final class PopularityScorer {
    static final double MS_PER_DAY = 86_400_000.0;
    static final double MISSING_AGE_DAYS = 3650.0;

    private PopularityScorer() {
    }

    /**
     * {@code (views + likeWeight * likes) / (1 + ageDays / 30)}. Unknown or zero
     * publish times count as roughly ten years old.
     */
    public static double score(Long views, Long likes, Long publishedAtMs, double likeWeight, long nowMs) {
        double viewCount = Math.max(0L, views == null ? 0L : views);
        double likeCount = Math.max(0L, likes == null ? 0L : likes);
        double ageDays;
        if (publishedAtMs == null || publishedAtMs <= 0) {
            ageDays = MISSING_AGE_DAYS;
        } else {
            ageDays = Math.max(nowMs - publishedAtMs, 0L) / MS_PER_DAY;
        }
        return (viewCount + likeWeight * likeCount) / (1.0 + ageDays / 30.0);
    }
}
