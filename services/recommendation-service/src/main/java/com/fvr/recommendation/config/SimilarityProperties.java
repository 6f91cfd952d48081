package com.fvr.recommendation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "similarity")
public class SimilarityProperties {
    private boolean normalizeQueries = true;
    private int searchLimit = 200;
    private int maxPerAuthor = 0;
    private boolean excludeSourceAuthor = false;
    private boolean requireFullCache = true;
    private boolean allowAnnOnCacheMiss = true;
    private int videoErrorThreshold = 3;

    public boolean isNormalizeQueries() {
        return normalizeQueries;
    }

    public void setNormalizeQueries(boolean normalizeQueries) {
        this.normalizeQueries = normalizeQueries;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    public void setSearchLimit(int searchLimit) {
        this.searchLimit = searchLimit;
    }

    public int getMaxPerAuthor() {
        return maxPerAuthor;
    }

    public void setMaxPerAuthor(int maxPerAuthor) {
        this.maxPerAuthor = maxPerAuthor;
    }

    public boolean isExcludeSourceAuthor() {
        return excludeSourceAuthor;
    }

    public void setExcludeSourceAuthor(boolean excludeSourceAuthor) {
        this.excludeSourceAuthor = excludeSourceAuthor;
    }

    public boolean isRequireFullCache() {
        return requireFullCache;
    }

    public void setRequireFullCache(boolean requireFullCache) {
        this.requireFullCache = requireFullCache;
    }

    public boolean isAllowAnnOnCacheMiss() {
        return allowAnnOnCacheMiss;
    }

    public void setAllowAnnOnCacheMiss(boolean allowAnnOnCacheMiss) {
        this.allowAnnOnCacheMiss = allowAnnOnCacheMiss;
    }

    public int getVideoErrorThreshold() {
        return videoErrorThreshold;
    }

    public void setVideoErrorThreshold(int videoErrorThreshold) {
        this.videoErrorThreshold = videoErrorThreshold;
    }
}
