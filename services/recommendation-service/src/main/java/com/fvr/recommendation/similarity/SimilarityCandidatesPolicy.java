package com.fvr.recommendation.similarity;

public final class SimilarityCandidatesPolicy {
    private final boolean refreshCache;
    private final boolean useCache;
    private final boolean requireFullCache;
    private final boolean allowCacheWrite;
    private final boolean allowCompute;

    public SimilarityCandidatesPolicy(
        boolean refreshCache,
        boolean useCache,
        boolean requireFullCache,
        boolean allowCacheWrite,
        boolean allowCompute
    ) {
        this.refreshCache = refreshCache;
        this.useCache = useCache;
        this.requireFullCache = requireFullCache;
        this.allowCacheWrite = allowCacheWrite;
        this.allowCompute = allowCompute;
    }

    public static SimilarityCandidatesPolicy defaults() {
        return new SimilarityCandidatesPolicy(false, true, true, true, true);
    }

    public SimilarityCachePolicy toCachePolicy() {
        return new SimilarityCachePolicy(refreshCache, requireFullCache, useCache, allowCacheWrite);
    }

    public boolean isRefreshCache() {
        return refreshCache;
    }

    public boolean isUseCache() {
        return useCache;
    }

    public boolean isRequireFullCache() {
        return requireFullCache;
    }

    public boolean isAllowCacheWrite() {
        return allowCacheWrite;
    }

    public boolean isAllowCompute() {
        return allowCompute;
    }
}
