package com.fvr.recommendation.similarity;

/**
 * Per-request cache controls. Never persisted.
 */
public final class SimilarityCachePolicy {
    private static final SimilarityCachePolicy DEFAULTS = new SimilarityCachePolicy(false, true, true, true);

    private final boolean refresh;
    private final boolean requireFull;
    private final boolean allowRead;
    private final boolean allowWrite;

    public SimilarityCachePolicy(boolean refresh, boolean requireFull, boolean allowRead, boolean allowWrite) {
        this.refresh = refresh;
        this.requireFull = requireFull;
        this.allowRead = allowRead;
        this.allowWrite = allowWrite;
    }

    public static SimilarityCachePolicy defaults() {
        return DEFAULTS;
    }

    public boolean isRefresh() {
        return refresh;
    }

    public boolean isRequireFull() {
        return requireFull;
    }

    public boolean isAllowRead() {
        return allowRead;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }
}
