package com.fvr.recommendation.service;

import java.util.List;

/**
 * Home feed request.
 */
public class RecommendationQuery {
    private final String userId;
    private final String mode;
    private final Integer limit;
    private final List<ClientLike> likes;
    private final boolean refreshCache;
    private final boolean debug;

    public RecommendationQuery(
        String userId,
        String mode,
        Integer limit,
        List<ClientLike> likes,
        boolean refreshCache,
        boolean debug
    ) {
        this.userId = userId;
        this.mode = mode;
        this.limit = limit;
        this.likes = likes == null ? List.of() : likes;
        this.refreshCache = refreshCache;
        this.debug = debug;
    }

    public String getUserId() {
        return userId;
    }

    public String getMode() {
        return mode;
    }

    public Integer getLimit() {
        return limit;
    }

    public List<ClientLike> getLikes() {
        return likes;
    }

    public boolean isRefreshCache() {
        return refreshCache;
    }

    public boolean isDebug() {
        return debug;
    }
}
