package com.fvr.recommendation.service;

import java.util.List;

/**
 * Related-videos request: either a seed video reference or a raw query vector.
 */
public class RelatedQuery {
    private final String videoId;
    private final String uuid;
    private final String host;
    private final float[] vector;
    private final String userId;
    private final Integer limit;
    private final List<ClientLike> likes;
    private final boolean refreshCache;
    private final boolean debug;

    public RelatedQuery(
        String videoId,
        String uuid,
        String host,
        float[] vector,
        String userId,
        Integer limit,
        List<ClientLike> likes,
        boolean refreshCache,
        boolean debug
    ) {
        this.videoId = videoId;
        this.uuid = uuid;
        this.host = host;
        this.vector = vector;
        this.userId = userId;
        this.limit = limit;
        this.likes = likes == null ? List.of() : likes;
        this.refreshCache = refreshCache;
        this.debug = debug;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getUuid() {
        return uuid;
    }

    public String getHost() {
        return host;
    }

    public float[] getVector() {
        return vector;
    }

    public String getUserId() {
        return userId;
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
