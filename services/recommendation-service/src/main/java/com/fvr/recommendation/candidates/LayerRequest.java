package com.fvr.recommendation.candidates;

import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.LikesScope;
import java.util.List;

/**
 * Per-request inputs shared by every candidate layer.
 */
public class LayerRequest {
    private final LikesScope scope;
    private final String userId;
    private final List<LikeEvent> likes;
    private final boolean refreshCache;
    private final String similarSource;

    public LayerRequest(
        LikesScope scope,
        String userId,
        List<LikeEvent> likes,
        boolean refreshCache,
        String similarSource
    ) {
        this.scope = scope;
        this.userId = userId;
        this.likes = likes == null ? List.of() : likes;
        this.refreshCache = refreshCache;
        this.similarSource = similarSource;
    }

    public LikesScope getScope() {
        return scope;
    }

    public String getUserId() {
        return userId;
    }

    public List<LikeEvent> getLikes() {
        return likes;
    }

    public boolean hasLikes() {
        return !likes.isEmpty();
    }

    public boolean isRefreshCache() {
        return refreshCache;
    }

    public String getSimilarSource() {
        return similarSource;
    }
}
