package com.fvr.recommendation.likes;

import java.util.List;

/**
 * Where a request's likes come from. Created once at request entry and passed
 * down explicitly: either the persisted likes store, or a list supplied by the
 * client with the request.
 */
public final class LikesScope {
    private static final LikesScope STORE = new LikesScope(null);

    private final List<LikeEvent> clientLikes;

    private LikesScope(List<LikeEvent> clientLikes) {
        this.clientLikes = clientLikes;
    }

    public static LikesScope store() {
        return STORE;
    }

    public static LikesScope client(List<LikeEvent> likes) {
        return new LikesScope(likes == null ? List.of() : List.copyOf(likes));
    }

    public boolean isClientSupplied() {
        return clientLikes != null;
    }

    public List<LikeEvent> getClientLikes() {
        return clientLikes == null ? List.of() : clientLikes;
    }
}
