package com.fvr.recommendation.likes;

import com.fvr.recommendation.common.ResourceLocks;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class LikesService {
    private final UserLikesRepository repository;
    private final ResourceLocks locks;

    public LikesService(UserLikesRepository repository, ResourceLocks locks) {
        this.repository = repository;
        this.locks = locks;
    }

    /**
     * Newest-first likes for the user within the given scope, at most {@code limit}.
     */
    public List<LikeEvent> recentLikes(LikesScope scope, String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        if (scope != null && scope.isClientSupplied()) {
            List<LikeEvent> likes = scope.getClientLikes();
            return likes.size() > limit ? likes.subList(0, limit) : likes;
        }
        if (userId == null || userId.isBlank()) {
            return List.of();
        }
        return locks.withLikes(() -> repository.findRecentLikes(userId, limit));
    }
}
