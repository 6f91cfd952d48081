package com.fvr.recommendation.likes;

import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.video.VideoIdentity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class UserLikesRepository {
    private final JdbcTemplate jdbcTemplate;

    public UserLikesRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<LikeEvent> findRecentLikes(String userId, int limit) {
        if (userId == null || limit <= 0) {
            return List.of();
        }
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
            "SELECT video_id, video_uuid, instance_domain, updated_at FROM likes "
                + "WHERE user_id = ? ORDER BY updated_at DESC LIMIT ?",
            userId,
            limit
        );
        List<LikeEvent> likes = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            VideoIdentity video = new VideoIdentity(
                JdbcUtils.asString(row.get("video_id")),
                JdbcUtils.asString(row.get("instance_domain")),
                JdbcUtils.asString(row.get("video_uuid")),
                null,
                null
            );
            Long updatedAt = JdbcUtils.asLong(row.get("updated_at"));
            likes.add(new LikeEvent(userId, video, updatedAt == null ? 0L : updatedAt));
        }
        return likes;
    }

    /**
     * Upserts a like and trims the user's history to the newest {@code maxLikes}.
     */
    @Transactional
    public void recordLike(String userId, VideoIdentity video, long now, int maxLikes) {
        Integer users = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users WHERE user_id = ?", Integer.class, userId);
        if (users == null || users == 0) {
            jdbcTemplate.update(
                "INSERT INTO users (user_id, username, created_at) VALUES (?, ?, ?)", userId, userId, now);
        }
        int updated = jdbcTemplate.update(
            "UPDATE likes SET video_uuid = ?, updated_at = ? WHERE user_id = ? AND video_id = ? AND instance_domain = ?",
            video.getUuid(), now, userId, video.getVideoId(), video.getInstanceDomain());
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO likes (user_id, video_id, instance_domain, video_uuid, updated_at) VALUES (?, ?, ?, ?, ?)",
                userId, video.getVideoId(), video.getInstanceDomain(), video.getUuid(), now);
        }
        if (maxLikes > 0) {
            List<Long> stale = jdbcTemplate.queryForList(
                "SELECT updated_at FROM likes WHERE user_id = ? ORDER BY updated_at DESC LIMIT 1 OFFSET ?",
                Long.class, userId, maxLikes - 1);
            if (!stale.isEmpty()) {
                jdbcTemplate.update("DELETE FROM likes WHERE user_id = ? AND updated_at < ?", userId, stale.get(0));
            }
        }
    }
}
