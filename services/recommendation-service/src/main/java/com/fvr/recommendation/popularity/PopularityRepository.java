package com.fvr.recommendation.popularity;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class PopularityRepository {
    private final JdbcTemplate jdbcTemplate;

    public PopularityRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Keyset page of videos after {@code (afterDomain, afterVideoId)}; pass nulls
     * for the first page.
     */
    public List<Map<String, Object>> listForScoring(
        boolean incrementalOnly,
        String afterDomain,
        String afterVideoId,
        int limit
    ) {
        StringBuilder sql = new StringBuilder()
            .append("SELECT video_id, instance_domain, views, likes, published_at FROM videos WHERE 1 = 1 ");
        List<Object> params = new ArrayList<>();
        if (incrementalOnly) {
            sql.append("AND (popularity IS NULL OR popularity = 0) ");
        }
        if (afterDomain != null && afterVideoId != null) {
            sql.append("AND (instance_domain > ? OR (instance_domain = ? AND video_id > ?)) ");
            params.add(afterDomain);
            params.add(afterDomain);
            params.add(afterVideoId);
        }
        sql.append("ORDER BY instance_domain ASC, video_id ASC LIMIT ?");
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), params.toArray());
    }

    public int updateScores(List<Object[]> updates) {
        if (updates.isEmpty()) {
            return 0;
        }
        int[] counts = jdbcTemplate.batchUpdate(
            "UPDATE videos SET popularity = ? WHERE video_id = ? AND instance_domain = ?",
            updates
        );
        int total = 0;
        for (int count : counts) {
            total += Math.max(count, 0);
        }
        return total;
    }

    /**
     * Embedding row ids of the most popular videos, with interaction signals
     * folded into the ordering.
     */
    public List<Long> findPopularRowIds(int limit, int errorThreshold) {
        StringBuilder sql = new StringBuilder()
            .append("SELECT e.id FROM videos v ")
            .append("JOIN video_embeddings e ON e.video_id = v.video_id AND e.instance_domain = v.instance_domain ")
            .append("LEFT JOIN interaction_signals sig ")
            .append("ON sig.video_uuid = v.video_uuid AND sig.instance_domain = v.instance_domain ");
        List<Object> params = new ArrayList<>();
        if (errorThreshold > 0) {
            sql.append("WHERE (v.error_count IS NULL OR v.error_count < ?) ");
            params.add(errorThreshold);
        }
        sql.append("ORDER BY (COALESCE(v.popularity, 0) + COALESCE(sig.signal_score, 0)) DESC, ")
            .append("(COALESCE(v.likes, 0) + COALESCE(sig.likes_count, 0) - COALESCE(sig.undo_likes_count, 0)) DESC, ")
            .append("COALESCE(v.views, 0) DESC, v.published_at DESC, v.video_id DESC ")
            .append("LIMIT ?");
        params.add(limit);
        return jdbcTemplate.queryForList(sql.toString(), Long.class, params.toArray());
    }
}
