package com.fvr.recommendation.similarity;

import com.fvr.recommendation.ann.SimilarItem;
import com.fvr.recommendation.video.VideoIdentity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class SimilarityCacheRepository {
    private final JdbcTemplate jdbcTemplate;

    public SimilarityCacheRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Map<String, Object>> findItems(VideoIdentity source, int limit) {
        return jdbcTemplate.queryForList(
            "SELECT similar_video_id, similar_instance_domain, score, item_rank FROM similarity_items "
                + "WHERE source_video_id = ? AND source_instance_domain = ? "
                + "ORDER BY item_rank ASC LIMIT ?",
            source.getVideoId(),
            source.getInstanceDomain(),
            limit
        );
    }

    public boolean hasItems(VideoIdentity source) {
        List<Integer> rows = jdbcTemplate.queryForList(
            "SELECT 1 FROM similarity_items WHERE source_video_id = ? AND source_instance_domain = ? LIMIT 1",
            Integer.class,
            source.getVideoId(),
            source.getInstanceDomain()
        );
        return !rows.isEmpty();
    }

    public Long findComputedAt(VideoIdentity source) {
        List<Long> rows = jdbcTemplate.queryForList(
            "SELECT computed_at FROM similarity_sources WHERE video_id = ? AND instance_domain = ?",
            Long.class,
            source.getVideoId(),
            source.getInstanceDomain()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Replaces the cached set for {@code source}; readers see either the old
     * set or the new one.
     */
    @Transactional
    public void replace(VideoIdentity source, List<SimilarItem> items, long computedAt) {
        int updated = jdbcTemplate.update(
            "UPDATE similarity_sources SET computed_at = ? WHERE video_id = ? AND instance_domain = ?",
            computedAt,
            source.getVideoId(),
            source.getInstanceDomain()
        );
        if (updated == 0) {
            jdbcTemplate.update(
                "INSERT INTO similarity_sources (video_id, instance_domain, computed_at) VALUES (?, ?, ?)",
                source.getVideoId(),
                source.getInstanceDomain(),
                computedAt
            );
        }
        jdbcTemplate.update(
            "DELETE FROM similarity_items WHERE source_video_id = ? AND source_instance_domain = ?",
            source.getVideoId(),
            source.getInstanceDomain()
        );
        if (items.isEmpty()) {
            return;
        }
        List<Object[]> batch = new ArrayList<>(items.size());
        for (SimilarItem item : items) {
            batch.add(new Object[] {
                source.getVideoId(),
                source.getInstanceDomain(),
                item.getVideo().getVideoId(),
                item.getVideo().getInstanceDomain(),
                item.getScore(),
                item.getRank()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO similarity_items (source_video_id, source_instance_domain, similar_video_id, "
                + "similar_instance_domain, score, item_rank) VALUES (?, ?, ?, ?, ?, ?)",
            batch
        );
    }
}
