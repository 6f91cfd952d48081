package com.fvr.recommendation.candidates;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RandomVideoRepository {
    private final JdbcTemplate jdbcTemplate;

    public RandomVideoRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public int countCachedRowIds() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM random_rowids", Integer.class);
        return count == null ? 0 : count;
    }

    public List<Long> findCachedRowIds(int limit, int offset) {
        return jdbcTemplate.queryForList(
            "SELECT video_rowid FROM random_rowids ORDER BY position ASC LIMIT ? OFFSET ?",
            Long.class,
            limit,
            offset
        );
    }

    public Map<String, Object> findRowIdBounds() {
        return jdbcTemplate.queryForMap("SELECT MIN(id) AS min_id, MAX(id) AS max_id FROM video_embeddings");
    }

    /**
     * Up to {@code limit} row ids starting at {@code startId}, wrapping around to
     * the lowest ids when the tail is short.
     */
    public List<Long> findRowIdWindow(long startId, int limit) {
        List<Long> ids = new ArrayList<>(jdbcTemplate.queryForList(
            "SELECT id FROM video_embeddings WHERE id >= ? ORDER BY id ASC LIMIT ?",
            Long.class,
            startId,
            limit
        ));
        if (ids.size() < limit) {
            ids.addAll(jdbcTemplate.queryForList(
                "SELECT id FROM video_embeddings WHERE id < ? ORDER BY id ASC LIMIT ?",
                Long.class,
                startId,
                limit - ids.size()
            ));
        }
        return ids;
    }
}
