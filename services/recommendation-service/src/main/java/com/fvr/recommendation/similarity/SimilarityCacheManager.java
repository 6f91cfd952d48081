package com.fvr.recommendation.similarity;

import com.fvr.recommendation.ann.SimilarItem;
import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.video.VideoIdentity;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Cache validity rules for similarity candidates. Storage failures degrade to
 * a miss on read and to no write on write.
 */
@Service
public class SimilarityCacheManager {
    private static final Logger log = LoggerFactory.getLogger(SimilarityCacheManager.class);

    private final SimilarityCacheRepository repository;

    public SimilarityCacheManager(SimilarityCacheRepository repository) {
        this.repository = repository;
    }

    public List<SimilarItem> readCached(VideoIdentity source, int limit, SimilarityCachePolicy policy) {
        if (source == null || limit <= 0 || !policy.isAllowRead() || policy.isRefresh()) {
            return List.of();
        }
        List<Map<String, Object>> rows;
        try {
            rows = repository.findItems(source, limit);
        } catch (DataAccessException ex) {
            log.warn("similar_cache_read_failed source={} error={}", source, ex.getMessage());
            return List.of();
        }
        if (rows.isEmpty()) {
            log.info("similar_cache_miss reason=empty source={} limit={}", source, limit);
            recordOutcome("miss");
            return List.of();
        }
        List<SimilarItem> items = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Double score = JdbcUtils.asDouble(row.get("score"));
            if (score == null || !Double.isFinite(score)) {
                log.info("similar_cache_miss reason=invalid_score source={} count={}", source, rows.size());
                recordOutcome("miss");
                return List.of();
            }
            Integer rank = JdbcUtils.asInt(row.get("item_rank"));
            VideoIdentity video = new VideoIdentity(
                JdbcUtils.asString(row.get("similar_video_id")),
                JdbcUtils.asString(row.get("similar_instance_domain"))
            );
            items.add(new SimilarItem(video, score, rank == null ? items.size() + 1 : rank));
        }
        if (policy.isRequireFull() && items.size() != limit) {
            log.info(
                "similar_cache_miss reason=partial source={} count={} limit={}", source, items.size(), limit);
            recordOutcome("miss");
            return List.of();
        }
        log.info("similar_cache_hit source={} count={} limit={}", source, items.size(), limit);
        recordOutcome("hit");
        return items;
    }

    public boolean shouldWrite(VideoIdentity source, SimilarityCachePolicy policy) {
        if (source == null || !policy.isAllowWrite()) {
            return false;
        }
        if (policy.isRefresh()) {
            return true;
        }
        try {
            return !repository.hasItems(source);
        } catch (DataAccessException ex) {
            log.warn("similar_cache_lookup_failed source={} error={}", source, ex.getMessage());
            return false;
        }
    }

    public void writeCache(VideoIdentity source, List<SimilarItem> items, long computedAt, SimilarityCachePolicy policy) {
        if (!shouldWrite(source, policy)) {
            return;
        }
        try {
            repository.replace(source, items, computedAt);
            log.info("similar_cache_write source={} count={}", source, items.size());
        } catch (DataAccessException ex) {
            log.warn("similar_cache_write_failed source={} error={}", source, ex.getMessage());
        }
    }

    private void recordOutcome(String outcome) {
        Metrics.counter("recommendation.similarity_cache.requests.total", "outcome", outcome).increment();
    }
}
