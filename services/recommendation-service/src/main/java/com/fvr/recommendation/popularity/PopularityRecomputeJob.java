package com.fvr.recommendation.popularity;

import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.config.PopularityProperties;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PopularityRecomputeJob {
    private static final Logger logger = LoggerFactory.getLogger(PopularityRecomputeJob.class);

    private final PopularityRepository repository;
    private final PopularityProperties properties;
    private final Clock clock;

    public PopularityRecomputeJob(PopularityRepository repository, PopularityProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
        fixedDelayString = "${popularity.job-delay-ms:3600000}",
        initialDelayString = "${popularity.job-initial-delay-ms:60000}"
    )
    public void scheduledRecompute() {
        if (!properties.isJobEnabled()) {
            return;
        }
        try {
            recompute(properties.isIncremental());
        } catch (DataAccessException ex) {
            Metrics.counter("recommendation.popularity.recompute.total", "outcome", "failed").increment();
            logger.error("popularity_recompute_failed error={}", ex.getMessage(), ex);
        }
    }

    /**
     * Scores every video, or only unscored ones when {@code incremental}.
     * Returns the number of rows updated.
     */
    public int recompute(boolean incremental) {
        int batchSize = Math.max(1, properties.getBatchSize());
        double likeWeight = properties.getLikeWeight();
        long now = clock.millis();
        int updated = 0;
        String afterDomain = null;
        String afterVideoId = null;
        while (true) {
            List<Map<String, Object>> rows = repository.listForScoring(incremental, afterDomain, afterVideoId, batchSize);
            if (rows.isEmpty()) {
                break;
            }
            List<Object[]> updates = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                double score = PopularityScorer.score(
                    JdbcUtils.asLong(row.get("views")),
                    JdbcUtils.asLong(row.get("likes")),
                    JdbcUtils.asLong(row.get("published_at")),
                    likeWeight,
                    now
                );
                updates.add(new Object[] {score, row.get("video_id"), row.get("instance_domain")});
            }
            updated += repository.updateScores(updates);
            Map<String, Object> last = rows.get(rows.size() - 1);
            afterDomain = JdbcUtils.asString(last.get("instance_domain"));
            afterVideoId = JdbcUtils.asString(last.get("video_id"));
            if (rows.size() < batchSize) {
                break;
            }
        }
        Metrics.counter("recommendation.popularity.recompute.total", "outcome", incremental ? "incremental" : "full")
            .increment();
        Metrics.counter("recommendation.popularity.rows.total").increment(updated);
        logger.info("popularity_recompute incremental={} updated={} like_weight={}", incremental, updated, likeWeight);
        return updated;
    }
}
