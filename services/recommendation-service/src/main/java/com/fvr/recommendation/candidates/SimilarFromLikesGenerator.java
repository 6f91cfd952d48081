package com.fvr.recommendation.candidates;

import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.video.CandidateRow;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Primary source, then the fallback source, then the cached random pool, then
 * the raw random pool. Each stage runs only when every earlier one came back
 * empty.
 */
public class SimilarFromLikesGenerator {
    private static final Logger log = LoggerFactory.getLogger(SimilarFromLikesGenerator.class);

    private final SimilarFromLikesSource source;
    private final SimilarFromLikesSource fallbackSource;
    private final RandomVideoPool randomPool;

    public SimilarFromLikesGenerator(
        SimilarFromLikesSource source,
        SimilarFromLikesSource fallbackSource,
        RandomVideoPool randomPool
    ) {
        this.source = source;
        this.fallbackSource = fallbackSource;
        this.randomPool = randomPool;
    }

    public List<CandidateRow> getCandidates(LikesScope scope, String userId, int limit, boolean refreshCache) {
        List<CandidateRow> rows = tag(source.getCandidates(scope, userId, limit, refreshCache), source.name());
        if (!rows.isEmpty()) {
            return rows;
        }
        if (fallbackSource != null) {
            rows = tag(fallbackSource.getCandidates(scope, userId, limit, refreshCache), fallbackSource.name());
            if (!rows.isEmpty()) {
                log.info("likes_fallback stage=fallback_source source={} count={}", fallbackSource.name(), rows.size());
                return rows;
            }
        }
        if (randomPool == null) {
            return List.of();
        }
        rows = randomPool.fromCache(limit);
        if (!rows.isEmpty()) {
            log.info("likes_fallback stage=random_cache count={}", rows.size());
            return rows;
        }
        rows = randomPool.raw(limit);
        log.info("likes_fallback stage=random_raw count={}", rows.size());
        return rows;
    }

    private static List<CandidateRow> tag(List<CandidateRow> rows, String layer) {
        for (CandidateRow row : rows) {
            if (row.getLayer() == null) {
                row.setLayer(layer);
            }
        }
        return rows;
    }
}
