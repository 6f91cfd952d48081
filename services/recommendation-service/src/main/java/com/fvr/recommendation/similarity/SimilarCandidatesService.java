package com.fvr.recommendation.similarity;

import com.fvr.recommendation.ann.AnnSimilaritySource;
import com.fvr.recommendation.ann.SimilarItem;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.SeedVideo;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Similar videos for one seed: cache first, ANN on a miss, then full metadata
 * rows with seed exclusion and author caps re-applied.
 */
@Service
public class SimilarCandidatesService {
    private static final Logger log = LoggerFactory.getLogger(SimilarCandidatesService.class);

    private final SimilarityCacheManager cacheManager;
    private final AnnSimilaritySource annSource;
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final SimilarityProperties properties;
    private final Clock clock;

    public SimilarCandidatesService(
        SimilarityCacheManager cacheManager,
        AnnSimilaritySource annSource,
        VideoRepository videoRepository,
        ResourceLocks locks,
        SimilarityProperties properties,
        Clock clock
    ) {
        this.cacheManager = cacheManager;
        this.annSource = annSource;
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.properties = properties;
        this.clock = clock;
    }

    public List<CandidateRow> getSimilarCandidates(SeedVideo seed, int limit, SimilarityCandidatesPolicy policy) {
        if (seed == null || seed.getEmbedding() == null || limit <= 0) {
            return List.of();
        }
        SimilarityCandidatesPolicy effective = policy == null ? SimilarityCandidatesPolicy.defaults() : policy;
        SimilarityCachePolicy cachePolicy = effective.toCachePolicy();
        VideoIdentity source = seed.getIdentity().getVideoId() == null ? null : seed.getIdentity();

        long totalStart = System.nanoTime();
        long cacheMs = 0;
        long computeMs = 0;
        List<SimilarItem> items = List.of();
        if (source != null && effective.isUseCache()) {
            long start = System.nanoTime();
            items = cacheManager.readCached(source, limit, cachePolicy);
            cacheMs = elapsedMs(start);
        }
        if (items.isEmpty()) {
            if (!effective.isAllowCompute()) {
                log.info("similar_cache_compute_disabled source={}", source == null ? "unknown" : source);
                return List.of();
            }
            long start = System.nanoTime();
            items = annSource.computeSimilarItems(seed, limit);
            computeMs = elapsedMs(start);
            if (source != null) {
                cacheManager.writeCache(source, items, clock.millis(), cachePolicy);
            }
        }
        if (items.isEmpty()) {
            return List.of();
        }

        long metaStart = System.nanoTime();
        List<VideoIdentity> keys = new ArrayList<>(items.size());
        for (SimilarItem item : items) {
            keys.add(item.getVideo());
        }
        Map<String, CandidateRow> metadata = locks.withMetadata(
            () -> videoRepository.findByKeys(keys, properties.getVideoErrorThreshold()));
        long metaMs = elapsedMs(metaStart);

        long filterStart = System.nanoTime();
        String sourceKey = source == null ? null : source.key();
        String sourceAuthor = properties.isExcludeSourceAuthor() ? seed.authorKey() : null;
        int authorLimit = properties.getMaxPerAuthor();
        Map<String, Integer> authorCounts = new HashMap<>();
        List<CandidateRow> rows = new ArrayList<>();
        for (SimilarItem item : items) {
            CandidateRow meta = metadata.get(item.getVideo().key());
            if (meta == null) {
                continue;
            }
            if (sourceKey != null && sourceKey.equals(meta.likeKey())) {
                continue;
            }
            String authorKey = meta.authorKey();
            if (sourceAuthor != null && Objects.equals(sourceAuthor, authorKey)) {
                continue;
            }
            if (authorLimit > 0 && authorKey != null) {
                if (authorCounts.getOrDefault(authorKey, 0) >= authorLimit) {
                    continue;
                }
                authorCounts.merge(authorKey, 1, Integer::sum);
            }
            CandidateRow row = meta.copy();
            row.setScore(item.getScore());
            row.setSimilarityScore(item.getScore());
            rows.add(row);
            if (rows.size() >= limit) {
                break;
            }
        }
        log.info(
            "similar_timing cache_ms={} compute_ms={} metadata_ms={} filter_ms={} total_ms={} candidates={} limit={}",
            cacheMs,
            computeMs,
            metaMs,
            elapsedMs(filterStart),
            elapsedMs(totalStart),
            rows.size(),
            limit
        );
        return rows;
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
