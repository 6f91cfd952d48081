package com.fvr.recommendation.candidates;

import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Random fallback pools. The cached pool reads a precomputed shuffled list of
 * embedding row ids; the raw pool samples a window of row ids directly.
 */
@Component
public class RandomVideoPool {
    static final String LAYER = "random";

    private final RandomVideoRepository randomVideoRepository;
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final SimilarityProperties similarityProperties;
    private final Random random;

    public RandomVideoPool(
        RandomVideoRepository randomVideoRepository,
        VideoRepository videoRepository,
        ResourceLocks locks,
        SimilarityProperties similarityProperties,
        Random random
    ) {
        this.randomVideoRepository = randomVideoRepository;
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.similarityProperties = similarityProperties;
        this.random = random;
    }

    public List<CandidateRow> fromCache(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return locks.withMetadata(() -> {
            int total = randomVideoRepository.countCachedRowIds();
            if (total <= 0) {
                return List.<CandidateRow>of();
            }
            int offset = total <= limit ? 0 : random.nextInt(total - limit + 1);
            List<Long> rowIds = randomVideoRepository.findCachedRowIds(limit, offset);
            return resolve(rowIds);
        });
    }

    public List<CandidateRow> raw(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return locks.withMetadata(() -> {
            Map<String, Object> bounds = randomVideoRepository.findRowIdBounds();
            Long minId = JdbcUtils.asLong(bounds.get("min_id"));
            Long maxId = JdbcUtils.asLong(bounds.get("max_id"));
            if (minId == null || maxId == null) {
                return List.<CandidateRow>of();
            }
            long span = maxId - minId + 1;
            long startId = minId + (span <= 1 ? 0 : Math.floorMod(random.nextLong(), span));
            List<Long> rowIds = new ArrayList<>(randomVideoRepository.findRowIdWindow(startId, limit));
            Collections.shuffle(rowIds, random);
            return resolve(rowIds);
        });
    }

    /**
     * Cached pool first, raw pool when the cache is empty.
     */
    public List<CandidateRow> sample(int limit) {
        List<CandidateRow> rows = fromCache(limit);
        if (!rows.isEmpty()) {
            return rows;
        }
        return raw(limit);
    }

    private List<CandidateRow> resolve(List<Long> rowIds) {
        Map<Long, CandidateRow> metadata = videoRepository.findByRowIds(
            rowIds, similarityProperties.getVideoErrorThreshold());
        List<CandidateRow> rows = new ArrayList<>(rowIds.size());
        for (Long rowId : rowIds) {
            CandidateRow row = metadata.get(rowId);
            if (row != null) {
                CandidateRow copy = row.copy();
                copy.setLayer(LAYER);
                rows.add(copy);
            }
        }
        return rows;
    }
}
