package com.fvr.recommendation.ann;

import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.SeedVideo;
import com.fvr.recommendation.video.VideoKeys;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnnSimilaritySource {
    private static final Logger log = LoggerFactory.getLogger(AnnSimilaritySource.class);

    private final VectorIndex index;
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final SimilarityProperties properties;

    public AnnSimilaritySource(
        VectorIndex index,
        VideoRepository videoRepository,
        ResourceLocks locks,
        SimilarityProperties properties
    ) {
        this.index = index;
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.properties = properties;
    }

    /**
     * Nearest neighbours of the seed, excluding the seed itself and, when
     * configured, its author; at most {@code maxPerAuthor} per author.
     */
    public List<SimilarItem> computeSimilarItems(SeedVideo seed, int limit) {
        if (seed == null || seed.getEmbedding() == null || limit <= 0) {
            return List.of();
        }
        float[] query = queryVector(seed.getEmbedding());
        if (query == null) {
            return List.of();
        }
        int searchLimit = searchLimit(limit);
        List<Neighbor> neighbors = locks.withIndex(() -> index.search(query, searchLimit));
        List<Long> rowIds = new ArrayList<>(neighbors.size());
        for (Neighbor neighbor : neighbors) {
            if (neighbor.getRowId() > 0) {
                rowIds.add(neighbor.getRowId());
            }
        }
        Map<Long, CandidateRow> metadata = locks.withMetadata(
            () -> videoRepository.findByRowIds(rowIds, properties.getVideoErrorThreshold()));

        String sourceAuthor = properties.isExcludeSourceAuthor() ? seed.authorKey() : null;
        int authorLimit = properties.getMaxPerAuthor();
        Map<String, Integer> authorCounts = new HashMap<>();
        List<SimilarItem> items = new ArrayList<>();
        for (Neighbor neighbor : neighbors) {
            if (neighbor.getRowId() == seed.getRowId()) {
                continue;
            }
            CandidateRow row = metadata.get(neighbor.getRowId());
            if (row == null) {
                continue;
            }
            String authorKey = row.authorKey();
            if (sourceAuthor != null && Objects.equals(sourceAuthor, authorKey)) {
                continue;
            }
            if (authorLimit > 0 && authorKey != null && authorCounts.getOrDefault(authorKey, 0) >= authorLimit) {
                continue;
            }
            items.add(new SimilarItem(row.identity(), neighbor.getScore(), items.size() + 1));
            if (authorLimit > 0 && authorKey != null) {
                authorCounts.merge(authorKey, 1, Integer::sum);
            }
            if (items.size() >= limit) {
                break;
            }
        }
        log.info(
            "ann_candidates seed={} neighbors={} metadata={} accepted={} limit={}",
            VideoKeys.likeKey(seed.getIdentity().getVideoId(), seed.getIdentity().getInstanceDomain()),
            neighbors.size(),
            metadata.size(),
            items.size(),
            limit
        );
        return items;
    }

    /**
     * Raw vector search returning full metadata rows ranked by similarity.
     */
    public List<CandidateRow> searchByVector(float[] vector, int limit, Long excludeRowId) {
        if (limit <= 0 || index.size() == 0) {
            return List.of();
        }
        float[] query = queryVector(vector);
        if (query == null) {
            return List.of();
        }
        List<Neighbor> neighbors = locks.withIndex(() -> index.search(query, limit + 5));
        List<Long> rowIds = new ArrayList<>();
        List<Neighbor> kept = new ArrayList<>();
        for (Neighbor neighbor : neighbors) {
            if (excludeRowId != null && neighbor.getRowId() == excludeRowId) {
                continue;
            }
            if (rowIds.contains(neighbor.getRowId())) {
                continue;
            }
            rowIds.add(neighbor.getRowId());
            kept.add(neighbor);
            if (kept.size() >= limit) {
                break;
            }
        }
        Map<Long, CandidateRow> metadata = locks.withMetadata(
            () -> videoRepository.findByRowIds(rowIds, properties.getVideoErrorThreshold()));
        List<CandidateRow> rows = new ArrayList<>();
        for (Neighbor neighbor : kept) {
            CandidateRow row = metadata.get(neighbor.getRowId());
            if (row == null) {
                continue;
            }
            CandidateRow ranked = row.copy();
            ranked.setScore(neighbor.getScore());
            ranked.setSimilarityScore(neighbor.getScore());
            ranked.setRank(rows.size() + 1);
            ranked.setLayer("ann");
            rows.add(ranked);
        }
        return rows;
    }

    public int dimension() {
        return index.dimension();
    }

    public int size() {
        return index.size();
    }

    int searchLimit(int limit) {
        return Math.max(limit + 1, Math.max(properties.getSearchLimit(), 0));
    }

    private float[] queryVector(float[] vector) {
        if (!VectorMath.isFinite(vector)) {
            return null;
        }
        if (index.dimension() > 0 && vector.length != index.dimension()) {
            return null;
        }
        return properties.isNormalizeQueries() ? VectorMath.normalize(vector) : vector;
    }
}
