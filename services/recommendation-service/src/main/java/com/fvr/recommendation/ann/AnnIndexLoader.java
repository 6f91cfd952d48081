package com.fvr.recommendation.ann;

import com.fvr.recommendation.config.AnnProperties;
import com.fvr.recommendation.video.VideoRepository;
import io.github.jbellis.jvector.vector.VectorSimilarityFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

/**
 * Builds the vector index from stored embeddings at startup. Any failure here
 * aborts context refresh so the service never serves without an index.
 */
@Configuration
public class AnnIndexLoader {
    private static final Logger log = LoggerFactory.getLogger(AnnIndexLoader.class);

    @Bean
    public VectorIndex vectorIndex(VideoRepository videoRepository, AnnProperties properties) {
        VectorSimilarityFunction function = resolveFunction(properties.getSimilarityFunction());
        boolean normalize = function != VectorSimilarityFunction.EUCLIDEAN;
        List<Long> rowIds = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        int[] skipped = new int[1];
        long started = System.nanoTime();
        try {
            videoRepository.forEachEmbedding((rowId, vector) -> {
                float[] value = normalize ? VectorMath.normalize(vector) : vector;
                if (value == null) {
                    skipped[0]++;
                    return;
                }
                rowIds.add(rowId);
                vectors.add(value);
            });
        } catch (DataAccessException ex) {
            throw new AnnIndexUnavailableException("failed to read embeddings", ex);
        }
        if (vectors.isEmpty()) {
            log.warn("ann_index_empty skipped={}", skipped[0]);
            return JVectorIndex.empty(0, function);
        }
        JVectorIndex index = JVectorIndex.build(
            rowIds,
            vectors,
            function,
            properties.getMaxDegree(),
            properties.getBeamWidth(),
            properties.getNeighborOverflow(),
            properties.getAlpha()
        );
        log.info(
            "ann_index_loaded size={} dim={} function={} skipped={} took_ms={}",
            index.size(),
            index.dimension(),
            function,
            skipped[0],
            (System.nanoTime() - started) / 1_000_000L
        );
        return index;
    }

    static VectorSimilarityFunction resolveFunction(String name) {
        if (name == null || name.isBlank()) {
            return VectorSimilarityFunction.DOT_PRODUCT;
        }
        try {
            return VectorSimilarityFunction.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new AnnIndexUnavailableException("unknown similarity function: " + name, ex);
        }
    }
}
