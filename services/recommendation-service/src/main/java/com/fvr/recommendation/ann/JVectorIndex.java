package com.fvr.recommendation.ann;

import io.github.jbellis.jvector.graph.GraphIndexBuilder;
import io.github.jbellis.jvector.graph.GraphSearcher;
import io.github.jbellis.jvector.graph.ListRandomAccessVectorValues;
import io.github.jbellis.jvector.graph.RandomAccessVectorValues;
import io.github.jbellis.jvector.graph.SearchResult;
import io.github.jbellis.jvector.graph.similarity.BuildScoreProvider;
import io.github.jbellis.jvector.graph.similarity.SearchScoreProvider;
import io.github.jbellis.jvector.util.Bits;
import io.github.jbellis.jvector.vector.VectorSimilarityFunction;
import io.github.jbellis.jvector.vector.VectorizationProvider;
import io.github.jbellis.jvector.vector.types.VectorFloat;
import io.github.jbellis.jvector.vector.types.VectorTypeSupport;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory graph index. Node ordinals are positions in {@code rowIds}; the
 * graph does not own the vectors, so the base values are kept alongside it for
 * exact rescoring at search time.
 */
public class JVectorIndex implements VectorIndex {
    private static final VectorTypeSupport VTS = VectorizationProvider.getInstance().getVectorTypeSupport();

    private final long[] rowIds;
    private final int dimension;
    private final VectorSimilarityFunction similarityFunction;
    private final RandomAccessVectorValues ravv;
    private final GraphSearcher searcher;

    private JVectorIndex(
        long[] rowIds,
        int dimension,
        VectorSimilarityFunction similarityFunction,
        RandomAccessVectorValues ravv,
        GraphSearcher searcher
    ) {
        this.rowIds = rowIds;
        this.dimension = dimension;
        this.similarityFunction = similarityFunction;
        this.ravv = ravv;
        this.searcher = searcher;
    }

    public static JVectorIndex empty(int dimension, VectorSimilarityFunction similarityFunction) {
        return new JVectorIndex(new long[0], dimension, similarityFunction, null, null);
    }

    public static JVectorIndex build(
        List<Long> rowIds,
        List<float[]> vectors,
        VectorSimilarityFunction similarityFunction,
        int maxDegree,
        int beamWidth,
        float neighborOverflow,
        float alpha
    ) {
        if (rowIds.size() != vectors.size()) {
            throw new AnnIndexUnavailableException("row id count does not match vector count");
        }
        if (vectors.isEmpty()) {
            return empty(0, similarityFunction);
        }
        int dimension = vectors.get(0).length;
        List<VectorFloat<?>> base = new ArrayList<>(vectors.size());
        long[] ids = new long[rowIds.size()];
        for (int i = 0; i < vectors.size(); i++) {
            float[] vector = vectors.get(i);
            if (vector.length != dimension) {
                throw new AnnIndexUnavailableException(
                    "embedding row " + rowIds.get(i) + " has dimension " + vector.length + ", expected " + dimension);
            }
            base.add(VTS.createFloatVector(vector));
            ids[i] = rowIds.get(i);
        }
        RandomAccessVectorValues ravv = new ListRandomAccessVectorValues(base, dimension);
        BuildScoreProvider bsp = BuildScoreProvider.randomAccessScoreProvider(ravv, similarityFunction);
        try (GraphIndexBuilder builder = new GraphIndexBuilder(
            bsp, dimension, maxDegree, beamWidth, neighborOverflow, alpha)) {
            var graph = builder.build(ravv);
            return new JVectorIndex(ids, dimension, similarityFunction, ravv, new GraphSearcher(graph));
        } catch (AnnIndexUnavailableException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new AnnIndexUnavailableException("failed to build vector graph", ex);
        }
    }

    /**
     * Callers serialise access; the searcher keeps per-search scratch state.
     */
    @Override
    public List<Neighbor> search(float[] query, int topK) {
        if (searcher == null || topK <= 0) {
            return List.of();
        }
        if (query.length != dimension) {
            throw new IllegalArgumentException("query dimension " + query.length + " != index dimension " + dimension);
        }
        SearchScoreProvider ssp = SearchScoreProvider.exact(
            VTS.createFloatVector(query), similarityFunction, ravv);
        SearchResult result = searcher.search(ssp, Math.min(topK, rowIds.length), Bits.ALL);
        List<Neighbor> neighbors = new ArrayList<>(result.getNodes().length);
        for (SearchResult.NodeScore node : result.getNodes()) {
            neighbors.add(new Neighbor(rowIds[node.node], node.score));
        }
        return neighbors;
    }

    @Override
    public int size() {
        return rowIds.length;
    }

    @Override
    public int dimension() {
        return dimension;
    }
}
