package com.fvr.recommendation.ann;

import java.util.List;

/**
 * Approximate nearest-neighbour index over embedding rows. Results are ordered
 * by descending similarity; recall is not guaranteed.
 */
public interface VectorIndex {
    List<Neighbor> search(float[] query, int topK);

    int size();

    int dimension();
}
