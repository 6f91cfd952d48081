package com.fvr.recommendation.candidates;

import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.video.CandidateRow;
import java.util.List;

/**
 * One named source of home-feed candidates. Profiles reference layers by
 * {@link #name()} and the mixer asks each for at most {@code limit} rows.
 */
public interface CandidateLayer {
    String name();

    List<CandidateRow> getCandidates(LayerRequest request, int limit, Layer settings);
}
