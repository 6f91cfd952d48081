package com.fvr.recommendation.candidates;

import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.video.CandidateRow;
import java.util.List;

/**
 * Candidates similar to a user's recent likes. Results never contain a liked
 * video or the same video twice; order is randomized.
 */
public interface SimilarFromLikesSource {
    String name();

    List<CandidateRow> getCandidates(LikesScope scope, String userId, int limit, boolean refreshCache);
}
