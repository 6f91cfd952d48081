package com.fvr.recommendation.personalize;

import com.fvr.recommendation.ann.VectorMath;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.likes.LikesService;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Reorders an already final list of related videos by blending the similarity
 * score with the user's affinity to each candidate. Never adds or drops rows.
 */
@Component
public class RelatedPersonalizationReranker {
    private final LikesService likesService;
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final RecommendationProperties properties;

    public RelatedPersonalizationReranker(
        LikesService likesService,
        VideoRepository videoRepository,
        ResourceLocks locks,
        RecommendationProperties properties
    ) {
        this.likesService = likesService;
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.properties = properties;
    }

    public List<CandidateRow> rerank(
        LikesScope scope,
        String userId,
        List<CandidateRow> candidates,
        double alpha,
        double beta
    ) {
        if (candidates == null || candidates.isEmpty() || userId == null || userId.isBlank()) {
            return candidates;
        }
        List<LikeEvent> likes = likesService.recentLikes(scope, userId, properties.getMaxLikes());
        if (likes.isEmpty()) {
            return candidates;
        }
        List<VideoIdentity> likedVideos = new ArrayList<>(likes.size());
        for (LikeEvent like : likes) {
            likedVideos.add(like.getVideo());
        }
        List<VideoIdentity> candidateVideos = new ArrayList<>(candidates.size());
        for (CandidateRow row : candidates) {
            candidateVideos.add(row.identity());
        }
        Map<String, float[]> likedEmbeddings = locks.withMetadata(
            () -> videoRepository.findEmbeddingsByKeys(likedVideos));
        Map<String, float[]> candidateEmbeddings = locks.withMetadata(
            () -> videoRepository.findEmbeddingsByKeys(candidateVideos));
        if (likedEmbeddings.isEmpty() || candidateEmbeddings.isEmpty()) {
            return candidates;
        }
        List<float[]> likedVectors = new ArrayList<>();
        for (float[] vector : likedEmbeddings.values()) {
            float[] normalized = VectorMath.normalize(vector);
            if (normalized != null) {
                likedVectors.add(normalized);
            }
        }
        if (likedVectors.isEmpty()) {
            return candidates;
        }
        return reorder(candidates, candidateEmbeddings, likedVectors, alpha, beta);
    }

    static List<CandidateRow> reorder(
        List<CandidateRow> candidates,
        Map<String, float[]> candidateEmbeddings,
        List<float[]> likedVectors,
        double alpha,
        double beta
    ) {
        List<Scored> scored = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            CandidateRow candidate = candidates.get(i);
            double affinity = 0.0;
            float[] vector = candidateEmbeddings.get(candidate.likeKey());
            float[] normalized = vector == null ? null : VectorMath.normalize(vector);
            if (normalized != null) {
                affinity = VectorMath.maxSimilarity(normalized, likedVectors);
            }
            double base = candidate.getScore() == null ? 0.0 : candidate.getScore();
            scored.add(new Scored(i, alpha * base + beta * affinity, affinity, candidate));
        }
        scored.sort(Comparator.comparingDouble((Scored s) -> -s.finalScore).thenComparingInt(s -> s.index));
        List<CandidateRow> out = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            Scored entry = scored.get(i);
            CandidateRow row = entry.row.copy();
            row.setAffinity(entry.affinity);
            row.setRankBefore(entry.index + 1);
            row.setRankAfter(i + 1);
            row.setRank(i + 1);
            out.add(row);
        }
        return out;
    }

    private static final class Scored {
        private final int index;
        private final double finalScore;
        private final double affinity;
        private final CandidateRow row;

        private Scored(int index, double finalScore, double affinity, CandidateRow row) {
            this.index = index;
            this.finalScore = finalScore;
            this.affinity = affinity;
            this.row = row;
        }
    }
}
