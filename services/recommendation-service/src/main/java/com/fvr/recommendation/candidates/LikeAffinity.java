package com.fvr.recommendation.candidates;

import com.fvr.recommendation.ann.VectorMath;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Affinity of candidates to the user's liked videos: the best cosine
 * similarity against any liked embedding, floored at zero.
 */
@Component
public class LikeAffinity {
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;

    public LikeAffinity(VideoRepository videoRepository, ResourceLocks locks) {
        this.videoRepository = videoRepository;
        this.locks = locks;
    }

    public List<float[]> likedVectors(List<LikeEvent> likes) {
        if (likes == null || likes.isEmpty()) {
            return List.of();
        }
        List<VideoIdentity> videos = new ArrayList<>(likes.size());
        for (LikeEvent like : likes) {
            videos.add(like.getVideo());
        }
        Map<String, float[]> embeddings = locks.withMetadata(() -> videoRepository.findEmbeddingsByKeys(videos));
        return normalizeAll(embeddings.values());
    }

    /**
     * Sets {@code affinity} and {@code similarityScore} on every row. Rows without
     * a stored embedding score zero.
     */
    public void annotate(List<CandidateRow> rows, List<float[]> likedVectors) {
        if (rows.isEmpty() || likedVectors.isEmpty()) {
            return;
        }
        List<VideoIdentity> videos = new ArrayList<>(rows.size());
        for (CandidateRow row : rows) {
            videos.add(row.identity());
        }
        Map<String, float[]> embeddings = locks.withMetadata(() -> videoRepository.findEmbeddingsByKeys(videos));
        for (CandidateRow row : rows) {
            float[] vector = embeddings.get(row.likeKey());
            float[] normalized = vector == null ? null : VectorMath.normalize(vector);
            double affinity = normalized == null ? 0.0 : VectorMath.maxSimilarity(normalized, likedVectors);
            row.setAffinity(affinity);
            row.setSimilarityScore(affinity);
        }
    }

    private static List<float[]> normalizeAll(Iterable<float[]> vectors) {
        List<float[]> out = new ArrayList<>();
        for (float[] vector : vectors) {
            float[] normalized = VectorMath.normalize(vector);
            if (normalized != null) {
                out.add(normalized);
            }
        }
        return out;
    }
}
