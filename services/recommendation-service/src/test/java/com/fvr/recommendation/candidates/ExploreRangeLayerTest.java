package com.fvr.recommendation.candidates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.TestRows;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExploreRangeLayerTest {
    static final Map<String, float[]> EMBEDDINGS = Map.of(
        "liked::x.example", new float[] {1f, 0f},
        "a::x.example", new float[] {1f, 0f},
        "b::x.example", new float[] {0.6f, 0.8f},
        "c::x.example", new float[] {0.8f, 0.6f},
        "d::x.example", new float[] {0f, 1f}
    );

    @Mock
    private RandomVideoPool randomPool;

    @Mock
    private VideoRepository videoRepository;

    private ExploreRangeLayer layer;

    @BeforeEach
    void setUp() {
        layer = new ExploreRangeLayer(randomPool, new LikeAffinity(videoRepository, new ResourceLocks()), new Random(3));
        lenient().when(videoRepository.findEmbeddingsByKeys(anyCollection()))
            .thenAnswer(invocation -> embeddingsFor(invocation.getArgument(0)));
    }

    @Test
    void guestsGetNothing() {
        LayerRequest guest = new LayerRequest(LikesScope.store(), null, List.of(), false, null);

        assertThat(layer.getCandidates(guest, 5, new Layer())).isEmpty();
        verifyNoInteractions(randomPool);
    }

    @Test
    void keepsOnlyRowsInsideTheSimilarityRange() {
        when(randomPool.sample(5)).thenReturn(pool());
        Layer settings = new Layer();
        settings.setSimilarityMin(0.5);
        settings.setSimilarityMax(0.95);

        List<CandidateRow> rows = layer.getCandidates(withLike(), 5, settings);

        assertThat(rows).extracting(CandidateRow::videoId).containsExactly("c", "b");
        assertThat(rows).extracting(CandidateRow::getExploreInRange).containsOnly(2);
        assertThat(rows).extracting(CandidateRow::getExplorePoolSize).containsOnly(4);
        assertThat(rows.get(0).getSimilarityScore()).isEqualTo(rows.get(0).getAffinity());
    }

    static LayerRequest withLike() {
        LikeEvent like = new LikeEvent("u1", new VideoIdentity("liked", "x.example"), 1L);
        return new LayerRequest(LikesScope.store(), "u1", List.of(like), false, null);
    }

    static List<CandidateRow> pool() {
        return List.of(
            TestRows.row(1, "a", "x.example", "c1"),
            TestRows.row(2, "b", "x.example", "c2"),
            TestRows.row(3, "c", "x.example", "c3"),
            TestRows.row(4, "d", "x.example", "c4")
        );
    }

    static Map<String, float[]> embeddingsFor(Collection<VideoIdentity> identities) {
        Map<String, float[]> out = new LinkedHashMap<>();
        for (VideoIdentity identity : identities) {
            float[] vector = EMBEDDINGS.get(identity.key());
            if (vector != null) {
                out.put(identity.key(), vector);
            }
        }
        return out;
    }
}
