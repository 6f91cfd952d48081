package com.fvr.recommendation.candidates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.TestRows;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SimilarFromLikesGeneratorTest {
    private static final LikesScope SCOPE = LikesScope.store();

    @Mock
    private SimilarFromLikesSource primary;

    @Mock
    private SimilarFromLikesSource fallback;

    @Mock
    private RandomVideoPool randomPool;

    @Test
    void primaryResultsAreTaggedWithSourceName() {
        when(primary.name()).thenReturn("ann");
        when(primary.getCandidates(SCOPE, "u1", 5, false)).thenReturn(rows("a"));

        List<CandidateRow> rows = new SimilarFromLikesGenerator(primary, fallback, randomPool)
            .getCandidates(SCOPE, "u1", 5, false);

        assertThat(rows).extracting(CandidateRow::getLayer).containsExactly("ann");
        verifyNoInteractions(fallback, randomPool);
    }

    @Test
    void fallsBackToSecondSource() {
        when(primary.name()).thenReturn("cache-optimized");
        when(fallback.name()).thenReturn("ann");
        when(primary.getCandidates(SCOPE, "u1", 5, true)).thenReturn(List.of());
        when(fallback.getCandidates(SCOPE, "u1", 5, true)).thenReturn(rows("b"));

        List<CandidateRow> rows = new SimilarFromLikesGenerator(primary, fallback, randomPool)
            .getCandidates(SCOPE, "u1", 5, true);

        assertThat(rows).extracting(CandidateRow::videoId).containsExactly("b");
        assertThat(rows.get(0).getLayer()).isEqualTo("ann");
        verifyNoInteractions(randomPool);
    }

    @Test
    void fallsBackToCachedRandomPool() {
        when(primary.name()).thenReturn("ann");
        when(primary.getCandidates(SCOPE, null, 5, false)).thenReturn(List.of());
        when(randomPool.fromCache(5)).thenReturn(rows("r"));

        List<CandidateRow> rows = new SimilarFromLikesGenerator(primary, null, randomPool)
            .getCandidates(SCOPE, null, 5, false);

        assertThat(rows).extracting(CandidateRow::videoId).containsExactly("r");
    }

    @Test
    void rawRandomPoolIsTheLastResort() {
        when(primary.name()).thenReturn("ann");
        when(primary.getCandidates(SCOPE, null, 3, false)).thenReturn(List.of());
        when(randomPool.fromCache(3)).thenReturn(List.of());
        when(randomPool.raw(3)).thenReturn(rows("x", "y"));

        List<CandidateRow> rows = new SimilarFromLikesGenerator(primary, null, randomPool)
            .getCandidates(SCOPE, null, 3, false);

        assertThat(rows).hasSize(2);
        verify(randomPool).raw(3);
    }

    @Test
    void unknownSourceNameIsRejected() {
        when(primary.name()).thenReturn("ann");
        SimilarFromLikesSourceFactory factory = new SimilarFromLikesSourceFactory(List.of(primary));

        assertThat(factory.create(" ann ")).isSameAs(primary);
        assertThatThrownBy(() -> factory.create("graph"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("graph");
    }

    private static List<CandidateRow> rows(String... videoIds) {
        List<CandidateRow> rows = new ArrayList<>();
        long rowId = 1;
        for (String videoId : videoIds) {
            rows.add(TestRows.row(rowId++, videoId, "a.example", "c" + videoId));
        }
        return rows;
    }
}
