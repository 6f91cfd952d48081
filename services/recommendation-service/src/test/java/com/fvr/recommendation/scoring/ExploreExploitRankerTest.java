package com.fvr.recommendation.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import com.fvr.recommendation.config.RecommendationProperties.Explore;
import com.fvr.recommendation.config.RecommendationProperties.Scoring;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.TestRows;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ExploreExploitRankerTest {
    private final ExploreExploitRanker ranker = new ExploreExploitRanker(new Random(11));

    @Test
    void zeroRatioKeepsScoreOrderAndRecordsRanks() {
        List<CandidateRow> ranked = ranker.scoreAndRank(List.of(
            TestRows.scored(1, "low", "x.example", "c1", 0.2),
            TestRows.scored(2, "high", "x.example", "c2", 0.9),
            TestRows.scored(3, "mid", "x.example", "c3", 0.5)
        ), new Scoring(), new Explore(), "upnext", 0L);

        assertThat(ranked).extracting(CandidateRow::videoId).containsExactly("high", "mid", "low");
        assertThat(ranked).extracting(CandidateRow::getRankBefore).containsExactly(1, 2, 3);
        assertThat(ranked).extracting(CandidateRow::getRankAfter).containsExactly(1, 2, 3);
        assertThat(ranked).extracting(CandidateRow::getLayer).containsOnly("upnext");
        assertThat(ranked).allSatisfy(row -> {
            assertThat(row.getPoolMin()).isEqualTo(0.2);
            assertThat(row.getPoolMax()).isEqualTo(0.9);
        });
    }

    @Test
    void ratioInterleavesExploreRows() {
        Explore explore = new Explore();
        explore.setRatio(0.5);
        explore.setSimilarityMin(0.0);
        explore.setSimilarityMax(0.5);

        List<CandidateRow> ranked = ranker.scoreAndRank(List.of(
            TestRows.scored(1, "e1", "x.example", "c1", 0.4),
            TestRows.scored(2, "x1", "x.example", "c2", 0.9),
            TestRows.scored(3, "x2", "x.example", "c3", 0.8),
            TestRows.scored(4, "e2", "x.example", "c4", 0.3)
        ), new Scoring(), explore, "upnext", 0L);

        assertThat(ranked).extracting(CandidateRow::videoId).containsExactly("x1", "e1", "e2", "x2");
        assertThat(ranked).extracting(CandidateRow::getBucket)
            .containsExactly("exploit", "explore", "explore", "exploit");
    }

    @Test
    void emptyExploreRangeIsFlagged() {
        Explore explore = new Explore();
        explore.setRatio(0.3);
        explore.setSimilarityMin(0.0);
        explore.setSimilarityMax(0.1);

        List<CandidateRow> ranked = ranker.scoreAndRank(List.of(
            TestRows.scored(1, "a", "x.example", "c1", 0.9),
            TestRows.scored(2, "b", "x.example", "c2", 0.8)
        ), new Scoring(), explore, "upnext", 0L);

        assertThat(ranked).extracting(CandidateRow::videoId).containsExactly("a", "b");
        assertThat(ranked).extracting(CandidateRow::getExploreEmpty).containsOnly(true);
    }

    @Test
    void jitterOnlyShufflesWithinWindows() {
        List<CandidateRow> rows = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            rows.add(TestRows.scored(i, "v" + i, "x.example", "c" + i, 1.0 - i * 0.1));
        }

        List<CandidateRow> jittered = ranker.jitter(rows, 3);

        assertThat(jittered.subList(0, 3)).containsExactlyInAnyOrderElementsOf(rows.subList(0, 3));
        assertThat(jittered.subList(3, 6)).containsExactlyInAnyOrderElementsOf(rows.subList(3, 6));
        assertThat(ranker.jitter(rows, 1)).containsExactlyElementsOf(rows);
    }

    @Test
    void fullRatioTakesOnlyExploreRows() {
        List<CandidateRow> explore = List.of(TestRows.row(1, "e", "x.example", "c1"));
        List<CandidateRow> exploit = List.of(TestRows.row(2, "x", "x.example", "c2"));

        assertThat(ExploreExploitRanker.mixByRatio(explore, exploit, 1.0, 5))
            .extracting(CandidateRow::videoId).containsExactly("e");
        assertThat(ExploreExploitRanker.mixByRatio(explore, exploit, 0.0, 5))
            .extracting(CandidateRow::videoId).containsExactly("x");
    }
}
