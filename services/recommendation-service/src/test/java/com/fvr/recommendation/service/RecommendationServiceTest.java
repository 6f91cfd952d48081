package com.fvr.recommendation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fvr.recommendation.ann.AnnSimilaritySource;
import com.fvr.recommendation.candidates.RandomVideoPool;
import com.fvr.recommendation.common.ApiException;
import com.fvr.recommendation.common.NotFoundException;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.common.ValidationException;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.LikesService;
import com.fvr.recommendation.mixer.LayeredCandidateMixer;
import com.fvr.recommendation.moderation.ModerationFilter;
import com.fvr.recommendation.moderation.ModerationFilterStats;
import com.fvr.recommendation.moderation.ModerationResult;
import com.fvr.recommendation.personalize.RelatedPersonalizationReranker;
import com.fvr.recommendation.popularity.PopularVideosSource;
import com.fvr.recommendation.scoring.ExploreExploitRanker;
import com.fvr.recommendation.similarity.SimilarCandidatesService;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.SeedVideo;
import com.fvr.recommendation.video.TestRows;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class RecommendationServiceTest {
    @Mock
    private LayeredCandidateMixer mixer;
    @Mock
    private RandomVideoPool randomPool;
    @Mock
    private PopularVideosSource popularSource;
    @Mock
    private SimilarCandidatesService similarCandidatesService;
    @Mock
    private AnnSimilaritySource annSource;
    @Mock
    private RelatedPersonalizationReranker reranker;
    @Mock
    private ModerationFilter moderationFilter;
    @Mock
    private LikesService likesService;
    @Mock
    private VideoRepository videoRepository;

    private RecommendationProperties properties;
    private RecommendationService service;

    @BeforeEach
    void setUp() {
        properties = new RecommendationProperties();
        properties.setDefaultLimit(5);
        properties.setMaxLimit(10);
        service = new RecommendationService(
            properties,
            new SimilarityProperties(),
            mixer,
            new ExploreExploitRanker(new Random(7)),
            randomPool,
            popularSource,
            similarCandidatesService,
            annSource,
            reranker,
            moderationFilter,
            likesService,
            videoRepository,
            new ResourceLocks(),
            Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC)
        );
        lenient().when(moderationFilter.filter(anyList())).thenAnswer(
            invocation -> new ModerationResult(new ArrayList<>(invocation.getArgument(0)), ModerationFilterStats.none()));
    }

    @Test
    void debugIsForbiddenUnlessEnabled() {
        assertThatThrownBy(() -> service.recommend(new RecommendationQuery("u1", null, 5, null, false, true)))
            .isInstanceOfSatisfying(ApiException.class, ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    void homeFeedUsesMixedCandidatesWithRanks() {
        when(likesService.recentLikes(any(), eq("u1"), eq(100))).thenReturn(List.of());
        when(mixer.mix(any(), any(), eq("default"), eq(3), anySet())).thenReturn(List.of(
            TestRows.row(1, "a", "x.example", "c1"),
            TestRows.row(2, "b", "x.example", "c2"),
            TestRows.row(3, "c", "y.example", "c3")
        ));

        RecommendationResult result = service.recommend(new RecommendationQuery("u1", null, 3, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("a", "b", "c");
        assertThat(result.getRows()).extracting(CandidateRow::getRank).containsExactly(1, 2, 3);
        assertThat(result.getRows()).extracting(CandidateRow::getProfile).containsOnly("default");
        assertThat(result.getSeed()).containsEntry("mode", "home").doesNotContainKey("random");
    }

    @Test
    void emptyFeedFallsBackToRandomRows() {
        when(likesService.recentLikes(any(), isNull(), eq(100))).thenReturn(List.of());
        when(mixer.mix(any(), any(), any(), eq(4), anySet())).thenReturn(List.of());
        when(randomPool.sample(4)).thenReturn(List.of(TestRows.row(9, "r", "x.example", "c9")));

        RecommendationResult result = service.recommend(new RecommendationQuery(null, "home", 4, null, false, false));

        assertThat(result.getSeed()).containsEntry("random", true);
        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("r");
    }

    @Test
    void randomFallbackNeverReturnsLikedVideo() {
        when(likesService.recentLikes(any(), eq("u1"), eq(100))).thenReturn(List.of(like("a")));
        when(mixer.mix(any(), any(), any(), eq(4), anySet())).thenReturn(List.of());
        when(randomPool.sample(4)).thenReturn(List.of(
            TestRows.row(1, "a", "x.example", "c1"),
            TestRows.row(9, "r", "x.example", "c9")
        ));

        RecommendationResult result = service.recommend(new RecommendationQuery("u1", "home", 4, null, false, false));

        assertThat(result.getSeed()).containsEntry("random", true);
        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("r");
    }

    @Test
    void homeFeedModeratesBeforeCuttingToLimit() {
        when(likesService.recentLikes(any(), eq("u1"), eq(100))).thenReturn(List.of());
        when(mixer.mix(any(), any(), any(), eq(2), anySet())).thenReturn(List.of(
            TestRows.row(1, "a", "blocked.example", "c1"),
            TestRows.row(2, "b", "x.example", "c2"),
            TestRows.row(3, "c", "y.example", "c3")
        ));
        blockInstance("blocked.example");

        RecommendationResult result = service.recommend(new RecommendationQuery("u1", null, 2, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("b", "c");
        assertThat(result.getRows()).extracting(CandidateRow::getRank).containsExactly(1, 2);
    }

    @Test
    void vectorWithWrongDimensionIsRejected() {
        when(annSource.dimension()).thenReturn(3);

        assertThatThrownBy(() -> service.related(vectorQuery(new float[] {1f, 0f})))
            .isInstanceOf(ValidationException.class);
        verify(annSource, never()).searchByVector(any(), anyInt(), any());
    }

    @Test
    void nonFiniteVectorIsRejected() {
        assertThatThrownBy(() -> service.related(vectorQuery(new float[] {Float.NaN, 1f})))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid vector parameter");
    }

    @Test
    void zeroVectorReturnsRandomRows() {
        when(randomPool.sample(5)).thenReturn(List.of(TestRows.row(9, "r", "x.example", "c9")));

        RecommendationResult result = service.related(vectorQuery(new float[] {0f, 0f}));

        assertThat(result.getSeed()).containsEntry("vector", "zero");
        assertThat(result.getRows()).hasSize(1);
    }

    @Test
    void vectorSearchReturnsNeighbours() {
        when(annSource.dimension()).thenReturn(2);
        when(annSource.searchByVector(any(), eq(5), isNull())).thenReturn(List.of(TestRows.scored(4, "n", "x.example", "c", 0.9)));

        RecommendationResult result = service.related(vectorQuery(new float[] {0.6f, 0.8f}));

        assertThat(result.getSeed()).containsEntry("vector", true);
        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("n");
    }

    @Test
    void relatedWithoutReferenceIsRejected() {
        assertThatThrownBy(() -> service.related(new RelatedQuery(null, " ", null, null, null, null, null, false, false)))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Missing vector or video reference");
    }

    @Test
    void unknownSeedIsNotFound() {
        when(videoRepository.resolveIdentity("v404", null, "x.example")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.related(
            new RelatedQuery("v404", null, "x.example", null, null, 5, null, false, false)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void relatedExcludesSeedAndDescribesIt() {
        SeedVideo seed = stubSeed();
        when(likesService.recentLikes(any(), isNull(), eq(100))).thenReturn(List.of());
        when(similarCandidatesService.getSimilarCandidates(eq(seed), eq(20), any())).thenReturn(List.of(
            TestRows.scored(1, "s", "x.example", "c0", 1.0),
            TestRows.scored(2, "t", "x.example", "c1", 0.8),
            TestRows.scored(3, "u", "y.example", "c2", 0.7)
        ));

        RecommendationResult result = service.related(
            new RelatedQuery("s", null, "x.example", null, null, 5, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("t", "u");
        assertThat(result.getSeed())
            .containsEntry("video_id", "s")
            .containsEntry("channel_id", "c0")
            .containsEntry("mode", "upnext");
    }

    @Test
    void relatedRowsCarrySimilarityPoolBounds() {
        SeedVideo seed = stubSeed();
        when(likesService.recentLikes(any(), isNull(), eq(100))).thenReturn(List.of());
        when(similarCandidatesService.getSimilarCandidates(eq(seed), eq(20), any())).thenReturn(List.of(
            TestRows.scored(2, "t", "x.example", "c1", 0.4),
            TestRows.scored(3, "u", "y.example", "c2", 0.9)
        ));

        RecommendationResult result = service.related(
            new RelatedQuery("s", null, "x.example", null, null, 5, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("u", "t");
        assertThat(result.getRows()).allSatisfy(row -> {
            assertThat(row.getPoolMin()).isEqualTo(0.4);
            assertThat(row.getPoolMax()).isEqualTo(0.9);
            assertThat(row.getBucket()).isEqualTo("exploit");
        });
        assertThat(result.getRows()).extracting(CandidateRow::getRankBefore).containsExactly(1, 2);
    }

    @Test
    void relatedNeverReturnsLikedVideos() {
        SeedVideo seed = stubSeed();
        when(likesService.recentLikes(any(), eq("u1"), eq(100))).thenReturn(List.of(like("t")));
        when(similarCandidatesService.getSimilarCandidates(eq(seed), eq(20), any())).thenReturn(List.of(
            TestRows.scored(2, "t", "x.example", "c1", 0.8),
            TestRows.scored(3, "u", "y.example", "c2", 0.7)
        ));

        RecommendationResult result = service.related(
            new RelatedQuery("s", null, "x.example", null, "u1", 5, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("u");
    }

    @Test
    void relatedRequestsSimilarPerLikeThenCutsToLimit() {
        SeedVideo seed = stubSeed();
        properties.setSimilarPerLike(6);
        when(likesService.recentLikes(any(), isNull(), eq(100))).thenReturn(List.of());
        when(similarCandidatesService.getSimilarCandidates(eq(seed), eq(6), any())).thenReturn(List.of(
            TestRows.scored(2, "t", "x.example", "c1", 0.9),
            TestRows.scored(3, "u", "y.example", "c2", 0.8),
            TestRows.scored(4, "w", "z.example", "c3", 0.7)
        ));

        RecommendationResult result = service.related(
            new RelatedQuery("s", null, "x.example", null, null, 2, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("t", "u");
        verify(similarCandidatesService).getSimilarCandidates(eq(seed), eq(6), any());
    }

    @Test
    void relatedModeratesBeforeCuttingToLimit() {
        SeedVideo seed = stubSeed();
        when(likesService.recentLikes(any(), isNull(), eq(100))).thenReturn(List.of());
        when(similarCandidatesService.getSimilarCandidates(eq(seed), eq(20), any())).thenReturn(List.of(
            TestRows.scored(2, "t", "blocked.example", "c1", 0.9),
            TestRows.scored(3, "u", "y.example", "c2", 0.8),
            TestRows.scored(4, "w", "z.example", "c3", 0.7)
        ));
        blockInstance("blocked.example");

        RecommendationResult result = service.related(
            new RelatedQuery("s", null, "x.example", null, null, 2, null, false, false));

        assertThat(result.getRows()).extracting(CandidateRow::videoId).containsExactly("u", "w");
    }

    @Test
    void limitIsDefaultedAndClamped() {
        assertThat(service.resolveLimit(null)).isEqualTo(5);
        assertThat(service.resolveLimit(0)).isEqualTo(5);
        assertThat(service.resolveLimit(50)).isEqualTo(10);
        assertThat(service.resolveLimit(7)).isEqualTo(7);
    }

    @Test
    void clientLikesAreIgnoredUnlessEnabled() {
        assertThat(service.resolveScope(List.of(new ClientLike("u", "x.example"))).isClientSupplied()).isFalse();

        properties.setUseClientLikes(true);
        when(videoRepository.resolveByUuids(anyList())).thenReturn(List.of(new VideoIdentity("v1", "x.example")));

        assertThat(service.resolveScope(List.of(
            new ClientLike("u", "x.example"),
            new ClientLike("u", "x.example"),
            new ClientLike(null, "x.example")
        )).getClientLikes()).hasSize(1);
    }

    private SeedVideo stubSeed() {
        VideoIdentity identity = new VideoIdentity("s", "x.example", "uuid-s", "c0", "Seed");
        SeedVideo seed = new SeedVideo(1L, identity, new float[] {1f, 0f});
        when(videoRepository.resolveIdentity("s", null, "x.example")).thenReturn(Optional.of(identity));
        when(videoRepository.findSeed(identity)).thenReturn(Optional.of(seed));
        return seed;
    }

    private void blockInstance(String domain) {
        doAnswer(invocation -> {
            List<CandidateRow> rows = new ArrayList<>();
            for (CandidateRow row : invocation.<List<CandidateRow>>getArgument(0)) {
                if (!domain.equals(row.instanceDomain())) {
                    rows.add(row);
                }
            }
            return new ModerationResult(rows, ModerationFilterStats.none());
        }).when(moderationFilter).filter(anyList());
    }

    private static LikeEvent like(String videoId) {
        return new LikeEvent("u1", new VideoIdentity(videoId, "x.example"), 1L);
    }

    private static RelatedQuery vectorQuery(float[] vector) {
        return new RelatedQuery(null, null, null, vector, null, null, null, false, false);
    }
}
