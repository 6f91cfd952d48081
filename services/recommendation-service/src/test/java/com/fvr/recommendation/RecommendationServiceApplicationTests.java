package com.fvr.recommendation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fvr.recommendation.ann.SimilarItem;
import com.fvr.recommendation.common.RecommendationRequestContextFilter;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.UserLikesRepository;
import com.fvr.recommendation.moderation.ModerationRepository;
import com.fvr.recommendation.similarity.SimilarityCacheRepository;
import com.fvr.recommendation.video.EmbeddingCodec;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.filter.RequestContextFilter;

@SpringBootTest
@AutoConfigureMockMvc
class RecommendationServiceApplicationTests {
    private static final List<String> TABLES = List.of(
        "videos",
        "channels",
        "video_embeddings",
        "users",
        "likes",
        "similarity_sources",
        "similarity_items",
        "random_rowids",
        "instance_denylist",
        "channel_moderation",
        "interaction_raw_events",
        "interaction_signals"
    );

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private SimilarityCacheRepository cacheRepository;

    @Autowired
    private UserLikesRepository likesRepository;

    @Autowired
    private ModerationRepository moderationRepository;

    @Autowired
    private VideoRepository videoRepository;

    @Autowired
    private ApplicationContext context;

    @BeforeEach
    void cleanTables() {
        for (String table : TABLES) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
    }

    @Test
    void healthReportsIndexState() throws Exception {
        mockMvc.perform(get("/health").header("x-request-id", "req-health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"))
            .andExpect(jsonPath("$.embeddings").value(0))
            .andExpect(jsonPath("$.request_id").value("req-health"));
    }

    @Test
    void similarityCacheReplacesWholeSet() {
        VideoIdentity source = new VideoIdentity("seed", "a.example");
        cacheRepository.replace(source, List.of(
            new SimilarItem(new VideoIdentity("v1", "b.example"), 0.9, 1),
            new SimilarItem(new VideoIdentity("v2", "b.example"), 0.8, 2),
            new SimilarItem(new VideoIdentity("v3", "c.example"), 0.7, 3)
        ), 1000L);
        cacheRepository.replace(source, List.of(
            new SimilarItem(new VideoIdentity("v4", "b.example"), 0.95, 1),
            new SimilarItem(new VideoIdentity("v1", "b.example"), 0.85, 2)
        ), 2000L);

        List<Map<String, Object>> rows = cacheRepository.findItems(source, 10);

        assertThat(rows).extracting(row -> row.get("similar_video_id")).containsExactly("v4", "v1");
        assertThat(cacheRepository.findComputedAt(source)).isEqualTo(2000L);
        assertThat(cacheRepository.hasItems(source)).isTrue();
        assertThat(cacheRepository.hasItems(new VideoIdentity("other", "a.example"))).isFalse();
    }

    @Test
    void likesHistoryIsTrimmedToNewest() {
        likesRepository.recordLike("u1", new VideoIdentity("a", "x.example", "uuid-a", null, null), 100L, 2);
        likesRepository.recordLike("u1", new VideoIdentity("b", "x.example", "uuid-b", null, null), 200L, 2);
        likesRepository.recordLike("u1", new VideoIdentity("c", "x.example", "uuid-c", null, null), 300L, 2);
        likesRepository.recordLike("u1", new VideoIdentity("b", "x.example", "uuid-b", null, null), 400L, 2);

        List<LikeEvent> likes = likesRepository.findRecentLikes("u1", 10);

        assertThat(likes).extracting(like -> like.getVideo().getVideoId()).containsExactly("b", "c");
        assertThat(likes.get(0).getUpdatedAt()).isEqualTo(400L);
    }

    @Test
    void moderationLookupsHonourActiveAndBlockedStatus() {
        jdbcTemplate.update("INSERT INTO instance_denylist (host, is_active) VALUES ('bad.example', 1)");
        jdbcTemplate.update("INSERT INTO instance_denylist (host, is_active) VALUES ('old.example', 0)");
        jdbcTemplate.update(
            "INSERT INTO channel_moderation (channel_id, instance_domain, status) VALUES ('spam', 'x.example', 'blocked')");
        jdbcTemplate.update(
            "INSERT INTO channel_moderation (channel_id, instance_domain, status) VALUES ('ok', 'x.example', 'allowed')");

        Set<String> denied = moderationRepository.findDeniedHosts(List.of("bad.example", "old.example", "x.example"));
        Set<String> blocked = moderationRepository.findBlockedChannels(List.of(
            new String[] {"spam", "x.example"},
            new String[] {"ok", "x.example"}
        ));

        assertThat(denied).containsExactly("bad.example");
        assertThat(blocked).containsExactly("spam::x.example");
    }

    @Test
    void eventIngestionIsIdempotentAndClampsSignals() throws Exception {
        String undo = "{\"event_id\":\"e1\",\"event_type\":\"UndoLike\","
            + "\"object\":{\"video_uuid\":\"uuid-a\",\"instance_domain\":\"x.example\"}}";
        String batch = "{\"events\":["
            + "{\"event_id\":\"e1\",\"event_type\":\"UndoLike\","
            + "\"object\":{\"video_uuid\":\"uuid-a\",\"instance_domain\":\"x.example\"}},"
            + "{\"event_id\":\"e2\",\"event_type\":\"Like\","
            + "\"object\":{\"video_uuid\":\"uuid-a\",\"instance_domain\":\"x.example\"}},"
            + "{\"event_id\":\"e3\",\"event_type\":\"Comment\","
            + "\"object\":{\"video_uuid\":\"uuid-a\",\"instance_domain\":\"x.example\"}}]}";

        mockMvc.perform(post("/internal/events/ingest").contentType(MediaType.APPLICATION_JSON).content(undo))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ingested").value(1));
        mockMvc.perform(post("/internal/events/ingest").contentType(MediaType.APPLICATION_JSON).content(batch))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(3))
            .andExpect(jsonPath("$.ingested").value(2))
            .andExpect(jsonPath("$.duplicates").value(1))
            .andExpect(jsonPath("$.results[0].duplicate").value(true));

        Map<String, Object> signals = jdbcTemplate.queryForMap(
            "SELECT likes_count, undo_likes_count, comments_count, signal_score FROM interaction_signals "
                + "WHERE video_uuid = 'uuid-a' AND instance_domain = 'x.example'");
        assertThat(((Number) signals.get("likes_count")).intValue()).isEqualTo(1);
        assertThat(((Number) signals.get("undo_likes_count")).intValue()).isEqualTo(1);
        assertThat(((Number) signals.get("comments_count")).intValue()).isEqualTo(1);
        assertThat(((Number) signals.get("signal_score")).doubleValue()).isEqualTo(1.25);
    }

    @Test
    void invalidEventInBatchWritesNothing() throws Exception {
        String batch = "{\"events\":["
            + "{\"event_id\":\"e1\",\"event_type\":\"Like\","
            + "\"object\":{\"video_uuid\":\"uuid-a\",\"instance_domain\":\"x.example\"}},"
            + "{\"event_id\":\"e2\",\"event_type\":\"Like\",\"object\":{\"video_uuid\":\"uuid-b\"}}]}";

        mockMvc.perform(post("/internal/events/ingest").contentType(MediaType.APPLICATION_JSON).content(batch))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("Missing object.instance_domain"));

        Integer stored = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM interaction_raw_events", Integer.class);
        assertThat(stored).isZero();
    }

    @Test
    void guestFeedServesModeratedRandomRows() throws Exception {
        long a = insertVideo("a", "x.example", "c1");
        long b = insertVideo("b", "x.example", "c2");
        long c = insertVideo("c", "y.example", "c3");
        long d = insertVideo("d", "bad.example", "c4");
        long[] rowIds = {a, b, c, d};
        for (int i = 0; i < rowIds.length; i++) {
            jdbcTemplate.update("INSERT INTO random_rowids (position, video_rowid) VALUES (?, ?)", i, rowIds[i]);
        }
        jdbcTemplate.update("INSERT INTO instance_denylist (host, is_active) VALUES ('bad.example', 1)");

        mockMvc.perform(post("/recommendations").contentType(MediaType.APPLICATION_JSON).content("{\"limit\":10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(3))
            .andExpect(jsonPath("$.seed.mode").value("home"))
            .andExpect(jsonPath("$.rows[0].rank").value(1));
    }

    @Test
    void requestFiltersRegisterAlongsideSpringDefaults() {
        assertThat(context.getBeansOfType(RecommendationRequestContextFilter.class)).hasSize(1);
        assertThat(context.getBean("requestContextFilter")).isInstanceOf(RequestContextFilter.class);
    }

    @Test
    void homeFeedModeratesBeforeCuttingToLimit() throws Exception {
        long a = insertVideo("a", "bad.example", "c1");
        long b = insertVideo("b", "x.example", "c2");
        long c = insertVideo("c", "y.example", "c3");
        long[] rowIds = {a, b, c};
        for (int i = 0; i < rowIds.length; i++) {
            jdbcTemplate.update("INSERT INTO random_rowids (position, video_rowid) VALUES (?, ?)", i, rowIds[i]);
        }
        jdbcTemplate.update("INSERT INTO instance_denylist (host, is_active) VALUES ('bad.example', 1)");

        mockMvc.perform(post("/recommendations").contentType(MediaType.APPLICATION_JSON).content("{\"limit\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(2))
            .andExpect(jsonPath("$.rows[0].video_id").value("b"))
            .andExpect(jsonPath("$.rows[1].video_id").value("c"))
            .andExpect(jsonPath("$.rows[0].video_uuid").value("uuid-b"))
            .andExpect(jsonPath("$.rows[0].channel_id").doesNotExist())
            .andExpect(jsonPath("$.rows[0].popularity").doesNotExist());
    }

    @Test
    void recentVideosAreNewestFirst() {
        insertVideo("old", "x.example", "c1", 1_000L);
        insertVideo("new", "x.example", "c2", 3_000L);
        insertVideo("mid", "x.example", "c3", 2_000L);

        List<CandidateRow> rows = videoRepository.findRecent(2, 0);

        assertThat(rows).extracting(CandidateRow::videoId).containsExactly("new", "mid");
    }

    @Test
    void unknownSeedIsNotFound() throws Exception {
        mockMvc.perform(get("/videos/missing/similar").param("host", "x.example"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"));
    }

    private long insertVideo(String videoId, String domain, String channelId) {
        return insertVideo(videoId, domain, channelId, 1_000L);
    }

    private long insertVideo(String videoId, String domain, String channelId, long publishedAt) {
        jdbcTemplate.update(
            "INSERT INTO videos (video_id, instance_domain, video_uuid, channel_id, title, views, likes, published_at) "
                + "VALUES (?, ?, ?, ?, ?, 10, 1, ?)",
            videoId,
            domain,
            "uuid-" + videoId,
            channelId,
            "Video " + videoId,
            publishedAt
        );
        jdbcTemplate.update(
            "INSERT INTO video_embeddings (video_id, instance_domain, embedding, embedding_dim) VALUES (?, ?, ?, 2)",
            videoId,
            domain,
            EmbeddingCodec.encode(new float[] {1f, 0f})
        );
        return jdbcTemplate.queryForObject(
            "SELECT id FROM video_embeddings WHERE video_id = ? AND instance_domain = ?", Long.class, videoId, domain);
    }
}
