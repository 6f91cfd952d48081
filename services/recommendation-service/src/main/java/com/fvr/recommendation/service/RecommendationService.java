package com.fvr.recommendation.service;

import com.fvr.recommendation.ann.AnnSimilaritySource;
import com.fvr.recommendation.ann.VectorMath;
import com.fvr.recommendation.candidates.LayerRequest;
import com.fvr.recommendation.candidates.RandomVideoPool;
import com.fvr.recommendation.common.ApiException;
import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.common.NotFoundException;
import com.fvr.recommendation.common.RequestContextHolder;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.common.ValidationException;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.config.RecommendationProperties.Profile;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.diversify.DiversificationFilter;
import com.fvr.recommendation.diversify.DiversificationState;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.likes.LikesService;
import com.fvr.recommendation.mixer.LayeredCandidateMixer;
import com.fvr.recommendation.moderation.ModerationFilter;
import com.fvr.recommendation.personalize.RelatedPersonalizationReranker;
import com.fvr.recommendation.popularity.PopularVideosSource;
import com.fvr.recommendation.scoring.ExploreExploitRanker;
import com.fvr.recommendation.similarity.SimilarCandidatesService;
import com.fvr.recommendation.similarity.SimilarityCandidatesPolicy;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.SeedVideo;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoKeys;
import com.fvr.recommendation.video.VideoRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final String MODE_HOME = "home";
    static final String MODE_UPNEXT = "upnext";

    private final RecommendationProperties properties;
    private final SimilarityProperties similarityProperties;
    private final LayeredCandidateMixer mixer;
    private final ExploreExploitRanker ranker;
    private final RandomVideoPool randomPool;
    private final PopularVideosSource popularSource;
    private final SimilarCandidatesService similarCandidatesService;
    private final AnnSimilaritySource annSource;
    private final RelatedPersonalizationReranker reranker;
    private final ModerationFilter moderationFilter;
    private final LikesService likesService;
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final Clock clock;

    public RecommendationService(
        RecommendationProperties properties,
        SimilarityProperties similarityProperties,
        LayeredCandidateMixer mixer,
        ExploreExploitRanker ranker,
        RandomVideoPool randomPool,
        PopularVideosSource popularSource,
        SimilarCandidatesService similarCandidatesService,
        AnnSimilaritySource annSource,
        RelatedPersonalizationReranker reranker,
        ModerationFilter moderationFilter,
        LikesService likesService,
        VideoRepository videoRepository,
        ResourceLocks locks,
        Clock clock
    ) {
        this.properties = properties;
        this.similarityProperties = similarityProperties;
        this.mixer = mixer;
        this.ranker = ranker;
        this.randomPool = randomPool;
        this.popularSource = popularSource;
        this.similarCandidatesService = similarCandidatesService;
        this.annSource = annSource;
        this.reranker = reranker;
        this.moderationFilter = moderationFilter;
        this.likesService = likesService;
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.clock = clock;
    }

    /**
     * Home feed: the profile's layers mixed into one batch, diversified,
     * optionally backfilled with popular videos, then moderated and cut to the
     * limit. Liked videos are excluded at every stage.
     */
    public RecommendationResult recommend(RecommendationQuery query) {
        long startedAt = System.nanoTime();
        boolean includeDebug = checkDebug(query.isDebug());
        int limit = resolveLimit(query.getLimit());
        String userId = JdbcUtils.trimToNull(query.getUserId());
        String mode = query.getMode() == null || query.getMode().isBlank() ? MODE_HOME : query.getMode().trim();
        LikesScope scope = resolveScope(query.getLikes());

        List<LikeEvent> likes = likesService.recentLikes(scope, userId, properties.getMaxLikes());
        ResolvedProfile resolved = ProfileResolver.resolve(
            properties.getProfiles(), properties.getDefaultProfile(), mode, !likes.isEmpty());
        Profile profile = resolved.getProfile();
        boolean refresh = query.isRefreshCache() || properties.isRefreshCache();

        int batch = Math.max(limit, profile.getBatchSize());
        Set<String> liked = likedKeys(likes);
        LayerRequest layerRequest = new LayerRequest(scope, userId, likes, refresh, profile.getSimilarSource());
        List<CandidateRow> candidates = mixer.mix(layerRequest, profile, resolved.getName(), batch, liked);

        DiversificationState state = new DiversificationState();
        state.markSeen(liked);
        List<CandidateRow> rows = new ArrayList<>(DiversificationFilter.apply(
            candidates, profile.getMaxPerAuthor(), profile.getMaxPerInstance(), true, 0, state));

        if (profile.isBackfillPopular() && rows.size() < batch) {
            List<CandidateRow> popular = popularSource.topPopular(batch * 2);
            rows.addAll(DiversificationFilter.apply(
                popular, profile.getMaxPerAuthor(), profile.getMaxPerInstance(), true, batch - rows.size(), state));
        }

        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put("user_id", userId);
        seed.put("mode", mode);
        if (rows.isEmpty()) {
            rows = DiversificationFilter.apply(
                randomPool.sample(batch), profile.getMaxPerAuthor(), profile.getMaxPerInstance(), true, 0, state);
            seed.put("random", true);
        }
        rows = finish(rows, limit, resolved.getName());
        log.info(
            "recommend_done request_id={} profile={} likes={} candidates={} count={} duration_ms={}",
            RequestContextHolder.currentRequestId(),
            resolved.getName(),
            likes.size(),
            candidates.size(),
            rows.size(),
            (System.nanoTime() - startedAt) / 1_000_000
        );
        return new RecommendationResult(rows, seed, includeDebug, clock.millis(), (long) annSource.size());
    }

    /**
     * Related videos for a seed video, or nearest neighbours of a raw vector.
     */
    public RecommendationResult related(RelatedQuery query) {
        boolean includeDebug = checkDebug(query.isDebug());
        int limit = resolveLimit(query.getLimit());
        if (query.getVector() != null) {
            return relatedToVector(query.getVector(), limit, includeDebug);
        }
        String videoId = JdbcUtils.trimToNull(query.getVideoId());
        String uuid = JdbcUtils.trimToNull(query.getUuid());
        String host = JdbcUtils.trimToNull(query.getHost());
        if (videoId == null && uuid == null) {
            throw new ValidationException("Missing vector or video reference");
        }
        long startedAt = System.nanoTime();
        SeedVideo seed = locks.withMetadata(() -> resolveSeed(videoId, uuid, host))
            .orElseThrow(() -> new NotFoundException("Video not found"));
        String userId = JdbcUtils.trimToNull(query.getUserId());
        LikesScope scope = resolveScope(query.getLikes());
        List<LikeEvent> likes = likesService.recentLikes(scope, userId, properties.getMaxLikes());
        ResolvedProfile resolved = ProfileResolver.resolve(
            properties.getProfiles(), properties.getDefaultProfile(), MODE_UPNEXT, !likes.isEmpty());
        Profile profile = resolved.getProfile();

        SimilarityCandidatesPolicy policy = new SimilarityCandidatesPolicy(
            query.isRefreshCache() || properties.isRefreshCache(),
            true,
            similarityProperties.isRequireFullCache(),
            true,
            true
        );
        int poolSize = properties.getSimilarPerLike() > 0 ? properties.getSimilarPerLike() : limit;
        List<CandidateRow> candidates = similarCandidatesService.getSimilarCandidates(seed, poolSize, policy);
        long relatedMs = (System.nanoTime() - startedAt) / 1_000_000;

        List<CandidateRow> ranked = ranker.scoreAndRank(
            candidates, profile.getScoring(), profile.getExplore(), MODE_UPNEXT, clock.millis());
        DiversificationState state = new DiversificationState();
        state.markSeen(List.of(seed.getIdentity().key()));
        state.markSeen(likedKeys(likes));
        List<CandidateRow> rows = finish(
            DiversificationFilter.apply(
                ranked, profile.getMaxPerAuthor(), profile.getMaxPerInstance(), true, 0, state),
            limit,
            resolved.getName()
        );

        RecommendationProperties.Personalization personalization = profile.getPersonalization();
        if (personalization != null && personalization.isEnabled()) {
            long personalizeStart = System.nanoTime();
            rows = reranker.rerank(scope, userId, rows, personalization.getAlpha(), personalization.getBeta());
            log.info(
                "related_personalize request_id={} duration_ms={}",
                RequestContextHolder.currentRequestId(),
                (System.nanoTime() - personalizeStart) / 1_000_000
            );
        }
        assignRanks(rows);

        VideoIdentity identity = seed.getIdentity();
        Map<String, Object> seedPayload = new LinkedHashMap<>();
        seedPayload.put("video_id", identity.getVideoId());
        seedPayload.put("instance_domain", identity.getInstanceDomain());
        seedPayload.put("channel_id", identity.getChannelId());
        seedPayload.put("title", identity.getTitle());
        seedPayload.put("mode", MODE_UPNEXT);
        log.info(
            "related_done request_id={} seed={} profile={} candidates={} count={} related_ms={} duration_ms={}",
            RequestContextHolder.currentRequestId(),
            identity,
            resolved.getName(),
            candidates.size(),
            rows.size(),
            relatedMs,
            (System.nanoTime() - startedAt) / 1_000_000
        );
        return new RecommendationResult(rows, seedPayload, includeDebug, clock.millis(), (long) annSource.size());
    }

    private RecommendationResult relatedToVector(float[] vector, int limit, boolean includeDebug) {
        if (vector.length == 0 || !VectorMath.isFinite(vector)) {
            throw new ValidationException("Invalid vector parameter");
        }
        Map<String, Object> seed = new LinkedHashMap<>();
        if (VectorMath.norm(vector) == 0.0) {
            seed.put("vector", "zero");
            List<CandidateRow> rows = finish(randomPool.sample(limit), limit, null);
            return new RecommendationResult(rows, seed, includeDebug, clock.millis(), (long) annSource.size());
        }
        int dimension = annSource.dimension();
        if (dimension > 0 && vector.length != dimension) {
            throw new ValidationException("Vector dimension does not match embeddings");
        }
        seed.put("vector", true);
        List<CandidateRow> rows = finish(annSource.searchByVector(vector, limit, null), limit, null);
        return new RecommendationResult(rows, seed, includeDebug, clock.millis(), (long) annSource.size());
    }

    private Optional<SeedVideo> resolveSeed(String videoId, String uuid, String host) {
        Optional<VideoIdentity> identity = Optional.empty();
        if (uuid != null) {
            identity = videoRepository.resolveIdentity(null, uuid, host);
        }
        if (identity.isEmpty() && videoId != null) {
            identity = videoRepository.resolveIdentity(videoId, null, host);
        }
        return identity.flatMap(videoRepository::findSeed);
    }

    /**
     * Moderates the whole candidate list, then cuts it to {@code limit} and
     * numbers the survivors. Truncating first would let blocked rows use up slots.
     */
    private List<CandidateRow> finish(List<CandidateRow> rows, int limit, String profileName) {
        List<CandidateRow> moderated = moderationFilter.filter(rows).getRows();
        List<CandidateRow> out = new ArrayList<>(Math.min(limit, moderated.size()));
        for (CandidateRow row : moderated) {
            if (out.size() >= limit) {
                break;
            }
            if (profileName != null) {
                row.setProfile(profileName);
            }
            out.add(row);
        }
        assignRanks(out);
        return out;
    }

    private static void assignRanks(List<CandidateRow> rows) {
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).setRank(i + 1);
        }
    }

    /**
     * Resolves client-supplied likes when the service is configured to trust
     * them; otherwise likes come from the store.
     */
    LikesScope resolveScope(List<ClientLike> clientLikes) {
        if (!properties.isUseClientLikes()) {
            return LikesScope.store();
        }
        List<VideoIdentity> refs = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int max = properties.getClientLikesMax();
        for (ClientLike like : clientLikes) {
            if (max > 0 && refs.size() >= max) {
                break;
            }
            String uuid = like == null ? null : JdbcUtils.trimToNull(like.getUuid());
            String host = like == null ? null : JdbcUtils.trimToNull(like.getHost());
            if (uuid == null || host == null || !seen.add(VideoKeys.uuidKey(uuid, host))) {
                continue;
            }
            refs.add(new VideoIdentity(null, host, uuid, null, null));
        }
        if (refs.isEmpty()) {
            return LikesScope.client(List.of());
        }
        List<VideoIdentity> resolved = locks.withMetadata(() -> videoRepository.resolveByUuids(refs));
        long now = clock.millis();
        List<LikeEvent> likes = new ArrayList<>(resolved.size());
        for (int i = 0; i < resolved.size(); i++) {
            likes.add(new LikeEvent(null, resolved.get(i), now - i));
        }
        return LikesScope.client(likes);
    }

    private boolean checkDebug(boolean requested) {
        if (!requested) {
            return false;
        }
        if (!properties.isDebugEnabled()) {
            throw new ApiException(HttpStatus.FORBIDDEN, "forbidden", "Debug mode is disabled");
        }
        return true;
    }

    int resolveLimit(Integer requested) {
        int limit = requested == null || requested <= 0 ? properties.getDefaultLimit() : requested;
        if (properties.getMaxLimit() > 0) {
            limit = Math.min(limit, properties.getMaxLimit());
        }
        return Math.max(limit, 1);
    }

    private static Set<String> likedKeys(List<LikeEvent> likes) {
        Set<String> keys = new LinkedHashSet<>();
        for (LikeEvent like : likes) {
            keys.add(like.getVideo().key());
        }
        return keys;
    }
}
