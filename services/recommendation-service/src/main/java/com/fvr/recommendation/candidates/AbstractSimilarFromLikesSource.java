package com.fvr.recommendation.candidates;

import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.RecommendationProperties;
import com.fvr.recommendation.likes.LikeEvent;
import com.fvr.recommendation.likes.LikesScope;
import com.fvr.recommendation.likes.LikesService;
import com.fvr.recommendation.similarity.SimilarCandidatesService;
import com.fvr.recommendation.similarity.SimilarityCandidatesPolicy;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.SeedVideo;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractSimilarFromLikesSource implements SimilarFromLikesSource {
    private static final Logger log = LoggerFactory.getLogger(AbstractSimilarFromLikesSource.class);

    private final LikesService likesService;
    private final VideoRepository videoRepository;
    private final SimilarCandidatesService similarCandidatesService;
    private final ResourceLocks locks;
    private final RecommendationProperties properties;
    private final Random random;

    AbstractSimilarFromLikesSource(
        LikesService likesService,
        VideoRepository videoRepository,
        SimilarCandidatesService similarCandidatesService,
        ResourceLocks locks,
        RecommendationProperties properties,
        Random random
    ) {
        this.likesService = likesService;
        this.videoRepository = videoRepository;
        this.similarCandidatesService = similarCandidatesService;
        this.locks = locks;
        this.properties = properties;
        this.random = random;
    }

    protected abstract SimilarityCandidatesPolicy policy(boolean refreshCache);

    @Override
    public List<CandidateRow> getCandidates(LikesScope scope, String userId, int limit, boolean refreshCache) {
        if (limit <= 0) {
            return List.of();
        }
        List<LikeEvent> likes = likesService.recentLikes(scope, userId, properties.getMaxLikes());
        if (likes.isEmpty()) {
            return List.of();
        }
        likes = sampleLikes(likes, properties.getMaxLikesForRecs(), random);

        List<VideoIdentity> likedVideos = new ArrayList<>(likes.size());
        Set<String> likedKeys = new HashSet<>();
        for (LikeEvent like : likes) {
            likedVideos.add(like.getVideo());
            likedKeys.add(like.getVideo().key());
        }
        long seedStart = System.nanoTime();
        Map<String, SeedVideo> seeds = locks.withMetadata(() -> videoRepository.findSeeds(likedVideos));
        log.info(
            "likes_seed_batch source={} likes={} resolved={} took_ms={}",
            name(),
            likes.size(),
            seeds.size(),
            (System.nanoTime() - seedStart) / 1_000_000L
        );

        SimilarityCandidatesPolicy policy = policy(refreshCache);
        Set<String> seen = new HashSet<>();
        List<CandidateRow> pool = new ArrayList<>();
        int skipped = 0;
        for (VideoIdentity liked : likedVideos) {
            SeedVideo seed = seeds.get(liked.key());
            if (seed == null) {
                skipped++;
                continue;
            }
            List<CandidateRow> similar = similarCandidatesService.getSimilarCandidates(
                seed, properties.getSimilarPerLike(), policy);
            for (CandidateRow row : similar) {
                String key = row.likeKey();
                if (likedKeys.contains(key) || !seen.add(key)) {
                    continue;
                }
                pool.add(row);
            }
        }
        Collections.shuffle(pool, random);
        log.info(
            "likes_candidates source={} likes={} skipped={} pool={} limit={}",
            name(),
            likedVideos.size(),
            skipped,
            pool.size(),
            limit
        );
        return pool.size() > limit ? new ArrayList<>(pool.subList(0, limit)) : pool;
    }

    /**
     * Uniform sample without replacement when there are more likes than {@code cap}.
     */
    static List<LikeEvent> sampleLikes(List<LikeEvent> likes, int cap, Random random) {
        if (cap <= 0 || likes.size() <= cap) {
            return likes;
        }
        List<LikeEvent> copy = new ArrayList<>(likes);
        Collections.shuffle(copy, random);
        return copy.subList(0, cap);
    }
}
