package com.fvr.recommendation.scoring;

import com.fvr.recommendation.config.RecommendationProperties.Explore;
import com.fvr.recommendation.config.RecommendationProperties.Scoring;
import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Orders a single scored list. Rows are sorted by score, split into an
 * explore bucket (similarity inside the explore range) and an exploit bucket,
 * jittered within fixed windows and interleaved at the configured ratio.
 */
@Component
public class ExploreExploitRanker {
    private static final Logger log = LoggerFactory.getLogger(ExploreExploitRanker.class);

    static final String EXPLORE = "explore";
    static final String EXPLOIT = "exploit";

    private final Random random;

    public ExploreExploitRanker(Random random) {
        this.random = random;
    }

    /**
     * Scores every row under {@code layer}, then ranks the whole list. Sets
     * {@code rank_before} and {@code rank_after} on each row.
     */
    public List<CandidateRow> scoreAndRank(
        List<CandidateRow> candidates,
        Scoring scoring,
        Explore explore,
        String layer,
        long nowMs
    ) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<CandidateRow> scored = new ArrayList<>(candidates.size());
        for (CandidateRow candidate : candidates) {
            CandidateRow row = candidate.copy();
            CandidateScorer.score(row, scoring, layer, nowMs);
            scored.add(row);
        }
        List<CandidateRow> ranked = rank(scored, explore, scored.size());
        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRankAfter(i + 1);
        }
        return ranked;
    }

    List<CandidateRow> rank(List<CandidateRow> scored, Explore explore, int size) {
        List<CandidateRow> sorted = new ArrayList<>(scored);
        sorted.sort(Comparator.comparingDouble((CandidateRow row) -> -(row.getScore() == null ? 0.0 : row.getScore())));
        for (int i = 0; i < sorted.size(); i++) {
            sorted.get(i).setRankBefore(i + 1);
        }
        double ratio = explore.getRatio();
        double exploreMin = explore.getSimilarityMin();
        double exploreMax = explore.getSimilarityMax();
        int jitterWindow = explore.getJitterWindow();

        PoolBounds bounds = PoolBounds.of(sorted);
        log.info("similarity_pool min={} max={} count={}", bounds.min(), bounds.max(), bounds.count());
        for (CandidateRow row : sorted) {
            row.setExploreMin(exploreMin);
            row.setExploreMax(exploreMax);
            row.setPoolMin(bounds.min());
            row.setPoolMax(bounds.max());
            row.setExploreEmpty(false);
        }

        if (ratio <= 0.0) {
            for (CandidateRow row : sorted) {
                row.setBucket(EXPLOIT);
            }
            return jitter(sorted, jitterWindow);
        }

        List<CandidateRow> explorePool = new ArrayList<>();
        List<CandidateRow> exploitPool = new ArrayList<>();
        for (CandidateRow row : sorted) {
            Double similarity = row.getSimilarityScore();
            if (similarity != null && similarity >= exploreMin && similarity < exploreMax) {
                row.setBucket(EXPLORE);
                explorePool.add(row);
            } else {
                row.setBucket(EXPLOIT);
                exploitPool.add(row);
            }
        }
        if (explorePool.isEmpty() && bounds.count() > 0) {
            log.warn(
                "explore_pool_empty similarity_min={} similarity_max={} pool_min={} pool_max={}",
                exploreMin, exploreMax, bounds.min(), bounds.max()
            );
            for (CandidateRow row : sorted) {
                row.setExploreEmpty(true);
            }
        }
        int limit = size > 0 ? size : sorted.size();
        return mixByRatio(jitter(explorePool, jitterWindow), jitter(exploitPool, jitterWindow), ratio, limit);
    }

    /**
     * Shuffles consecutive windows of {@code window} rows; windows of one or less leave order alone.
     */
    List<CandidateRow> jitter(List<CandidateRow> rows, int window) {
        if (window <= 1 || rows.size() <= 1) {
            return new ArrayList<>(rows);
        }
        List<CandidateRow> out = new ArrayList<>(rows.size());
        for (int start = 0; start < rows.size(); start += window) {
            List<CandidateRow> chunk = new ArrayList<>(rows.subList(start, Math.min(rows.size(), start + window)));
            Collections.shuffle(chunk, random);
            out.addAll(chunk);
        }
        return out;
    }

    /**
     * Interleaves so that after n picks roughly {@code round(n * ratio)} came
     * from the explore bucket. An exhausted bucket yields to the other.
     */
    static List<CandidateRow> mixByRatio(
        List<CandidateRow> explorePool,
        List<CandidateRow> exploitPool,
        double ratio,
        int limit
    ) {
        if (ratio <= 0) {
            return new ArrayList<>(exploitPool.subList(0, Math.min(limit, exploitPool.size())));
        }
        if (ratio >= 1) {
            return new ArrayList<>(explorePool.subList(0, Math.min(limit, explorePool.size())));
        }
        List<CandidateRow> out = new ArrayList<>();
        int exploreIdx = 0;
        int exploitIdx = 0;
        while (out.size() < limit && (exploreIdx < explorePool.size() || exploitIdx < exploitPool.size())) {
            int desiredExplore = (int) Math.rint((out.size() + 1) * ratio);
            if (exploreIdx < explorePool.size() && desiredExplore > exploreIdx) {
                out.add(explorePool.get(exploreIdx++));
            } else if (exploitIdx < exploitPool.size()) {
                out.add(exploitPool.get(exploitIdx++));
            } else {
                out.add(explorePool.get(exploreIdx++));
            }
        }
        return out;
    }
}
