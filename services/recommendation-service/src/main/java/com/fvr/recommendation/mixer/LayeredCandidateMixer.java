package com.fvr.recommendation.mixer;

import com.fvr.recommendation.candidates.CandidateLayer;
import com.fvr.recommendation.candidates.ExploitLayer;
import com.fvr.recommendation.candidates.ExploreRangeLayer;
import com.fvr.recommendation.candidates.LayerRequest;
import com.fvr.recommendation.common.RequestContextHolder;
import com.fvr.recommendation.config.RecommendationProperties.Layer;
import com.fvr.recommendation.config.RecommendationProperties.Profile;
import com.fvr.recommendation.config.RecommendationProperties.SoftCaps;
import com.fvr.recommendation.scoring.CandidateScorer;
import com.fvr.recommendation.scoring.PoolBounds;
import com.fvr.recommendation.video.CandidateRow;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds one home-feed batch from the profile's candidate layers. Each layer
 * is asked for its share of an over-fetched pool, every row is scored, and the
 * per-layer lists are interleaved according to the layers' mix ratios. Liked
 * videos never survive the final pass.
 */
@Component
public class LayeredCandidateMixer {
    private static final Logger log = LoggerFactory.getLogger(LayeredCandidateMixer.class);

    private final Map<String, CandidateLayer> layers = new LinkedHashMap<>();
    private final Random random;
    private final Clock clock;

    public LayeredCandidateMixer(List<CandidateLayer> available, Random random, Clock clock) {
        for (CandidateLayer layer : available) {
            layers.put(layer.name(), layer);
        }
        this.random = random;
        this.clock = clock;
    }

    public List<CandidateRow> mix(
        LayerRequest request,
        Profile profile,
        String profileName,
        int batchSize,
        Set<String> excludedKeys
    ) {
        if (batchSize <= 0) {
            return List.of();
        }
        Map<String, Layer> configs = layerConfigs(profile);
        List<String> order = resolveOrder(profile.getMixOrder(), configs);
        Map<String, Integer> fetchLimits = fetchLimits(
            configs, order, batchSize, profile.getOverfetchFactor(), request.hasLikes());

        Map<String, List<CandidateRow>> byLayer = new LinkedHashMap<>();
        List<String> timings = new ArrayList<>();
        for (String name : order) {
            Integer fetchLimit = fetchLimits.get(name);
            if (fetchLimit == null || fetchLimit <= 0) {
                continue;
            }
            CandidateLayer layer = layers.get(name);
            if (layer == null) {
                log.warn("mixer_unknown_layer name={} profile={}", name, profileName);
                continue;
            }
            long startedAt = System.nanoTime();
            List<CandidateRow> rows = new ArrayList<>(layer.getCandidates(request, fetchLimit, configs.get(name)));
            if (configs.get(name).isShuffle()) {
                Collections.shuffle(rows, random);
            }
            byLayer.put(name, rows);
            timings.add(name + "=" + (System.nanoTime() - startedAt) / 1_000_000 + "ms(" + rows.size() + ")");
        }
        log.info(
            "mixer_layers request_id={} profile={} likes={} timing=\"{}\"",
            RequestContextHolder.currentRequestId(),
            profileName,
            request.hasLikes(),
            String.join(" ", timings)
        );
        Set<String> seen = new HashSet<>(excludedKeys);
        return softMix(byLayer, configs, order, batchSize, seen, profile, profileName);
    }

    private List<CandidateRow> softMix(
        Map<String, List<CandidateRow>> byLayer,
        Map<String, Layer> configs,
        List<String> order,
        int batchSize,
        Set<String> seen,
        Profile profile,
        String profileName
    ) {
        long now = clock.millis();
        Layer exploreConfig = configs.get(ExploreRangeLayer.NAME);
        double exploreMin = exploreConfig == null ? 0.0 : exploreConfig.getSimilarityMin();
        double exploreMax = exploreConfig == null ? 1.0 : exploreConfig.getSimilarityMax();

        Map<String, List<CandidateRow>> scored = new LinkedHashMap<>();
        List<CandidateRow> pool = new ArrayList<>();
        for (String name : order) {
            for (CandidateRow candidate : byLayer.getOrDefault(name, List.of())) {
                CandidateRow row = candidate.copy();
                CandidateScorer.score(row, profile.getScoring(), name, now);
                scored.computeIfAbsent(name, key -> new ArrayList<>()).add(row);
                pool.add(row);
            }
        }
        PoolBounds bounds = PoolBounds.of(pool);
        log.info("similarity_pool min={} max={} count={}", bounds.min(), bounds.max(), bounds.count());
        bounds.applyTo(pool);
        for (CandidateRow row : pool) {
            row.setExploreMin(exploreMin);
            row.setExploreMax(exploreMax);
            row.setProfile(profileName);
        }

        List<String> active = new ArrayList<>();
        for (String name : order) {
            if (scored.containsKey(name)) {
                active.add(name);
            }
        }
        if (active.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> targets = outputTargets(configs, active, batchSize);
        Map<String, Deque<CandidateRow>> remaining = new LinkedHashMap<>();
        for (Map.Entry<String, List<CandidateRow>> entry : scored.entrySet()) {
            List<CandidateRow> rows = entry.getValue();
            rows.sort(Comparator.comparingDouble((CandidateRow row) -> -row.getScore()));
            for (int i = 0; i < rows.size(); i++) {
                rows.get(i).setRankBefore(i + 1);
            }
            remaining.put(entry.getKey(), new ArrayDeque<>(rows));
        }
        targets.replaceAll((name, target) -> Math.min(target, scored.getOrDefault(name, List.of()).size()));

        List<CandidateRow> mixed = new ArrayList<>();
        for (String name : schedule(targets, order)) {
            if (mixed.size() >= batchSize) {
                break;
            }
            CandidateRow next = remaining.get(name).pollFirst();
            if (next != null) {
                mixed.add(next);
            }
        }
        for (String name : order) {
            Deque<CandidateRow> rows = remaining.get(name);
            while (rows != null && !rows.isEmpty() && mixed.size() < batchSize) {
                mixed.add(rows.pollFirst());
            }
        }
        return postFilter(mixed, batchSize, seen, profile.getSoftCaps());
    }

    /**
     * Drops already-seen videos and enforces per-layer soft caps. Layers with
     * a minimum are served first, then the rest of the pool in order.
     */
    static List<CandidateRow> postFilter(List<CandidateRow> mixed, int batchSize, Set<String> seen, SoftCaps caps) {
        Map<String, Integer> minCaps = caps == null ? Map.of() : caps.getMin();
        Map<String, Integer> maxCaps = caps == null ? Map.of() : caps.getMax();
        Map<String, Integer> layerCounts = new HashMap<>();
        List<CandidateRow> out = new ArrayList<>();
        int skippedSeen = 0;
        int skippedCap = 0;

        for (Map.Entry<String, Integer> entry : minCaps.entrySet()) {
            String layer = entry.getKey();
            int minCount = entry.getValue() == null ? 0 : entry.getValue();
            if (minCount <= 0) {
                continue;
            }
            for (CandidateRow row : mixed) {
                if (out.size() >= batchSize || layerCounts.getOrDefault(layer, 0) >= minCount) {
                    break;
                }
                if (!layer.equals(row.getLayer())) {
                    continue;
                }
                if (seen.contains(row.likeKey())) {
                    skippedSeen++;
                    continue;
                }
                if (atCap(row.getLayer(), layerCounts, maxCaps)) {
                    skippedCap++;
                    continue;
                }
                take(row, out, seen, layerCounts);
            }
        }
        for (CandidateRow row : mixed) {
            if (out.size() >= batchSize) {
                break;
            }
            if (seen.contains(row.likeKey())) {
                skippedSeen++;
                continue;
            }
            if (atCap(row.getLayer(), layerCounts, maxCaps)) {
                skippedCap++;
                continue;
            }
            take(row, out, seen, layerCounts);
        }
        for (int i = 0; i < out.size(); i++) {
            out.get(i).setRankAfter(i + 1);
        }
        log.info(
            "mixer_post_filter kept={} batch={} pool={} skipped_seen={} skipped_layer_cap={}",
            out.size(), batchSize, mixed.size(), skippedSeen, skippedCap
        );
        return out;
    }

    private static boolean atCap(String layer, Map<String, Integer> counts, Map<String, Integer> maxCaps) {
        if (layer == null) {
            return false;
        }
        Integer max = maxCaps.get(layer);
        return max != null && max > 0 && counts.getOrDefault(layer, 0) >= max;
    }

    private static void take(CandidateRow row, List<CandidateRow> out, Set<String> seen, Map<String, Integer> counts) {
        seen.add(row.likeKey());
        if (row.getLayer() != null) {
            counts.merge(row.getLayer(), 1, Integer::sum);
        }
        out.add(row);
    }

    static Map<String, Layer> layerConfigs(Profile profile) {
        if (profile.getLayers() == null || profile.getLayers().isEmpty()) {
            Map<String, Layer> defaults = new LinkedHashMap<>();
            defaults.put(ExploitLayer.NAME, new Layer());
            return defaults;
        }
        return profile.getLayers();
    }

    static List<String> resolveOrder(List<String> mixOrder, Map<String, Layer> configs) {
        if (mixOrder == null || mixOrder.isEmpty()) {
            return new ArrayList<>(configs.keySet());
        }
        List<String> order = new ArrayList<>();
        for (String name : mixOrder) {
            if (configs.containsKey(name)) {
                order.add(name);
            }
        }
        return order;
    }

    /**
     * Splits {@code batchSize * max(overfetch, 1)} across enabled layers by
     * gather ratio. Without ratios every layer gets an even share of at least one.
     */
    static Map<String, Integer> fetchLimits(
        Map<String, Layer> configs,
        List<String> order,
        int batchSize,
        double overfetchFactor,
        boolean hasLikes
    ) {
        List<String> enabled = new ArrayList<>();
        for (String name : order) {
            Layer config = configs.get(name);
            if (config == null || !config.isEnabled() || (config.isRequiresLikes() && !hasLikes)) {
                continue;
            }
            enabled.add(name);
        }
        Map<String, Integer> limits = new LinkedHashMap<>();
        int total = (int) (batchSize * Math.max(overfetchFactor, 1.0));
        if (enabled.isEmpty() || total <= 0) {
            return limits;
        }
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (String name : enabled) {
            ratios.put(name, configs.get(name).getGatherRatio());
        }
        if (sumPositive(ratios) <= 0) {
            int perLayer = Math.max(total / enabled.size(), 1);
            for (String name : enabled) {
                limits.put(name, perLayer);
            }
            return limits;
        }
        return proportional(ratios, total);
    }

    /**
     * Splits the batch across enabled layers by mix ratio, handing the
     * remainder out one at a time in order.
     */
    static Map<String, Integer> outputTargets(Map<String, Layer> configs, List<String> active, int batchSize) {
        List<String> enabled = new ArrayList<>();
        for (String name : active) {
            Layer config = configs.get(name);
            if (config != null && config.isEnabled()) {
                enabled.add(name);
            }
        }
        Map<String, Integer> targets = new LinkedHashMap<>();
        if (enabled.isEmpty() || batchSize <= 0) {
            return targets;
        }
        Map<String, Double> ratios = new LinkedHashMap<>();
        for (String name : enabled) {
            ratios.put(name, configs.get(name).getMixRatio());
        }
        if (sumPositive(ratios) <= 0) {
            for (String name : enabled) {
                ratios.put(name, 1.0);
            }
        }
        return proportional(ratios, batchSize);
    }

    private static Map<String, Integer> proportional(Map<String, Double> ratios, int total) {
        double ratioSum = sumPositive(ratios);
        Map<String, Integer> shares = new LinkedHashMap<>();
        int allocated = 0;
        for (Map.Entry<String, Double> entry : ratios.entrySet()) {
            if (entry.getValue() <= 0) {
                continue;
            }
            int share = (int) Math.floor(total * entry.getValue() / ratioSum);
            shares.put(entry.getKey(), share);
            allocated += share;
        }
        int remainder = total - allocated;
        for (String name : shares.keySet()) {
            if (remainder <= 0) {
                break;
            }
            shares.merge(name, 1, Integer::sum);
            remainder--;
        }
        return shares;
    }

    private static double sumPositive(Map<String, Double> ratios) {
        double sum = 0.0;
        for (double ratio : ratios.values()) {
            if (ratio > 0) {
                sum += ratio;
            }
        }
        return sum;
    }

    /**
     * Slot sequence that keeps every layer's fill fraction level: each slot goes
     * to the layer furthest behind its target, earlier layers winning ties.
     */
    static List<String> schedule(Map<String, Integer> targets, List<String> order) {
        List<String> ordered = new ArrayList<>();
        int total = 0;
        for (String name : order) {
            if (targets.containsKey(name)) {
                ordered.add(name);
                total += Math.max(targets.get(name), 0);
            }
        }
        Map<String, Integer> counts = new HashMap<>();
        List<String> schedule = new ArrayList<>(total);
        for (int slot = 0; slot < total; slot++) {
            String chosen = null;
            double chosenRatio = 0.0;
            for (String name : ordered) {
                int target = targets.get(name);
                int count = counts.getOrDefault(name, 0);
                if (target <= 0 || count >= target) {
                    continue;
                }
                double ratio = (double) count / target;
                if (chosen == null || ratio < chosenRatio) {
                    chosen = name;
                    chosenRatio = ratio;
                }
            }
            if (chosen == null) {
                break;
            }
            counts.merge(chosen, 1, Integer::sum);
            schedule.add(chosen);
        }
        return schedule;
    }
}
