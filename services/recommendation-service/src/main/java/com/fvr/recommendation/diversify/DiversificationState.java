package com.fvr.recommendation.diversify;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Author counts, instance counts and seen keys for one request. Shared across
 * successive filter calls so batches compose; never persisted.
 */
public class DiversificationState {
    private final Map<String, Integer> authorCounts = new HashMap<>();
    private final Map<String, Integer> instanceCounts = new HashMap<>();
    private final Set<String> seen = new HashSet<>();

    public int authorCount(String authorKey) {
        return authorCounts.getOrDefault(authorKey, 0);
    }

    public int instanceCount(String instance) {
        return instanceCounts.getOrDefault(instance, 0);
    }

    public boolean isSeen(String key) {
        return seen.contains(key);
    }

    /**
     * Marks keys as already used, e.g. liked videos that must never be returned.
     */
    public void markSeen(Iterable<String> keys) {
        for (String key : keys) {
            seen.add(key);
        }
    }

    void record(String key, String authorKey, String instance) {
        if (key != null) {
            seen.add(key);
        }
        if (authorKey != null) {
            authorCounts.merge(authorKey, 1, Integer::sum);
        }
        if (instance != null && !instance.isEmpty()) {
            instanceCounts.merge(instance, 1, Integer::sum);
        }
    }
}
