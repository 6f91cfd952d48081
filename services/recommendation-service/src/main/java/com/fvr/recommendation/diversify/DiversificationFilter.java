package com.fvr.recommendation.diversify;

import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.List;

/**
 * Order-preserving author/instance caps with optional identity dedup. Caps of
 * zero or less are disabled; a {@code limit} of zero or less is unbounded.
 */
public final class DiversificationFilter {
    private DiversificationFilter() {
    }

    public static List<CandidateRow> apply(
        List<CandidateRow> candidates,
        int maxPerAuthor,
        int maxPerInstance,
        boolean dedupe,
        int limit,
        DiversificationState state
    ) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        boolean cappedAuthors = maxPerAuthor > 0;
        boolean cappedInstances = maxPerInstance > 0;
        if (!cappedAuthors && !cappedInstances && !dedupe) {
            int end = limit > 0 ? Math.min(limit, candidates.size()) : candidates.size();
            return new ArrayList<>(candidates.subList(0, end));
        }
        DiversificationState counters = state == null ? new DiversificationState() : state;
        List<CandidateRow> kept = new ArrayList<>();
        for (CandidateRow row : candidates) {
            if (limit > 0 && kept.size() >= limit) {
                break;
            }
            String key = dedupe ? row.likeKey() : null;
            if (key != null && counters.isSeen(key)) {
                continue;
            }
            String author = row.authorKey();
            if (cappedAuthors && author != null && counters.authorCount(author) >= maxPerAuthor) {
                continue;
            }
            String instance = row.instanceDomain();
            if (cappedInstances && !instance.isEmpty() && counters.instanceCount(instance) >= maxPerInstance) {
                continue;
            }
            counters.record(key, author, instance);
            kept.add(row);
        }
        return kept;
    }
}
