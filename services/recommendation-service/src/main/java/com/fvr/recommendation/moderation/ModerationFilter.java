package com.fvr.recommendation.moderation;

import com.fvr.recommendation.common.RequestContextHolder;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.ModerationProperties;
import com.fvr.recommendation.video.CandidateRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drops rows from denylisted instances and blocked channels. Returns a new
 * list in the original order and never touches the input.
 */
@Component
public class ModerationFilter {
    private static final Logger log = LoggerFactory.getLogger(ModerationFilter.class);

    private final ModerationRepository repository;
    private final ModerationProperties properties;
    private final ResourceLocks locks;

    public ModerationFilter(ModerationRepository repository, ModerationProperties properties, ResourceLocks locks) {
        this.repository = repository;
        this.properties = properties;
        this.locks = locks;
    }

    public ModerationResult filter(List<CandidateRow> rows) {
        boolean instanceFilter = properties.isInstanceDenylistEnabled();
        boolean channelFilter = properties.isChannelBlocklistEnabled();
        if (rows == null || rows.isEmpty() || (!instanceFilter && !channelFilter)) {
            return new ModerationResult(rows == null ? List.of() : new ArrayList<>(rows), ModerationFilterStats.none());
        }
        Set<String> hosts = new LinkedHashSet<>();
        Map<String, String[]> pairs = new LinkedHashMap<>();
        for (CandidateRow row : rows) {
            String host = HostNormalizer.normalize(row.instanceDomain());
            if (host == null) {
                continue;
            }
            hosts.add(host);
            String channelId = row.channelId();
            if (channelId != null && !channelId.isBlank()) {
                pairs.putIfAbsent(channelId + "::" + host, new String[] {channelId, host});
            }
        }
        Set<String> denied = instanceFilter
            ? locks.withMetadata(() -> repository.findDeniedHosts(hosts))
            : Set.of();
        Set<String> blocked = channelFilter
            ? locks.withMetadata(() -> repository.findBlockedChannels(pairs.values()))
            : Set.of();

        List<CandidateRow> kept = new ArrayList<>(rows.size());
        int deniedCount = 0;
        int blockedCount = 0;
        for (CandidateRow row : rows) {
            String host = HostNormalizer.normalize(row.instanceDomain());
            if (host != null && denied.contains(host)) {
                deniedCount++;
                continue;
            }
            String channelId = row.channelId();
            if (host != null && channelId != null && blocked.contains(channelId + "::" + host)) {
                blockedCount++;
                continue;
            }
            kept.add(row);
        }
        ModerationFilterStats stats = new ModerationFilterStats(deniedCount, blockedCount);
        if (stats.totalFiltered() > 0) {
            log.info(
                "moderation_filtered request_id={} denylist={} blocked_channel={} total={}",
                RequestContextHolder.currentRequestId(),
                deniedCount,
                blockedCount,
                stats.totalFiltered()
            );
        }
        return new ModerationResult(kept, stats);
    }
}
