package com.fvr.recommendation.moderation;

import com.fvr.recommendation.common.JdbcUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class ModerationRepository {
    private final JdbcTemplate jdbcTemplate;

    public ModerationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Set<String> findDeniedHosts(Collection<String> hosts) {
        Set<String> denied = new HashSet<>();
        if (hosts.isEmpty()) {
            return denied;
        }
        List<Object> params = new ArrayList<>(hosts);
        String sql = "SELECT host FROM instance_denylist WHERE is_active = 1 AND host IN ("
            + placeholders(hosts.size()) + ")";
        for (String host : jdbcTemplate.queryForList(sql, String.class, params.toArray())) {
            String normalized = HostNormalizer.normalize(host);
            if (normalized != null) {
                denied.add(normalized);
            }
        }
        return denied;
    }

    /**
     * Blocked {@code channelId::host} keys among the given pairs.
     */
    public Set<String> findBlockedChannels(Collection<String[]> channelHostPairs) {
        Set<String> blocked = new HashSet<>();
        if (channelHostPairs.isEmpty()) {
            return blocked;
        }
        StringBuilder sql = new StringBuilder()
            .append("SELECT channel_id, instance_domain FROM channel_moderation WHERE status = 'blocked' AND (");
        List<Object> params = new ArrayList<>();
        int i = 0;
        for (String[] pair : channelHostPairs) {
            if (i++ > 0) {
                sql.append(" OR ");
            }
            sql.append("(channel_id = ? AND instance_domain = ?)");
            params.add(pair[0]);
            params.add(pair[1]);
        }
        sql.append(")");
        for (Map<String, Object> row : jdbcTemplate.queryForList(sql.toString(), params.toArray())) {
            blocked.add(
                JdbcUtils.asString(row.get("channel_id")) + "::"
                    + HostNormalizer.normalize(JdbcUtils.asString(row.get("instance_domain"))));
        }
        return blocked;
    }

    private static String placeholders(int count) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < count; i++) {
            out.append(i == 0 ? "?" : ",?");
        }
        return out.toString();
    }
}
