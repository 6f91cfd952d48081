package com.fvr.recommendation.events;

import java.util.ArrayList;
import java.util.List;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class InteractionEventRepository {
    private final JdbcTemplate jdbcTemplate;

    public InteractionEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Stores each event once and folds newly stored events into
     * {@code interaction_signals}. Returns, per event, whether it was new.
     */
    @Transactional
    public List<Boolean> ingest(List<InteractionEvent> events, long ingestedAt) {
        List<Boolean> inserted = new ArrayList<>(events.size());
        for (InteractionEvent event : events) {
            boolean stored = insertRawEvent(event, ingestedAt);
            if (stored) {
                applySignalDeltas(event, ingestedAt);
            }
            inserted.add(stored);
        }
        return inserted;
    }

    public boolean hasEvent(String eventId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM interaction_raw_events WHERE event_id = ?", Integer.class, eventId);
        return count != null && count > 0;
    }

    private boolean insertRawEvent(InteractionEvent event, long ingestedAt) {
        if (hasEvent(event.getEventId())) {
            return false;
        }
        String sql = "INSERT INTO interaction_raw_events "
            + "(event_id, event_type, actor_id, video_uuid, instance_domain, canonical_url, source_instance, "
            + "published_at, raw_payload_json, ingested_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try {
            jdbcTemplate.update(
                sql,
                event.getEventId(),
                event.getType().getWireName(),
                event.getActorId(),
                event.getVideoUuid(),
                event.getInstanceDomain(),
                event.getCanonicalUrl(),
                event.getSourceInstance(),
                event.getPublishedAt(),
                event.getRawPayloadJson(),
                ingestedAt
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    private void applySignalDeltas(InteractionEvent event, long now) {
        InteractionEventType type = event.getType();
        int updated = jdbcTemplate.update(
            "UPDATE interaction_signals SET "
                + "likes_count = GREATEST(0, likes_count + ?), "
                + "undo_likes_count = GREATEST(0, undo_likes_count + ?), "
                + "comments_count = GREATEST(0, comments_count + ?), "
                + "signal_score = GREATEST(0.0, signal_score + ?), "
                + "updated_at = ? "
                + "WHERE video_uuid = ? AND instance_domain = ?",
            type.getLikesDelta(),
            type.getUndoLikesDelta(),
            type.getCommentsDelta(),
            type.getSignalDelta(),
            now,
            event.getVideoUuid(),
            event.getInstanceDomain()
        );
        if (updated > 0) {
            return;
        }
        jdbcTemplate.update(
            "INSERT INTO interaction_signals "
                + "(video_uuid, instance_domain, likes_count, undo_likes_count, comments_count, signal_score, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)",
            event.getVideoUuid(),
            event.getInstanceDomain(),
            Math.max(0, type.getLikesDelta()),
            Math.max(0, type.getUndoLikesDelta()),
            Math.max(0, type.getCommentsDelta()),
            Math.max(0.0, type.getSignalDelta()),
            now
        );
    }
}
