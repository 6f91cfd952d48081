package com.fvr.recommendation.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.common.RequestContextHolder;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.common.StorageException;
import com.fvr.recommendation.common.ValidationException;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class InteractionEventService {
    private static final Logger log = LoggerFactory.getLogger(InteractionEventService.class);

    private final InteractionEventRepository repository;
    private final ResourceLocks locks;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InteractionEventService(
        InteractionEventRepository repository,
        ResourceLocks locks,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.repository = repository;
        this.locks = locks;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Accepts either {@code {"events": [...]}} or a single event object. Every
     * event is validated before anything is written.
     */
    public IngestResult ingest(Map<String, Object> body) {
        List<Map<String, Object>> payloads = extractEvents(body);
        if (payloads.isEmpty()) {
            throw new ValidationException("Missing events");
        }
        long now = clock.millis();
        List<InteractionEvent> events = new ArrayList<>(payloads.size());
        for (Map<String, Object> payload : payloads) {
            events.add(normalize(payload, now));
        }

        List<Boolean> inserted;
        try {
            inserted = locks.withMetadata(() -> repository.ingest(events, now));
        } catch (DataAccessException e) {
            throw new StorageException("Failed to ingest interaction events", e);
        }

        int ingested = 0;
        int duplicates = 0;
        List<Map<String, Object>> results = new ArrayList<>(events.size());
        for (int i = 0; i < events.size(); i++) {
            InteractionEvent event = events.get(i);
            boolean duplicate = !inserted.get(i);
            if (duplicate) {
                duplicates++;
            } else {
                ingested++;
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("ok", true);
            result.put("duplicate", duplicate);
            result.put("event_id", event.getEventId());
            result.put("event_type", event.getType().getWireName());
            results.add(result);
        }
        Metrics.counter("recommendation.events.ingested.total", "outcome", "new").increment(ingested);
        Metrics.counter("recommendation.events.ingested.total", "outcome", "duplicate").increment(duplicates);
        log.info(
            "events_ingested request_id={} count={} ingested={} duplicates={}",
            RequestContextHolder.currentRequestId(),
            events.size(),
            ingested,
            duplicates
        );
        return new IngestResult(ingested, duplicates, results);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> extractEvents(Map<String, Object> body) {
        List<Map<String, Object>> events = new ArrayList<>();
        if (body == null) {
            return events;
        }
        Object raw = body.get("events");
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    events.add((Map<String, Object>) map);
                }
            }
            return events;
        }
        events.add(body);
        return events;
    }

    InteractionEvent normalize(Map<String, Object> payload, long now) {
        String eventId = JdbcUtils.trimToNull(payload.get("event_id"));
        if (eventId == null) {
            throw new ValidationException("Missing event_id");
        }
        InteractionEventType type = InteractionEventType.fromWireName(JdbcUtils.trimToNull(payload.get("event_type")));
        if (type == null) {
            throw new ValidationException("Unsupported event_type");
        }
        if (!(payload.get("object") instanceof Map<?, ?> object)) {
            throw new ValidationException("Missing object");
        }
        String videoUuid = JdbcUtils.trimToNull(object.get("video_uuid"));
        if (videoUuid == null) {
            throw new ValidationException("Missing object.video_uuid");
        }
        String instanceDomain = JdbcUtils.trimToNull(object.get("instance_domain"));
        if (instanceDomain == null) {
            throw new ValidationException("Missing object.instance_domain");
        }
        Long publishedAt = JdbcUtils.asLong(payload.get("published_at"));
        Object rawPayload = payload.get("raw_payload");
        return new InteractionEvent(
            eventId,
            type,
            JdbcUtils.trimToNull(payload.get("actor_id")),
            videoUuid,
            instanceDomain,
            JdbcUtils.trimToNull(object.get("canonical_url")),
            JdbcUtils.trimToNull(payload.get("source_instance")),
            publishedAt == null ? now : publishedAt,
            toJson(rawPayload instanceof Map<?, ?> ? rawPayload : Map.of())
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid raw_payload");
        }
    }
}
