package com.fvr.recommendation.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.common.StorageException;
import com.fvr.recommendation.common.ValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class InteractionEventServiceTest {
    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private InteractionEventRepository repository;

    private InteractionEventService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        service = new InteractionEventService(repository, new ResourceLocks(), new ObjectMapper(), clock);
    }

    @Test
    void countsNewAndDuplicateEvents() {
        when(repository.ingest(anyList(), anyLong())).thenReturn(List.of(true, false));

        IngestResult result = service.ingest(Map.of("events", List.of(event("e1", "Like"), event("e2", "Comment"))));

        assertThat(result.getIngested()).isEqualTo(1);
        assertThat(result.getDuplicates()).isEqualTo(1);
        Map<String, Object> response = result.toResponse();
        assertThat(response).containsEntry("ok", true).containsEntry("count", 2);
        assertThat(result.getResults().get(1))
            .containsEntry("duplicate", true)
            .containsEntry("event_id", "e2")
            .containsEntry("event_type", "Comment");
    }

    @Test
    void acceptsASingleEventObject() {
        when(repository.ingest(anyList(), anyLong())).thenReturn(List.of(true));

        IngestResult result = service.ingest(event("e1", "UndoLike"));

        assertThat(result.getIngested()).isEqualTo(1);
        assertThat(result.getResults().get(0)).containsEntry("event_type", "UndoLike");
    }

    @Test
    void oneInvalidEventRejectsTheWholeBatch() {
        Map<String, Object> bad = event("e2", "Dislike");

        assertThatThrownBy(() -> service.ingest(Map.of("events", List.of(event("e1", "Like"), bad))))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Unsupported event_type");
        verifyNoInteractions(repository);
    }

    @Test
    void emptyEventListIsRejected() {
        assertThatThrownBy(() -> service.ingest(Map.of("events", List.of())))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Missing events");
    }

    @Test
    void reportsMissingObjectFields() {
        Map<String, Object> noObject = event("e1", "Like");
        noObject.remove("object");
        Map<String, Object> noUuid = event("e1", "Like");
        noUuid.put("object", Map.of("instance_domain", "a.example"));
        Map<String, Object> noDomain = event("e1", "Like");
        noDomain.put("object", Map.of("video_uuid", "u1"));
        Map<String, Object> noId = event(" ", "Like");

        assertThatThrownBy(() -> service.normalize(noObject, NOW)).hasMessage("Missing object");
        assertThatThrownBy(() -> service.normalize(noUuid, NOW)).hasMessage("Missing object.video_uuid");
        assertThatThrownBy(() -> service.normalize(noDomain, NOW)).hasMessage("Missing object.instance_domain");
        assertThatThrownBy(() -> service.normalize(noId, NOW)).hasMessage("Missing event_id");
    }

    @Test
    void publishedAtDefaultsToNow() {
        Map<String, Object> payload = event("e1", "Like");
        payload.put("raw_payload", Map.of("type", "Like"));

        InteractionEvent event = service.normalize(payload, NOW);

        assertThat(event.getPublishedAt()).isEqualTo(NOW);
        assertThat(event.getType()).isEqualTo(InteractionEventType.LIKE);
        assertThat(event.getRawPayloadJson()).isEqualTo("{\"type\":\"Like\"}");
    }

    @Test
    void storageFailureIsWrapped() {
        when(repository.ingest(anyList(), anyLong())).thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.ingest(event("e1", "Like"))).isInstanceOf(StorageException.class);
    }

    private static Map<String, Object> event(String eventId, String type) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("video_uuid", "uuid-1");
        object.put("instance_domain", "a.example");
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event_id", eventId);
        event.put("event_type", type);
        event.put("actor_id", "https://a.example/accounts/bob");
        event.put("object", object);
        return event;
    }
}
