package com.fvr.recommendation.api;

import com.fvr.recommendation.events.InteractionEventService;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class InternalEventsController {
    private final InteractionEventService eventService;

    public InternalEventsController(InteractionEventService eventService) {
        this.eventService = eventService;
    }

    @PostMapping("/internal/events/ingest")
    public Map<String, Object> ingest(@RequestBody(required = false) Map<String, Object> body) {
        return eventService.ingest(body).toResponse();
    }
}
