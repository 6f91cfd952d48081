package com.fvr.recommendation.events;

public class InteractionEvent {
    private final String eventId;
    private final InteractionEventType type;
    private final String actorId;
    private final String videoUuid;
    private final String instanceDomain;
    private final String canonicalUrl;
    private final String sourceInstance;
    private final long publishedAt;
    private final String rawPayloadJson;

    public InteractionEvent(
        String eventId,
        InteractionEventType type,
        String actorId,
        String videoUuid,
        String instanceDomain,
        String canonicalUrl,
        String sourceInstance,
        long publishedAt,
        String rawPayloadJson
    ) {
        this.eventId = eventId;
        this.type = type;
        this.actorId = actorId;
        this.videoUuid = videoUuid;
        this.instanceDomain = instanceDomain;
        this.canonicalUrl = canonicalUrl;
        this.sourceInstance = sourceInstance;
        this.publishedAt = publishedAt;
        this.rawPayloadJson = rawPayloadJson;
    }

    public String getEventId() {
        return eventId;
    }

    public InteractionEventType getType() {
        return type;
    }

    public String getActorId() {
        return actorId;
    }

    public String getVideoUuid() {
        return videoUuid;
    }

    public String getInstanceDomain() {
        return instanceDomain;
    }

    public String getCanonicalUrl() {
        return canonicalUrl;
    }

    public String getSourceInstance() {
        return sourceInstance;
    }

    public long getPublishedAt() {
        return publishedAt;
    }

    public String getRawPayloadJson() {
        return rawPayloadJson;
    }
}
