package com.fvr.recommendation.video;

import java.util.Objects;

/**
 * Natural key of a video across federated instances. Equality is on
 * {@code (videoId, instanceDomain)} only.
 */
public final class VideoIdentity {
    private final String videoId;
    private final String instanceDomain;
    private final String uuid;
    private final String channelId;
    private final String title;

    public VideoIdentity(String videoId, String instanceDomain) {
        this(videoId, instanceDomain, null, null, null);
    }

    public VideoIdentity(String videoId, String instanceDomain, String uuid, String channelId, String title) {
        this.videoId = videoId;
        this.instanceDomain = instanceDomain == null ? "" : instanceDomain;
        this.uuid = uuid;
        this.channelId = channelId;
        this.title = title;
    }

    public String getVideoId() {
        return videoId;
    }

    public String getInstanceDomain() {
        return instanceDomain;
    }

    public String getUuid() {
        return uuid;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getTitle() {
        return title;
    }

    public String key() {
        return VideoKeys.likeKey(videoId, instanceDomain);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof VideoIdentity that)) {
            return false;
        }
        return Objects.equals(videoId, that.videoId) && Objects.equals(instanceDomain, that.instanceDomain);
    }

    @Override
    public int hashCode() {
        return Objects.hash(videoId, instanceDomain);
    }

    @Override
    public String toString() {
        return videoId + "@" + instanceDomain;
    }
}
