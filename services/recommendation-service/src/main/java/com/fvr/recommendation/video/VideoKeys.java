package com.fvr.recommendation.video;

public final class VideoKeys {
    private VideoKeys() {
    }

    public static String likeKey(String videoId, String instanceDomain) {
        return (videoId == null ? "" : videoId) + "::" + (instanceDomain == null ? "" : instanceDomain);
    }

    public static String uuidKey(String videoUuid, String instanceDomain) {
        return "uuid::" + videoUuid + "::" + (instanceDomain == null ? "" : instanceDomain);
    }

    /** Returns null when the channel is unknown; such rows are never author-capped. */
    public static String authorKey(String channelId, String instanceDomain) {
        if (channelId == null || channelId.isBlank()) {
            return null;
        }
        return channelId + "::" + (instanceDomain == null ? "" : instanceDomain);
    }
}
