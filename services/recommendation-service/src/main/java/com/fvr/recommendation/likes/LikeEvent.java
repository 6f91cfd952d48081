package com.fvr.recommendation.likes;

import com.fvr.recommendation.video.VideoIdentity;

public class LikeEvent {
    private final String userId;
    private final VideoIdentity video;
    private final long updatedAt;

    public LikeEvent(String userId, VideoIdentity video, long updatedAt) {
        this.userId = userId;
        this.video = video;
        this.updatedAt = updatedAt;
    }

    public String getUserId() {
        return userId;
    }

    public VideoIdentity getVideo() {
        return video;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }
}
