package com.fvr.recommendation.video;

/**
 * A video with its embedding, used as the query side of a similarity search.
 */
public class SeedVideo {
    private final long rowId;
    private final VideoIdentity identity;
    private final float[] embedding;

    public SeedVideo(long rowId, VideoIdentity identity, float[] embedding) {
        this.rowId = rowId;
        this.identity = identity;
        this.embedding = embedding;
    }

    public long getRowId() {
        return rowId;
    }

    public VideoIdentity getIdentity() {
        return identity;
    }

    public float[] getEmbedding() {
        return embedding;
    }

    public String authorKey() {
        return VideoKeys.authorKey(identity.getChannelId(), identity.getInstanceDomain());
    }
}
