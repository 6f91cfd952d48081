package com.fvr.recommendation.ann;

import com.fvr.recommendation.video.VideoIdentity;

/**
 * One ranked neighbour of a seed video. Ranks are dense and start at 1.
 */
public class SimilarItem {
    private final VideoIdentity video;
    private final double score;
    private final int rank;

    public SimilarItem(VideoIdentity video, double score, int rank) {
        this.video = video;
        this.score = score;
        this.rank = rank;
    }

    public VideoIdentity getVideo() {
        return video;
    }

    public double getScore() {
        return score;
    }

    public int getRank() {
        return rank;
    }
}
