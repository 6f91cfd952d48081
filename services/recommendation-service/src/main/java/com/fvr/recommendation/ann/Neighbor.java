package com.fvr.recommendation.ann;

public class Neighbor {
    private final long rowId;
    private final double score;

    public Neighbor(long rowId, double score) {
        this.rowId = rowId;
        this.score = score;
    }

    public long getRowId() {
        return rowId;
    }

    public double getScore() {
        return score;
    }
}
