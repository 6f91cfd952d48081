package com.fvr.recommendation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "popularity")
public class PopularityProperties {
    private double likeWeight = 5.0;
    private boolean jobEnabled = false;
    private long jobDelayMs = 3_600_000L;
    private int batchSize = 1000;
    private boolean incremental = true;

    public double getLikeWeight() {
        return likeWeight;
    }

    public void setLikeWeight(double likeWeight) {
        this.likeWeight = likeWeight;
    }

    public boolean isJobEnabled() {
        return jobEnabled;
    }

    public void setJobEnabled(boolean jobEnabled) {
        this.jobEnabled = jobEnabled;
    }

    public long getJobDelayMs() {
        return jobDelayMs;
    }

    public void setJobDelayMs(long jobDelayMs) {
        this.jobDelayMs = jobDelayMs;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public boolean isIncremental() {
        return incremental;
    }

    public void setIncremental(boolean incremental) {
        this.incremental = incremental;
    }
}
