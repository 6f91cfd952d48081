package com.fvr.recommendation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Graph construction parameters for the in-memory vector index.
 */
@ConfigurationProperties(prefix = "ann")
public class AnnProperties {
    private String similarityFunction = "DOT_PRODUCT";
    private int maxDegree = 32;
    private int beamWidth = 100;
    private float neighborOverflow = 1.2f;
    private float alpha = 1.2f;

    public String getSimilarityFunction() {
        return similarityFunction;
    }

    public void setSimilarityFunction(String similarityFunction) {
        this.similarityFunction = similarityFunction;
    }

    public int getMaxDegree() {
        return maxDegree;
    }

    public void setMaxDegree(int maxDegree) {
        this.maxDegree = maxDegree;
    }

    public int getBeamWidth() {
        return beamWidth;
    }

    public void setBeamWidth(int beamWidth) {
        this.beamWidth = beamWidth;
    }

    public float getNeighborOverflow() {
        return neighborOverflow;
    }

    public void setNeighborOverflow(float neighborOverflow) {
        this.neighborOverflow = neighborOverflow;
    }

    public float getAlpha() {
        return alpha;
    }

    public void setAlpha(float alpha) {
        this.alpha = alpha;
    }
}
