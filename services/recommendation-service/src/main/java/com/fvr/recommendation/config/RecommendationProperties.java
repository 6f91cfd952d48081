package com.fvr.recommendation.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recommendation")
public class RecommendationProperties {
    private int defaultLimit = 50;
    private int maxLimit = 500;
    private int maxLikes = 100;
    private int maxLikesForRecs = 25;
    private int similarPerLike = 20;
    private String defaultProfile = "home";
    private boolean useClientLikes = false;
    private int clientLikesMax = 200;
    private boolean debugEnabled = false;
    private boolean refreshCache = false;
    private String similarSource = "ann";
    private String fallbackSource;
    private int freshPoolSize = 0;
    private Map<String, Profile> profiles = new LinkedHashMap<>();

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getMaxLikes() {
        return maxLikes;
    }

    public void setMaxLikes(int maxLikes) {
        this.maxLikes = maxLikes;
    }

    public int getMaxLikesForRecs() {
        return maxLikesForRecs;
    }

    public void setMaxLikesForRecs(int maxLikesForRecs) {
        this.maxLikesForRecs = maxLikesForRecs;
    }

    public int getSimilarPerLike() {
        return similarPerLike;
    }

    public void setSimilarPerLike(int similarPerLike) {
        this.similarPerLike = similarPerLike;
    }

    public String getDefaultProfile() {
        return defaultProfile;
    }

    public void setDefaultProfile(String defaultProfile) {
        this.defaultProfile = defaultProfile;
    }

    public boolean isUseClientLikes() {
        return useClientLikes;
    }

    public void setUseClientLikes(boolean useClientLikes) {
        this.useClientLikes = useClientLikes;
    }

    public int getClientLikesMax() {
        return clientLikesMax;
    }

    public void setClientLikesMax(int clientLikesMax) {
        this.clientLikesMax = clientLikesMax;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public void setDebugEnabled(boolean debugEnabled) {
        this.debugEnabled = debugEnabled;
    }

    public boolean isRefreshCache() {
        return refreshCache;
    }

    public void setRefreshCache(boolean refreshCache) {
        this.refreshCache = refreshCache;
    }

    public String getSimilarSource() {
        return similarSource;
    }

    public void setSimilarSource(String similarSource) {
        this.similarSource = similarSource;
    }

    public String getFallbackSource() {
        return fallbackSource;
    }

    public void setFallbackSource(String fallbackSource) {
        this.fallbackSource = fallbackSource;
    }

    public int getFreshPoolSize() {
        return freshPoolSize;
    }

    public void setFreshPoolSize(int freshPoolSize) {
        this.freshPoolSize = freshPoolSize;
    }

    public Map<String, Profile> getProfiles() {
        return profiles;
    }

    public void setProfiles(Map<String, Profile> profiles) {
        this.profiles = profiles;
    }

    public static class Profile {
        private int batchSize = 0;
        private int maxPerAuthor = 0;
        private int maxPerInstance = 0;
        private boolean backfillPopular = false;
        private String similarSource;
        private double overfetchFactor = 1.0;
        private Map<String, Layer> layers = new LinkedHashMap<>();
        private List<String> mixOrder = new ArrayList<>();
        private SoftCaps softCaps = new SoftCaps();
        private Scoring scoring = new Scoring();
        private Explore explore = new Explore();
        private Personalization personalization = new Personalization();

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxPerAuthor() {
            return maxPerAuthor;
        }

        public void setMaxPerAuthor(int maxPerAuthor) {
            this.maxPerAuthor = maxPerAuthor;
        }

        public int getMaxPerInstance() {
            return maxPerInstance;
        }

        public void setMaxPerInstance(int maxPerInstance) {
            this.maxPerInstance = maxPerInstance;
        }

        public boolean isBackfillPopular() {
            return backfillPopular;
        }

        public void setBackfillPopular(boolean backfillPopular) {
            this.backfillPopular = backfillPopular;
        }

        public String getSimilarSource() {
            return similarSource;
        }

        public void setSimilarSource(String similarSource) {
            this.similarSource = similarSource;
        }

        public double getOverfetchFactor() {
            return overfetchFactor;
        }

        public void setOverfetchFactor(double overfetchFactor) {
            this.overfetchFactor = overfetchFactor;
        }

        /**
         * Candidate layers in configuration order. Empty means a single
         * {@code exploit} layer with default settings.
         */
        public Map<String, Layer> getLayers() {
            return layers;
        }

        public void setLayers(Map<String, Layer> layers) {
            this.layers = layers;
        }

        public List<String> getMixOrder() {
            return mixOrder;
        }

        public void setMixOrder(List<String> mixOrder) {
            this.mixOrder = mixOrder;
        }

        public SoftCaps getSoftCaps() {
            return softCaps;
        }

        public void setSoftCaps(SoftCaps softCaps) {
            this.softCaps = softCaps;
        }

        public Scoring getScoring() {
            return scoring;
        }

        public void setScoring(Scoring scoring) {
            this.scoring = scoring;
        }

        public Explore getExplore() {
            return explore;
        }

        public void setExplore(Explore explore) {
            this.explore = explore;
        }

        public Personalization getPersonalization() {
            return personalization;
        }

        public void setPersonalization(Personalization personalization) {
            this.personalization = personalization;
        }
    }

    public static class Personalization {
        private boolean enabled = false;
        private double alpha = 1.0;
        private double beta = 0.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getAlpha() {
            return alpha;
        }

        public void setAlpha(double alpha) {
            this.alpha = alpha;
        }

        public double getBeta() {
            return beta;
        }

        public void setBeta(double beta) {
            this.beta = beta;
        }
    }

    public static class Layer {
        private boolean enabled = true;
        private boolean requiresLikes = false;
        private double gatherRatio = 0.0;
        private double mixRatio = 0.0;
        private boolean shuffle = false;
        private int poolSize = 0;
        private int maxPerAuthor = 0;
        private int maxPerInstance = 0;
        private double similarityMin = 0.0;
        private double similarityMax = 1.0;
        private boolean belowExploreMin = false;
        private double exploreMin = 0.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRequiresLikes() {
            return requiresLikes;
        }

        public void setRequiresLikes(boolean requiresLikes) {
            this.requiresLikes = requiresLikes;
        }

        public double getGatherRatio() {
            return gatherRatio;
        }

        public void setGatherRatio(double gatherRatio) {
            this.gatherRatio = gatherRatio;
        }

        public double getMixRatio() {
            return mixRatio;
        }

        public void setMixRatio(double mixRatio) {
            this.mixRatio = mixRatio;
        }

        public boolean isShuffle() {
            return shuffle;
        }

        public void setShuffle(boolean shuffle) {
            this.shuffle = shuffle;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getMaxPerAuthor() {
            return maxPerAuthor;
        }

        public void setMaxPerAuthor(int maxPerAuthor) {
            this.maxPerAuthor = maxPerAuthor;
        }

        public int getMaxPerInstance() {
            return maxPerInstance;
        }

        public void setMaxPerInstance(int maxPerInstance) {
            this.maxPerInstance = maxPerInstance;
        }

        public double getSimilarityMin() {
            return similarityMin;
        }

        public void setSimilarityMin(double similarityMin) {
            this.similarityMin = similarityMin;
        }

        public double getSimilarityMax() {
            return similarityMax;
        }

        public void setSimilarityMax(double similarityMax) {
            this.similarityMax = similarityMax;
        }

        public boolean isBelowExploreMin() {
            return belowExploreMin;
        }

        public void setBelowExploreMin(boolean belowExploreMin) {
            this.belowExploreMin = belowExploreMin;
        }

        public double getExploreMin() {
            return exploreMin;
        }

        public void setExploreMin(double exploreMin) {
            this.exploreMin = exploreMin;
        }
    }

    /**
     * Per-layer floors and ceilings applied after mixing. Zero or missing means no cap.
     */
    public static class SoftCaps {
        private Map<String, Integer> min = new LinkedHashMap<>();
        private Map<String, Integer> max = new LinkedHashMap<>();

        public Map<String, Integer> getMin() {
            return min;
        }

        public void setMin(Map<String, Integer> min) {
            this.min = min;
        }

        public Map<String, Integer> getMax() {
            return max;
        }

        public void setMax(Map<String, Integer> max) {
            this.max = max;
        }
    }

    public static class Scoring {
        private double similarityWeight = 1.0;
        private double freshnessWeight = 0.0;
        private double popularityWeight = 0.0;
        private Map<String, Double> layerWeights = new LinkedHashMap<>();
        private double freshnessHalfLifeDays = 14.0;
        private double popularityViews = 1.0;
        private double popularityLikes = 2.0;

        public double getSimilarityWeight() {
            return similarityWeight;
        }

        public void setSimilarityWeight(double similarityWeight) {
            this.similarityWeight = similarityWeight;
        }

        public double getFreshnessWeight() {
            return freshnessWeight;
        }

        public void setFreshnessWeight(double freshnessWeight) {
            this.freshnessWeight = freshnessWeight;
        }

        public double getPopularityWeight() {
            return popularityWeight;
        }

        public void setPopularityWeight(double popularityWeight) {
            this.popularityWeight = popularityWeight;
        }

        public Map<String, Double> getLayerWeights() {
            return layerWeights;
        }

        public void setLayerWeights(Map<String, Double> layerWeights) {
            this.layerWeights = layerWeights;
        }

        public double getFreshnessHalfLifeDays() {
            return freshnessHalfLifeDays;
        }

        public void setFreshnessHalfLifeDays(double freshnessHalfLifeDays) {
            this.freshnessHalfLifeDays = freshnessHalfLifeDays;
        }

        public double getPopularityViews() {
            return popularityViews;
        }

        public void setPopularityViews(double popularityViews) {
            this.popularityViews = popularityViews;
        }

        public double getPopularityLikes() {
            return popularityLikes;
        }

        public void setPopularityLikes(double popularityLikes) {
            this.popularityLikes = popularityLikes;
        }
    }

    /**
     * Explore/exploit split for single-list ranking. A ratio of zero keeps the
     * list in score order (with optional jitter).
     */
    public static class Explore {
        private double ratio = 0.0;
        private double similarityMin = 0.0;
        private double similarityMax = 1.0;
        private int jitterWindow = 0;

        public double getRatio() {
            return ratio;
        }

        public void setRatio(double ratio) {
            this.ratio = ratio;
        }

        public double getSimilarityMin() {
            return similarityMin;
        }

        public void setSimilarityMin(double similarityMin) {
            this.similarityMin = similarityMin;
        }

        public double getSimilarityMax() {
            return similarityMax;
        }

        public void setSimilarityMax(double similarityMax) {
            this.similarityMax = similarityMax;
        }

        public int getJitterWindow() {
            return jitterWindow;
        }

        public void setJitterWindow(int jitterWindow) {
            this.jitterWindow = jitterWindow;
        }
    }
}
