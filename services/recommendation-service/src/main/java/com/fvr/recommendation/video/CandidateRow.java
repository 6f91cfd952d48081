package com.fvr.recommendation.video;

import com.fvr.recommendation.common.JdbcUtils;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One video under consideration within a single request: the metadata row as
 * read from storage plus the score, rank and provenance attached by the
 * pipeline stages.
 */
public class CandidateRow {
    /**
     * Metadata columns exposed to clients. Internal columns such as channel_id,
     * popularity and the embedding model stay server side.
     */
    public static final List<String> RESPONSE_FIELDS = List.of(
        "video_id",
        "video_uuid",
        "instance_domain",
        "title",
        "thumbnail_url",
        "preview_path",
        "channel_avatar_url",
        "channel_name",
        "channel_display_name",
        "channel_url",
        "published_at",
        "duration",
        "video_url",
        "embed_path",
        "views",
        "likes"
    );

    private final Long rowId;
    private final Map<String, Object> metadata;
    private Double score;
    private Integer rank;
    private Double similarityScore;
    private Double poolMin;
    private Double poolMax;
    private String layer;
    private Integer rankBefore;
    private Integer rankAfter;
    private String profile;
    private Double popularityScore;
    private Double affinity;
    private Double freshnessScore;
    private Double exploreMin;
    private Double exploreMax;
    private Boolean exploreEmpty;
    private Integer explorePoolSize;
    private Integer exploreInRange;
    private String bucket;

    public CandidateRow(Long rowId, Map<String, Object> metadata) {
        this.rowId = rowId;
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CandidateRow fromRow(Map<String, Object> row) {
        Map<String, Object> metadata = new LinkedHashMap<>(row);
        Long rowId = JdbcUtils.asLong(metadata.remove("row_id"));
        return new CandidateRow(rowId, metadata);
    }

    public CandidateRow copy() {
        CandidateRow copy = new CandidateRow(rowId, metadata);
        copy.score = score;
        copy.rank = rank;
        copy.similarityScore = similarityScore;
        copy.poolMin = poolMin;
        copy.poolMax = poolMax;
        copy.layer = layer;
        copy.rankBefore = rankBefore;
        copy.rankAfter = rankAfter;
        copy.profile = profile;
        copy.popularityScore = popularityScore;
        copy.affinity = affinity;
        copy.freshnessScore = freshnessScore;
        copy.exploreMin = exploreMin;
        copy.exploreMax = exploreMax;
        copy.exploreEmpty = exploreEmpty;
        copy.explorePoolSize = explorePoolSize;
        copy.exploreInRange = exploreInRange;
        copy.bucket = bucket;
        return copy;
    }

    public Long getRowId() {
        return rowId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String videoId() {
        return JdbcUtils.asString(metadata.get("video_id"));
    }

    public String videoUuid() {
        return JdbcUtils.asString(metadata.get("video_uuid"));
    }

    public String instanceDomain() {
        String domain = JdbcUtils.asString(metadata.get("instance_domain"));
        return domain == null ? "" : domain;
    }

    public String channelId() {
        return JdbcUtils.asString(metadata.get("channel_id"));
    }

    public String likeKey() {
        return VideoKeys.likeKey(videoId(), instanceDomain());
    }

    public String authorKey() {
        return VideoKeys.authorKey(channelId(), instanceDomain());
    }

    public VideoIdentity identity() {
        return new VideoIdentity(
            videoId(),
            instanceDomain(),
            videoUuid(),
            channelId(),
            JdbcUtils.asString(metadata.get("title"))
        );
    }

    public Double getScore() {
        return score;
    }

    public void setScore(Double score) {
        this.score = score;
    }

    public Integer getRank() {
        return rank;
    }

    public void setRank(Integer rank) {
        this.rank = rank;
    }

    public Double getSimilarityScore() {
        return similarityScore;
    }

    public void setSimilarityScore(Double similarityScore) {
        this.similarityScore = similarityScore;
    }

    public Double getPoolMin() {
        return poolMin;
    }

    public void setPoolMin(Double poolMin) {
        this.poolMin = poolMin;
    }

    public Double getPoolMax() {
        return poolMax;
    }

    public void setPoolMax(Double poolMax) {
        this.poolMax = poolMax;
    }

    public String getLayer() {
        return layer;
    }

    public void setLayer(String layer) {
        this.layer = layer;
    }

    public Integer getRankBefore() {
        return rankBefore;
    }

    public void setRankBefore(Integer rankBefore) {
        this.rankBefore = rankBefore;
    }

    public Integer getRankAfter() {
        return rankAfter;
    }

    public void setRankAfter(Integer rankAfter) {
        this.rankAfter = rankAfter;
    }

    public String getProfile() {
        return profile;
    }

    public void setProfile(String profile) {
        this.profile = profile;
    }

    public Double getPopularityScore() {
        return popularityScore;
    }

    public void setPopularityScore(Double popularityScore) {
        this.popularityScore = popularityScore;
    }

    public Double getAffinity() {
        return affinity;
    }

    public void setAffinity(Double affinity) {
        this.affinity = affinity;
    }

    public Double getFreshnessScore() {
        return freshnessScore;
    }

    public void setFreshnessScore(Double freshnessScore) {
        this.freshnessScore = freshnessScore;
    }

    public Double getExploreMin() {
        return exploreMin;
    }

    public void setExploreMin(Double exploreMin) {
        this.exploreMin = exploreMin;
    }

    public Double getExploreMax() {
        return exploreMax;
    }

    public void setExploreMax(Double exploreMax) {
        this.exploreMax = exploreMax;
    }

    public Boolean getExploreEmpty() {
        return exploreEmpty;
    }

    public void setExploreEmpty(Boolean exploreEmpty) {
        this.exploreEmpty = exploreEmpty;
    }

    public Integer getExplorePoolSize() {
        return explorePoolSize;
    }

    public void setExplorePoolSize(Integer explorePoolSize) {
        this.explorePoolSize = explorePoolSize;
    }

    public Integer getExploreInRange() {
        return exploreInRange;
    }

    public void setExploreInRange(Integer exploreInRange) {
        this.exploreInRange = exploreInRange;
    }

    /** "explore" or "exploit" once the row has been through explore/exploit ranking. */
    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    /**
     * Projects the row onto {@link #RESPONSE_FIELDS}; {@code debug} is added only when requested.
     */
    public Map<String, Object> toResponse(boolean includeDebug) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String field : RESPONSE_FIELDS) {
            if (metadata.containsKey(field)) {
                out.put(field, metadata.get(field));
            }
        }
        if (score != null) {
            out.put("score", score);
        }
        if (rank != null) {
            out.put("rank", rank);
        }
        if (includeDebug) {
            Map<String, Object> debug = new LinkedHashMap<>();
            debug.put("score", score);
            debug.put("similarity_score", similarityScore);
            debug.put("similarity_pool_min", poolMin);
            debug.put("similarity_pool_max", poolMax);
            debug.put("freshness_score", freshnessScore);
            debug.put("popularity_score", popularityScore);
            debug.put("affinity", affinity);
            debug.put("layer", layer);
            debug.put("bucket", bucket);
            debug.put("rank_before", rankBefore);
            debug.put("rank_after", rankAfter);
            debug.put("profile", profile);
            debug.put("explore_min", exploreMin);
            debug.put("explore_max", exploreMax);
            debug.put("explore_empty", exploreEmpty);
            debug.put("explore_pool_size", explorePoolSize);
            debug.put("explore_in_range", exploreInRange);
            out.put("debug", debug);
        }
        return out;
    }
}
