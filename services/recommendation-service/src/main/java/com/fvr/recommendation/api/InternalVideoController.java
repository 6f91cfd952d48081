package com.fvr.recommendation.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fvr.recommendation.common.JdbcUtils;
import com.fvr.recommendation.common.NotFoundException;
import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.common.ValidationException;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoIdentity;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Identity and metadata lookups for trusted internal callers.
 */
@RestController
@RequestMapping("/internal/videos")
public class InternalVideoController {
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final SimilarityProperties similarityProperties;

    public InternalVideoController(
        VideoRepository videoRepository,
        ResourceLocks locks,
        SimilarityProperties similarityProperties
    ) {
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.similarityProperties = similarityProperties;
    }

    @PostMapping("/resolve")
    public Map<String, Object> resolve(@RequestBody(required = false) ResolveRequest request) {
        String videoId = request == null ? null : JdbcUtils.trimToNull(request.videoId);
        String uuid = request == null ? null : JdbcUtils.trimToNull(request.uuid);
        String host = request == null ? null : JdbcUtils.trimToNull(request.host);
        if (videoId == null && uuid == null) {
            throw new ValidationException("Missing video_id or uuid");
        }
        VideoIdentity identity = locks.withMetadata(() -> {
            Optional<VideoIdentity> found = Optional.empty();
            if (uuid != null) {
                found = videoRepository.resolveIdentity(null, uuid, host);
            }
            if (found.isEmpty() && videoId != null) {
                found = videoRepository.resolveIdentity(videoId, null, host);
            }
            return found;
        }).orElseThrow(() -> new NotFoundException("Video not found"));

        Map<String, Object> video = new LinkedHashMap<>();
        video.put("video_id", identity.getVideoId());
        video.put("video_uuid", identity.getUuid());
        video.put("instance_domain", identity.getInstanceDomain());
        video.put("channel_id", identity.getChannelId());
        video.put("title", identity.getTitle());
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("video", video);
        return response;
    }

    @PostMapping("/metadata")
    public Map<String, Object> metadata(@RequestBody(required = false) MetadataRequest request) {
        if (request == null || request.entries == null) {
            throw new ValidationException("Missing entries");
        }
        Map<String, VideoIdentity> entries = new LinkedHashMap<>();
        for (EntryRequest entry : request.entries) {
            String videoId = entry == null ? null : JdbcUtils.trimToNull(entry.videoId);
            String instance = entry == null ? null : JdbcUtils.trimToNull(entry.instanceDomain);
            if (videoId == null || instance == null) {
                continue;
            }
            VideoIdentity identity = new VideoIdentity(videoId, instance);
            entries.putIfAbsent(identity.key(), identity);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        if (!entries.isEmpty()) {
            Map<String, CandidateRow> found = locks.withMetadata(() -> videoRepository.findByKeys(
                entries.values(), similarityProperties.getVideoErrorThreshold()));
            for (String key : entries.keySet()) {
                CandidateRow row = found.get(key);
                if (row != null) {
                    rows.add(row.getMetadata());
                }
            }
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("count", rows.size());
        response.put("rows", rows);
        return response;
    }

    public static class ResolveRequest {
        @JsonProperty("video_id")
        public String videoId;
        public String uuid;
        public String host;
    }

    public static class MetadataRequest {
        public List<EntryRequest> entries;
    }

    public static class EntryRequest {
        @JsonProperty("video_id")
        public String videoId;
        @JsonProperty("instance_domain")
        public String instanceDomain;
    }
}
