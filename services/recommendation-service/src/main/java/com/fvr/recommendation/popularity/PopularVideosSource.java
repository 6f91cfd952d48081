package com.fvr.recommendation.popularity;

import com.fvr.recommendation.common.ResourceLocks;
import com.fvr.recommendation.config.SimilarityProperties;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.VideoRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class PopularVideosSource {
    static final String LAYER = "popular";

    private final PopularityRepository popularityRepository;
    private final VideoRepository videoRepository;
    private final ResourceLocks locks;
    private final SimilarityProperties similarityProperties;

    public PopularVideosSource(
        PopularityRepository popularityRepository,
        VideoRepository videoRepository,
        ResourceLocks locks,
        SimilarityProperties similarityProperties
    ) {
        this.popularityRepository = popularityRepository;
        this.videoRepository = videoRepository;
        this.locks = locks;
        this.similarityProperties = similarityProperties;
    }

    public List<CandidateRow> topPopular(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int threshold = similarityProperties.getVideoErrorThreshold();
        return locks.withMetadata(() -> {
            List<Long> rowIds = popularityRepository.findPopularRowIds(limit, threshold);
            Map<Long, CandidateRow> metadata = videoRepository.findByRowIds(rowIds, threshold);
            List<CandidateRow> rows = new ArrayList<>(rowIds.size());
            for (Long rowId : rowIds) {
                CandidateRow row = metadata.get(rowId);
                if (row == null) {
                    continue;
                }
                CandidateRow copy = row.copy();
                copy.setLayer(LAYER);
                Object popularity = row.getMetadata().get("popularity");
                if (popularity instanceof Number number) {
                    copy.setPopularityScore(number.doubleValue());
                }
                rows.add(copy);
            }
            return rows;
        });
    }
}
