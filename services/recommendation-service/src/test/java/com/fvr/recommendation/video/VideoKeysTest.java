package com.fvr.recommendation.video;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class VideoKeysTest {

    @Test
    void identityKeyIsIdAndInstance() {
        VideoIdentity identity = new VideoIdentity("42", "tube.example", "u-1", "chan", "Title");

        assertThat(identity.key()).isEqualTo("42::tube.example");
        assertThat(identity).isEqualTo(new VideoIdentity("42", "tube.example"));
    }

    @Test
    void authorKeyIsAbsentForBlankChannel() {
        assertThat(VideoKeys.authorKey("chan", "tube.example")).isEqualTo("chan::tube.example");
        assertThat(VideoKeys.authorKey("  ", "tube.example")).isNull();
        assertThat(VideoKeys.authorKey(null, "tube.example")).isNull();
    }

    @Test
    void candidateRowFromRowSeparatesRowId() {
        CandidateRow row = CandidateRow.fromRow(new LinkedHashMap<>(Map.of(
            "row_id", 7L, "video_id", "v1", "instance_domain", "a.example", "channel_id", "c1")));

        assertThat(row.getRowId()).isEqualTo(7L);
        assertThat(row.getMetadata()).doesNotContainKey("row_id");
        assertThat(row.authorKey()).isEqualTo("c1::a.example");
    }
}
