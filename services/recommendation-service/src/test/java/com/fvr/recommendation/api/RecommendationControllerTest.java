package com.fvr.recommendation.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fvr.recommendation.common.ApiException;
import com.fvr.recommendation.common.NotFoundException;
import com.fvr.recommendation.common.RecommendationRequestContextFilter;
import com.fvr.recommendation.common.StorageException;
import com.fvr.recommendation.service.RecommendationQuery;
import com.fvr.recommendation.service.RecommendationResult;
import com.fvr.recommendation.service.RecommendationService;
import com.fvr.recommendation.service.RelatedQuery;
import com.fvr.recommendation.video.CandidateRow;
import com.fvr.recommendation.video.TestRows;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {
    @Mock
    private RecommendationService recommendationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        RecommendationController controller = new RecommendationController(recommendationService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .addFilter(new RecommendationRequestContextFilter())
            .build();
    }

    @Test
    void recommendMapsBodyAndRendersRows() throws Exception {
        CandidateRow row = TestRows.scored(1, "a", "x.example", "c1", 0.5);
        row.setRank(1);
        when(recommendationService.recommend(any())).thenReturn(
            new RecommendationResult(List.of(row), Map.of("mode", "home"), false, 1000L, 42L));

        String body = "{\"user_id\":\"u1\",\"limit\":10,\"refresh_cache\":true,"
            + "\"likes\":[{\"uuid\":\"uuid-1\",\"host\":\"x.example\"}]}";

        mockMvc.perform(post("/recommendations").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(header().exists("x-request-id"))
            .andExpect(jsonPath("$.generated_at").value(1000))
            .andExpect(jsonPath("$.total").value(42))
            .andExpect(jsonPath("$.count").value(1))
            .andExpect(jsonPath("$.seed.mode").value("home"))
            .andExpect(jsonPath("$.rows[0].video_id").value("a"))
            .andExpect(jsonPath("$.rows[0].rank").value(1))
            .andExpect(jsonPath("$.rows[0].debug").doesNotExist());

        ArgumentCaptor<RecommendationQuery> captor = ArgumentCaptor.forClass(RecommendationQuery.class);
        verify(recommendationService).recommend(captor.capture());
        RecommendationQuery query = captor.getValue();
        assertThat(query.getUserId()).isEqualTo("u1");
        assertThat(query.getLimit()).isEqualTo(10);
        assertThat(query.isRefreshCache()).isTrue();
        assertThat(query.isDebug()).isFalse();
        assertThat(query.getLikes()).hasSize(1);
        assertThat(query.getLikes().get(0).getHost()).isEqualTo("x.example");
    }

    @Test
    void similarByIdParsesFlags() throws Exception {
        when(recommendationService.related(any())).thenReturn(
            new RecommendationResult(List.of(), Map.of(), false, 1000L, 0L));

        mockMvc.perform(get("/videos/v1/similar")
                .param("host", "x.example")
                .param("limit", "5")
                .param("refresh_cache", "yes")
                .param("debug", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.count").value(0));

        ArgumentCaptor<RelatedQuery> captor = ArgumentCaptor.forClass(RelatedQuery.class);
        verify(recommendationService).related(captor.capture());
        assertThat(captor.getValue().getVideoId()).isEqualTo("v1");
        assertThat(captor.getValue().getHost()).isEqualTo("x.example");
        assertThat(captor.getValue().getLimit()).isEqualTo(5);
        assertThat(captor.getValue().isRefreshCache()).isTrue();
        assertThat(captor.getValue().isDebug()).isFalse();
    }

    @Test
    void similarByVectorPassesFloats() throws Exception {
        when(recommendationService.related(any())).thenReturn(
            new RecommendationResult(List.of(), Map.of("vector", true), false, 1000L, 0L));

        mockMvc.perform(post("/videos/similar")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vector\":[0.5,1.5,-2]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.seed.vector").value(true));

        ArgumentCaptor<RelatedQuery> captor = ArgumentCaptor.forClass(RelatedQuery.class);
        verify(recommendationService).related(captor.capture());
        assertThat(captor.getValue().getVector()).containsExactly(0.5f, 1.5f, -2f);
    }

    @Test
    void invalidJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/recommendations").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"))
            .andExpect(jsonPath("$.error.message").value("Invalid JSON body"));
    }

    @Test
    void nonNumericLimitIsBadRequest() throws Exception {
        mockMvc.perform(get("/videos/v1/similar").param("limit", "many"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
    }

    @Test
    void missingSeedIsNotFound() throws Exception {
        when(recommendationService.related(any())).thenThrow(new NotFoundException("Video not found"));

        mockMvc.perform(get("/videos/missing/similar"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("not_found"))
            .andExpect(jsonPath("$.request_id").exists());
    }

    @Test
    void disabledDebugIsForbidden() throws Exception {
        when(recommendationService.recommend(any())).thenThrow(
            new ApiException(HttpStatus.FORBIDDEN, "forbidden", "Debug mode is disabled"));

        mockMvc.perform(post("/recommendations").contentType(MediaType.APPLICATION_JSON).content("{\"debug\":true}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error.code").value("forbidden"));
    }

    @Test
    void storageFailureIsGenericServerError() throws Exception {
        when(recommendationService.recommend(any())).thenThrow(
            new StorageException("boom", new IllegalStateException("db")));

        mockMvc.perform(post("/recommendations").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error.code").value("internal_error"))
            .andExpect(jsonPath("$.error.message").value("Storage error"));
    }

    @Test
    void parsesTruthyFlags() {
        assertThat(RecommendationController.parseFlag(" TRUE ")).isTrue();
        assertThat(RecommendationController.parseFlag("on")).isTrue();
        assertThat(RecommendationController.parseFlag("1")).isTrue();
        assertThat(RecommendationController.parseFlag("nope")).isFalse();
        assertThat(RecommendationController.parseFlag(null)).isFalse();
    }
}
