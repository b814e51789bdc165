package com.vigil.controller.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.repo.DetectionHistoryEntry;
import com.vigil.service.core.repo.InMemoryDetectionHistoryRepository;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class HistoryControllerTest {

    private static final Instant T0 = Instant.parse("2025-12-28T22:00:00Z");

    private InMemoryDetectionHistoryRepository repository;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDetectionHistoryRepository();
        mvc = MockMvcBuilders.standaloneSetup(new HistoryController(repository))
                .setControllerAdvice(new RestErrorHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json()
                        .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                        .build()))
                .build();
    }

    private void record(String resource, String method, int anomalies, Instant at) {
        repository.record(new DetectionHistoryEntry(
                resource, "cpu", method, Sensitivity.HIGH, 10, anomalies, anomalies * 10.0, 3L, at));
    }

    @Test
    void listsRunsOfOneStreamNewestFirst() throws Exception {
        record("pod-web-001", "z-score", 1, T0);
        record("pod-web-002", "z-score", 4, T0.plusSeconds(30));
        record("pod-web-001", "isolation-forest", 2, T0.plusSeconds(60));

        mvc.perform(get("/api/history").param("resource_id", "pod-web-001").param("metric_name", "cpu"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].method").value("isolation-forest"))
                .andExpect(jsonPath("$[0].sensitivity").value("high"))
                .andExpect(jsonPath("$[0].anomaly_count").value(2))
                .andExpect(jsonPath("$[0].anomaly_percentage").value(20.0))
                .andExpect(jsonPath("$[0].created_at").value("2025-12-28T22:01:00Z"))
                .andExpect(jsonPath("$[1].method").value("z-score"));
    }

    @Test
    void limitCapsTheNumberOfRuns() throws Exception {
        for (int i = 0; i < 5; i++) {
            record("pod-web-001", "z-score", i, T0.plusSeconds(i));
        }

        mvc.perform(get("/api/history")
                        .param("resource_id", "pod-web-001")
                        .param("metric_name", "cpu")
                        .param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].anomaly_count").value(4));
    }

    @Test
    void rejectsOutOfRangeLimitAndMissingParameters() throws Exception {
        mvc.perform(get("/api/history")
                        .param("resource_id", "pod-web-001")
                        .param("metric_name", "cpu")
                        .param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid-input"))
                .andExpect(jsonPath("$.message").value("limit must be between 1 and 100 (got 0)"));
        mvc.perform(get("/api/history").param("resource_id", "pod-web-001"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid-input"));
        mvc.perform(get("/api/history")
                        .param("resource_id", "pod-web-001")
                        .param("metric_name", "cpu")
                        .param("limit", "many"))
                .andExpect(status().isBadRequest());
        mvc.perform(get("/api/history").param("resource_id", " ").param("metric_name", "cpu"))
                .andExpect(status().isBadRequest());
    }
}
