package com.vigil.service.core.repo;

import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.metric.model.Sensitivity;
import com.vigil.metric.model.StreamKey;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryDetectionHistoryRepositoryTest {

    private static final Instant T0 = Instant.parse("2025-12-28T22:00:00Z");

    private static DetectionHistoryEntry entry(String metric, int anomalies, int second) {
        return new DetectionHistoryEntry(
                "pod-web-001", metric, "z-score", Sensitivity.MEDIUM, 10, anomalies, anomalies * 10.0, 3, T0.plusSeconds(second));
    }

    @Test
    void returnsMostRecentRunsOfTheStreamFirst() {
        InMemoryDetectionHistoryRepository repository = new InMemoryDetectionHistoryRepository();
        repository.record(entry("cpu", 1, 0));
        repository.record(entry("memory", 2, 1));
        repository.record(entry("cpu", 3, 2));
        repository.record(entry("cpu", 4, 3));

        assertThat(repository.findRecent(new StreamKey("pod-web-001", "cpu"), 2))
                .extracting(DetectionHistoryEntry::anomalyCount)
                .containsExactly(4, 3);
        assertThat(repository.findRecent(new StreamKey("pod-web-001", "disk"), 5)).isEmpty();
    }
}
