package com.vigil.service.core.pipeline;

import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.event.AnomalyEvent;
import com.vigil.service.core.priority.PriorityScorer;
import java.util.ArrayList;
import java.util.List;

/** Batch outcome; {@code results} follows the request order of the series. */
public record BatchDetectionResult(String method, Sensitivity sensitivity, List<SeriesDetection> results) {

    public BatchDetectionResult {
        results = List.copyOf(results);
    }

    public int totalSeries() {
        return results.size();
    }

    public int totalAnomalies() {
        return results.stream().mapToInt(SeriesDetection::anomalyCount).sum();
    }

    public int totalEvents() {
        return results.stream().mapToInt(r -> r.events().size()).sum();
    }

    /** Events of every series, highest priority first. */
    public List<AnomalyEvent> rankedEvents() {
        List<AnomalyEvent> all = new ArrayList<>();
        results.forEach(r -> all.addAll(r.events()));
        return PriorityScorer.rank(all);
    }
}
