package com.vigil.service.core.pipeline;

import com.vigil.metric.model.MetricSeries;
import com.vigil.service.core.detect.DetectionResult;
import com.vigil.service.core.event.AnomalyEvent;
import java.util.List;
import java.util.Objects;

/**
 * Per-series outcome inside a batch. {@code result} and {@code events} are only populated for
 * {@link SeriesStatus#OK}; failed series carry the error code and message instead.
 */
public record SeriesDetection(
        MetricSeries series,
        SeriesStatus status,
        DetectionResult result,
        List<AnomalyEvent> events,
        String errorCode,
        String error,
        long detectionTimeMs) {

    public SeriesDetection {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(status, "status");
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static SeriesDetection ok(DetectionResult result, List<AnomalyEvent> events, long detectionTimeMs) {
        return new SeriesDetection(result.series(), SeriesStatus.OK, result, events, null, null, detectionTimeMs);
    }

    public static SeriesDetection failed(
            MetricSeries series, SeriesStatus status, String errorCode, String error, long detectionTimeMs) {
        return new SeriesDetection(series, status, null, List.of(), errorCode, error, detectionTimeMs);
    }

    public static SeriesDetection timedOut(MetricSeries series, long elapsedMs) {
        return failed(series, SeriesStatus.TIMED_OUT, "timed-out", "detection did not finish before the request deadline", elapsedMs);
    }

    public boolean isOk() {
        return status == SeriesStatus.OK;
    }

    public int anomalyCount() {
        return result == null ? 0 : result.anomalyCount();
    }

    public double anomalyPercentage() {
        if (result == null || result.size() == 0) {
            return 0.0;
        }
        return Math.round(result.anomalyCount() * 10000.0 / result.size()) / 100.0;
    }
}
