package com.vigil.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response of {@code POST /api/detect}. {@code results} follows the request order;
 * {@code grouped_events} lists every event of the batch, highest priority first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DetectionResponse(
        String method,
        String sensitivity,
        int totalSeries,
        int totalAnomalies,
        int totalEvents,
        List<SeriesResult> results,
        List<EventResult> groupedEvents) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SeriesResult(
            String resourceId,
            String metricName,
            String status,
            String errorCode,
            String error,
            int anomalyCount,
            int totalPoints,
            double anomalyPercentage,
            long detectionTimeMs,
            List<PointResult> points,
            List<EventResult> events) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PointResult(
            Instant timestamp, double value, double score, @JsonProperty("is_anomaly") boolean isAnomaly, String reason) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record EventResult(
            UUID id,
            String resourceId,
            String metricName,
            Instant start,
            Instant end,
            double durationSeconds,
            double peakScore,
            Instant peakTime,
            double peakValue,
            double averageScore,
            int pointCount,
            String method,
            String priority,
            Double priorityScore) {}
}
