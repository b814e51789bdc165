package com.vigil.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/** One entry of {@code GET /api/history}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HistoryEntryInfo(
        String resourceId,
        String metricName,
        String method,
        String sensitivity,
        int totalPoints,
        int anomalyCount,
        double anomalyPercentage,
        long detectionTimeMs,
        Instant createdAt) {}
