package com.vigil.service.core.repo;

import com.vigil.metric.model.Sensitivity;
import java.time.Instant;

/** Summary of one detection run over one series. */
public record DetectionHistoryEntry(
        String resourceId,
        String metricName,
        String method,
        Sensitivity sensitivity,
        int totalPoints,
        int anomalyCount,
        double anomalyPercentage,
        long detectionTimeMs,
        Instant createdAt) {}
