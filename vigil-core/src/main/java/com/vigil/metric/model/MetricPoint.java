package com.vigil.metric.model;

import java.time.Instant;
import java.util.Objects;

/** A single observation of a metric. */
public record MetricPoint(Instant timestamp, double value) {

    public MetricPoint {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static MetricPoint of(Instant timestamp, double value) {
        return new MetricPoint(timestamp, value);
    }
}
