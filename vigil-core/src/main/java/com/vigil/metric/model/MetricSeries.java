package com.vigil.metric.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered observations of one metric on one resource. The point list is copied on construction,
 * so a submitted series cannot change underneath a running detection.
 */
public record MetricSeries(String resourceId, String metricName, List<MetricPoint> points) {

    public MetricSeries {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(metricName, "metricName");
        points = List.copyOf(Objects.requireNonNull(points, "points"));
    }

    public int size() {
        return points.size();
    }

    public StreamKey streamKey() {
        return new StreamKey(resourceId, metricName);
    }

    public Instant timestamp(int index) {
        return points.get(index).timestamp();
    }

    public double value(int index) {
        return points.get(index).value();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    /** Median spacing between consecutive points, or {@link Duration#ZERO} for fewer than two points. */
    public Duration medianInterval() {
        if (points.size() < 2) {
            return Duration.ZERO;
        }
        long[] gaps = new long[points.size() - 1];
        for (int i = 1; i < points.size(); i++) {
            gaps[i - 1] = Duration.between(timestamp(i - 1), timestamp(i)).toNanos();
        }
        Arrays.sort(gaps);
        int mid = gaps.length / 2;
        long median = gaps.length % 2 == 1 ? gaps[mid] : gaps[mid - 1] + (gaps[mid] - gaps[mid - 1]) / 2;
        return Duration.ofNanos(Math.max(0, median));
    }
}
