package com.vigil.metric.validation;

import com.vigil.metric.model.MetricPoint;
import com.vigil.metric.model.MetricSeries;
import java.util.List;

/**
 * Structural checks: identifiers present, at least one point, finite values and strictly
 * increasing timestamps. Length against a detector's minimum is not checked here; that is a
 * per-series failure, not an envelope failure.
 */
public class DefaultSeriesValidator implements SeriesValidator {

    @Override
    public void validate(MetricSeries series) {
        if (series.resourceId().isBlank()) {
            throw new IllegalArgumentException("resource_id is required");
        }
        if (series.metricName().isBlank()) {
            throw new IllegalArgumentException("metric_name is required");
        }
        List<MetricPoint> points = series.points();
        if (points.isEmpty()) {
            throw new IllegalArgumentException("data must contain at least one point");
        }
        MetricPoint previous = null;
        for (int i = 0; i < points.size(); i++) {
            MetricPoint point = points.get(i);
            if (!Double.isFinite(point.value())) {
                throw new IllegalArgumentException(String.format("value at index %d is not finite", i));
            }
            if (previous != null && !point.timestamp().isAfter(previous.timestamp())) {
                throw new IllegalArgumentException(String.format(
                        "timestamps must be strictly increasing (index %d: %s after %s)",
                        i, point.timestamp(), previous.timestamp()));
            }
            previous = point;
        }
    }
}
