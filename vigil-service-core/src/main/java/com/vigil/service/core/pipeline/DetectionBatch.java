package com.vigil.service.core.pipeline;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import java.util.List;

/** One detection request: the series to evaluate and the (method, sensitivity) to evaluate them with. */
public record DetectionBatch(List<MetricSeries> series, String method, Sensitivity sensitivity) {

    public static final String DEFAULT_METHOD = "isolation-forest";

    public DetectionBatch {
        series = series == null ? List.of() : List.copyOf(series);
        method = method == null || method.isBlank() ? DEFAULT_METHOD : method;
        sensitivity = sensitivity == null ? Sensitivity.MEDIUM : sensitivity;
    }
}
