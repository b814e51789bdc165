package com.vigil.metric.model;

import java.util.Objects;

/** Identity of one (resource, metric) event stream. */
public record StreamKey(String resourceId, String metricName) {

    public StreamKey {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(metricName, "metricName");
    }

    @Override
    public String toString() {
        return resourceId + "/" + metricName;
    }
}
