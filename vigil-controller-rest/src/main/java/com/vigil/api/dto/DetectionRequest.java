package com.vigil.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;

/** Body of {@code POST /api/detect}. {@code method} and {@code sensitivity} are optional. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DetectionRequest(List<SeriesInput> series, String method, String sensitivity) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SeriesInput(String resourceId, String metricName, List<PointInput> data) {}

    public record PointInput(@JsonDeserialize(using = FlexibleInstantDeserializer.class) Instant timestamp, Double value) {}
}
