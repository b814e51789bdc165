package com.vigil.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** One entry of {@code GET /api/methods}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MethodInfo(
        String name,
        String category,
        String description,
        List<String> bestFor,
        int minimumPoints,
        boolean available,
        String unavailableReason) {}
