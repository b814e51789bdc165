package com.vigil.service.core.detect;

import java.util.List;
import java.util.Objects;

/**
 * Static description of a detection method plus its current availability.
 */
public record DetectorDescriptor(
        String name,
        DetectorCategory category,
        String description,
        List<String> bestFor,
        int minimumPoints,
        boolean available,
        String unavailableReason) {

    public DetectorDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        bestFor = List.copyOf(bestFor == null ? List.of() : bestFor);
        if (minimumPoints < 1) {
            throw new IllegalArgumentException("minimumPoints must be >= 1 for " + name);
        }
    }

    public static DetectorDescriptor of(
            String name, DetectorCategory category, String description, List<String> bestFor, int minimumPoints) {
        return new DetectorDescriptor(name, category, description, bestFor, minimumPoints, true, null);
    }

    public DetectorDescriptor unavailable(String reason) {
        return new DetectorDescriptor(name, category, description, bestFor, minimumPoints, false, reason);
    }
}
