package com.vigil.metric.model;

import java.util.Locale;

/**
 * Ordinal detection knob. {@code LOW} flags the fewest points, {@code HIGH} the most.
 */
public enum Sensitivity {
    LOW,
    MEDIUM,
    HIGH;

    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Sensitivity fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "LOW" -> LOW;
            case "MEDIUM", "MED" -> MEDIUM;
            case "HIGH" -> HIGH;
            default -> throw new IllegalArgumentException("Unsupported sensitivity: " + value);
        };
    }
}
