package com.vigil.service.core.detect;

import com.vigil.metric.model.Sensitivity;
import java.util.Map;
import java.util.Objects;

/**
 * Hyperparameters for one (method, sensitivity) pair. {@code value} is the sensitivity-driven
 * knob (deviation multiplier, contamination fraction or interval z); {@code options} carries the
 * method's sensitivity-independent settings such as window sizes.
 */
public record DetectorParameters(Sensitivity sensitivity, ParameterKind kind, double value, Map<String, Double> options) {

    public DetectorParameters {
        Objects.requireNonNull(sensitivity, "sensitivity");
        Objects.requireNonNull(kind, "kind");
        options = Map.copyOf(options == null ? Map.of() : options);
    }

    public static DetectorParameters threshold(Sensitivity sensitivity, double k) {
        return new DetectorParameters(sensitivity, ParameterKind.THRESHOLD, k, Map.of());
    }

    public static DetectorParameters contamination(Sensitivity sensitivity, double fraction) {
        return new DetectorParameters(sensitivity, ParameterKind.CONTAMINATION, fraction, Map.of());
    }

    public DetectorParameters withOptions(Map<String, Double> next) {
        return new DetectorParameters(sensitivity, kind, value, next);
    }

    public double option(String name, double defaultValue) {
        Double v = options.get(name);
        return v == null ? defaultValue : v;
    }

    public int intOption(String name, int defaultValue) {
        Double v = options.get(name);
        return v == null ? defaultValue : (int) Math.round(v);
    }
}
