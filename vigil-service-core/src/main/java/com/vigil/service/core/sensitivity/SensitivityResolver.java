package com.vigil.service.core.sensitivity;

import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.detect.AnomalyDetector;
import com.vigil.service.core.detect.DetectorParameters;
import com.vigil.service.core.detect.DetectorRegistry;
import com.vigil.service.core.detect.ParameterKind;
import com.vigil.service.core.error.DetectorUnavailableException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Pure {@code (method, sensitivity) -> DetectorParameters} lookup. The table starts from each
 * detector's defaults, applies {@code vigil.sensitivity.*} and {@code vigil.detectors.options.*}
 * overrides, and is validated once at construction.
 */
@Component
@Slf4j
public class SensitivityResolver {

    private final Map<String, Map<Sensitivity, DetectorParameters>> table;

    public SensitivityResolver(DetectorRegistry registry, DetectionSettings settings) {
        Map<String, Map<Sensitivity, DetectorParameters>> built = new LinkedHashMap<>();
        for (AnomalyDetector detector : registry.detectors()) {
            String method = DetectionSettings.normalizeMethod(detector.name());
            Map<Sensitivity, Double> levels = new EnumMap<>(Sensitivity.class);
            levels.putAll(detector.defaultSensitivity());
            levels.putAll(settings.sensitivityOverrides().getOrDefault(method, Map.of()));

            Map<String, Double> options = new LinkedHashMap<>(detector.defaultOptions());
            options.putAll(settings.optionsFor(method));

            validate(method, detector.parameterKind(), levels);

            Map<Sensitivity, DetectorParameters> row = new EnumMap<>(Sensitivity.class);
            levels.forEach((level, value) ->
                    row.put(level, new DetectorParameters(level, detector.parameterKind(), value, options)));
            built.put(method, Collections.unmodifiableMap(row));
            log.debug("Sensitivity table method={} kind={} levels={} options={}", method, detector.parameterKind(), levels, options);
        }
        for (String method : settings.sensitivityOverrides().keySet()) {
            if (!built.containsKey(method)) {
                throw new IllegalStateException("vigil.sensitivity names unknown method '" + method + "'");
            }
        }
        this.table = Collections.unmodifiableMap(built);
    }

    /**
     * @throws DetectorUnavailableException if no detector with that name is registered
     */
    public DetectorParameters resolve(String method, Sensitivity sensitivity) {
        Map<Sensitivity, DetectorParameters> row = table.get(DetectionSettings.normalizeMethod(method));
        if (row == null) {
            throw new DetectorUnavailableException(method, "No sensitivity table for method '" + method + "'");
        }
        return row.get(sensitivity == null ? Sensitivity.MEDIUM : sensitivity);
    }

    static void validate(String method, ParameterKind kind, Map<Sensitivity, Double> levels) {
        for (Sensitivity level : Sensitivity.values()) {
            Double value = levels.get(level);
            if (value == null) {
                throw new IllegalStateException(
                        String.format("Sensitivity table for '%s' has no %s entry", method, level.configValue()));
            }
            if (!Double.isFinite(value) || value <= 0) {
                throw new IllegalStateException(String.format(
                        "Sensitivity %s for '%s' must be a positive number (got %s)", level.configValue(), method, value));
            }
            if (kind == ParameterKind.CONTAMINATION && value > 0.5) {
                throw new IllegalStateException(String.format(
                        "Contamination %s for '%s' must be within (0, 0.5] (got %s)", level.configValue(), method, value));
            }
        }
        double low = levels.get(Sensitivity.LOW);
        double medium = levels.get(Sensitivity.MEDIUM);
        double high = levels.get(Sensitivity.HIGH);
        if (!kind.isAtLeastAsStrict(low, medium) || !kind.isAtLeastAsStrict(medium, high)) {
            throw new IllegalStateException(String.format(
                    "Sensitivity table for '%s' is not monotonic: low=%s medium=%s high=%s", method, low, medium, high));
        }
    }
}
