package com.vigil.service.core.detect;

import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.error.DetectorUnavailableException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Read-only catalogue of detection methods, built once from every {@link AnomalyDetector} bean.
 * Methods listed under {@code vigil.detectors.disabled} stay visible but are reported unavailable.
 */
@Component
@Slf4j
public class DetectorRegistry {

    static final String DISABLED_REASON = "disabled by configuration (vigil.detectors.disabled)";

    private final Map<String, AnomalyDetector> detectors;
    private final Map<String, DetectorDescriptor> descriptors;

    public DetectorRegistry(List<AnomalyDetector> detectors, DetectionSettings settings) {
        Map<String, AnomalyDetector> byName = new LinkedHashMap<>();
        Map<String, DetectorDescriptor> described = new LinkedHashMap<>();
        for (AnomalyDetector detector : detectors) {
            String name = DetectionSettings.normalizeMethod(detector.name());
            AnomalyDetector previous = byName.putIfAbsent(name, detector);
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Duplicate detector name '%s' (%s and %s)",
                        name, previous.getClass().getName(), detector.getClass().getName()));
            }
            DetectorDescriptor descriptor = detector.descriptor();
            if (settings.disabledDetectors().contains(name)) {
                descriptor = descriptor.unavailable(DISABLED_REASON);
            }
            described.put(name, descriptor);
        }
        for (String disabled : settings.disabledDetectors()) {
            if (!byName.containsKey(disabled)) {
                log.warn("vigil.detectors.disabled names unknown method '{}'", disabled);
            }
        }
        this.detectors = Collections.unmodifiableMap(byName);
        this.descriptors = Collections.unmodifiableMap(described);
        log.info("Detector registry ready available={} unavailable={}", availableMethods(), unavailableMethods());
    }

    /**
     * Looks up an available detector.
     *
     * @throws DetectorUnavailableException if the method is unknown or disabled
     */
    public AnomalyDetector resolve(String method) {
        String name = DetectionSettings.normalizeMethod(method);
        AnomalyDetector detector = detectors.get(name);
        if (detector == null) {
            throw new DetectorUnavailableException(
                    method, String.format("Unknown detection method '%s'; available: %s", method, availableMethods()));
        }
        DetectorDescriptor descriptor = descriptors.get(name);
        if (!descriptor.available()) {
            throw new DetectorUnavailableException(
                    method,
                    String.format("Detection method '%s' is unavailable: %s", method, descriptor.unavailableReason()));
        }
        return detector;
    }

    public boolean isAvailable(String method) {
        DetectorDescriptor descriptor = descriptors.get(DetectionSettings.normalizeMethod(method));
        return descriptor != null && descriptor.available();
    }

    /** Every registered method in registration order, available or not. */
    public List<DetectorDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    /** Every registered detector, including disabled ones. */
    public List<AnomalyDetector> detectors() {
        return List.copyOf(detectors.values());
    }

    public List<String> availableMethods() {
        List<String> names = new ArrayList<>();
        descriptors.forEach((name, descriptor) -> {
            if (descriptor.available()) {
                names.add(name);
            }
        });
        return names;
    }

    private List<String> unavailableMethods() {
        List<String> names = new ArrayList<>();
        descriptors.forEach((name, descriptor) -> {
            if (!descriptor.available()) {
                names.add(name);
            }
        });
        return names;
    }
}
