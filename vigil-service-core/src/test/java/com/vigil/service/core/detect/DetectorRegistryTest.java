package com.vigil.service.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.detect.method.IsolationForestDetector;
import com.vigil.service.core.detect.method.MovingAverageDetector;
import com.vigil.service.core.detect.method.ZScoreDetector;
import com.vigil.service.core.error.DetectorUnavailableException;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DetectorRegistryTest {

    private static final List<AnomalyDetector> DETECTORS =
            List.of(new ZScoreDetector(), new MovingAverageDetector(), new IsolationForestDetector());

    @Test
    void resolvesRegisteredMethodsCaseInsensitively() {
        DetectorRegistry registry = new DetectorRegistry(DETECTORS, DetectionSettings.defaults());

        assertThat(registry.resolve("z-score")).isInstanceOf(ZScoreDetector.class);
        assertThat(registry.resolve(" Isolation-Forest ")).isInstanceOf(IsolationForestDetector.class);
        assertThat(registry.availableMethods()).containsExactly("z-score", "moving-average", "isolation-forest");
    }

    @Test
    void unknownMethodIsRejectedWithTheAvailableOnes() {
        DetectorRegistry registry = new DetectorRegistry(DETECTORS, DetectionSettings.defaults());

        assertThatThrownBy(() -> registry.resolve("autoencoder"))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("Unknown detection method 'autoencoder'")
                .hasMessageContaining("z-score")
                .satisfies(e -> assertThat(((DetectorUnavailableException) e).getMethod()).isEqualTo("autoencoder"));
        assertThat(registry.isAvailable("autoencoder")).isFalse();
    }

    @Test
    void disabledMethodStaysListedButCannotBeResolved() {
        DetectionSettings settings = DetectionSettings.defaults().withDisabledDetectors(Set.of("moving-average", "nope"));
        DetectorRegistry registry = new DetectorRegistry(DETECTORS, settings);

        assertThat(registry.isAvailable("moving-average")).isFalse();
        assertThat(registry.availableMethods()).containsExactly("z-score", "isolation-forest");
        assertThat(registry.descriptors())
                .filteredOn(d -> d.name().equals("moving-average"))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.available()).isFalse();
                    assertThat(d.unavailableReason()).isEqualTo(DetectorRegistry.DISABLED_REASON);
                });
        assertThat(registry.detectors()).hasSize(3);
        assertThatThrownBy(() -> registry.resolve("moving-average"))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("is unavailable");
    }

    @Test
    void duplicateNamesFailFast() {
        assertThatThrownBy(() -> new DetectorRegistry(
                        List.of(new ZScoreDetector(), new ZScoreDetector()), DetectionSettings.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate detector name 'z-score'");
    }
}
