package com.vigil.service.core.config;

import static com.vigil.service.core.detect.SeriesFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.config.DetectionSettings.GroupingSettings;
import com.vigil.service.core.detect.SeriesFixtures;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DetectionSettingsTest {

    @Test
    void defaultsMatchTheDocumentedConfiguration() {
        DetectionSettings settings = DetectionSettings.defaults();

        assertThat(settings.pipeline().maxSeries()).isEqualTo(10);
        assertThat(settings.pipeline().workers()).isEqualTo(4);
        assertThat(settings.pipeline().deadline()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.grouping().maxGap()).isNull();
        assertThat(settings.grouping().gapIntervals()).isEqualTo(5);
        assertThat(settings.priority().minSupport()).isEqualTo(2);
        assertThat(settings.priority().criticalCut()).isEqualTo(0.8);
        assertThat(settings.sensitivityOverrides()).isEmpty();
        assertThat(settings.disabledDetectors()).isEmpty();
    }

    @Test
    void normalizesMethodNamesAndSensitivityLevels() {
        VigilProperties properties = new VigilProperties();
        properties.getSensitivity().put(" Z-Score-Custom ", Map.of("LOW", 4.0, "Med", 3.0));
        properties.getDetectors().setDisabled(List.of("LOF"));
        properties.getDetectors().getOptions().put("Moving-Average", Map.of("window", 7.0));

        DetectionSettings settings = DetectionSettings.from(properties);

        assertThat(settings.sensitivityOverrides())
                .containsOnlyKeys("z-score-custom")
                .extractingByKey("z-score-custom")
                .isEqualTo(Map.of(Sensitivity.LOW, 4.0, Sensitivity.MEDIUM, 3.0));
        assertThat(settings.disabledDetectors()).containsExactly("lof");
        assertThat(settings.optionsFor("moving-average")).containsEntry("window", 7.0);
        assertThat(settings.optionsFor("z-score")).isEmpty();
    }

    @Test
    void unknownSensitivityLevelFailsAtStartup() {
        VigilProperties properties = new VigilProperties();
        properties.getSensitivity().put("z-score", Map.of("extreme", 1.0));

        assertThatThrownBy(() -> DetectionSettings.from(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("extreme");
    }

    @Test
    void maxGapDerivesFromTheSamplingInterval() {
        GroupingSettings derived = DetectionSettings.defaults().grouping();
        MetricSeries perMinute = SeriesFixtures.series(1, 2, 3, 4);
        MetricSeries single = SeriesFixtures.series(1);

        assertThat(derived.maxGapFor(perMinute)).isEqualTo(Duration.ofMinutes(5));
        assertThat(derived.maxGapFor(single)).isEqualTo(Duration.ofMinutes(5));
        assertThat(GroupingSettings.fixedGap(Duration.ofSeconds(90)).maxGapFor(perMinute))
                .isEqualTo(Duration.ofSeconds(90));
        assertThat(derived.maxGapFor(SeriesFixtures.series("r", "m", T0, Duration.ofSeconds(10), 1, 2, 3)))
                .isEqualTo(Duration.ofSeconds(50));
        assertThat(derived.maxGapFor(SeriesFixtures.series("r", "m", T0, Duration.ofNanos(200_000), 1, 2, 3)))
                .isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void rejectsInconsistentCutPoints() {
        VigilProperties properties = new VigilProperties();
        properties.getPriority().getCutPoints().setMedium(0.7);

        assertThatThrownBy(() -> DetectionSettings.from(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cut-points");
    }

    @Test
    void rejectsCollapsedBuckets() {
        VigilProperties properties = new VigilProperties();
        properties.getPriority().getCutPoints().setHigh(0.8);

        assertThatThrownBy(() -> DetectionSettings.from(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("0 < medium < high < critical <= 1");
    }

    @Test
    void rejectsNonPositivePipelineLimits() {
        VigilProperties properties = new VigilProperties();
        properties.getPipeline().setMaxSeries(0);

        assertThatThrownBy(() -> DetectionSettings.from(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max-series");
    }
}
