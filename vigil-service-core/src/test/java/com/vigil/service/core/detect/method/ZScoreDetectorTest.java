package com.vigil.service.core.detect.method;

import static com.vigil.service.core.detect.SeriesFixtures.SPIKE_EXAMPLE_INDEX;
import static com.vigil.service.core.detect.SeriesFixtures.constant;
import static com.vigil.service.core.detect.SeriesFixtures.flagged;
import static com.vigil.service.core.detect.SeriesFixtures.series;
import static com.vigil.service.core.detect.SeriesFixtures.spikeExample;
import static org.assertj.core.api.Assertions.assertThat;

import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.detect.DetectionResult;
import com.vigil.service.core.detect.DetectorParameters;
import org.junit.jupiter.api.Test;

class ZScoreDetectorTest {

    private final ZScoreDetector detector = new ZScoreDetector();

    @Test
    void highSensitivityFlagsOnlyTheSpike() {
        DetectionResult result = detector.detect(spikeExample(), DetectorParameters.threshold(Sensitivity.HIGH, 2.0));

        assertThat(flagged(result)).containsExactly(SPIKE_EXAMPLE_INDEX);
        assertThat(result.reason(SPIKE_EXAMPLE_INDEX))
                .startsWith("value 45.20 is ")
                .endsWith("standard deviations from the mean");
    }

    @Test
    void singleSpikeInTenPointsCannotReachThreeSigma() {
        // with n = 10 a single outlier's population z-score is bounded by 3
        DetectionResult result = detector.detect(spikeExample(), DetectorParameters.threshold(Sensitivity.MEDIUM, 3.0));

        assertThat(result.anomalyCount()).isZero();
        assertThat(result.score(SPIKE_EXAMPLE_INDEX)).isGreaterThan(0.45).isLessThanOrEqualTo(0.5);
    }

    @Test
    void scoreIsHalfTheRatioOfZToK() {
        double[] values = {0, 0, 0, 0, 0, 10, 10, 10, 10, 10};
        // mean 5, population std 5 -> |z| = 1 everywhere
        DetectionResult result = detector.detect(
                series(values),
                DetectorParameters.threshold(Sensitivity.HIGH, 2.0));

        assertThat(result.scores()).containsOnly(0.25);
        assertThat(result.anomalyCount()).isZero();
    }

    @Test
    void zeroVarianceProducesNoAnomaliesAtAnySensitivity() {
        for (double k : new double[] {3.5, 3.0, 2.0}) {
            DetectionResult result = detector.detect(constant(10, 10.0), DetectorParameters.threshold(Sensitivity.HIGH, k));

            assertThat(result.anomalyCount()).isZero();
            assertThat(result.scores()).containsOnly(0.0);
        }
    }
}
