package com.vigil.service.core.detect.method;

import static com.vigil.service.core.detect.SeriesFixtures.SPIKE_EXAMPLE_INDEX;
import static com.vigil.service.core.detect.SeriesFixtures.flagged;
import static com.vigil.service.core.detect.SeriesFixtures.spikeExample;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.detect.DetectionResult;
import com.vigil.service.core.detect.DetectorParameters;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IsolationForestDetectorTest {

    private final IsolationForestDetector detector = new IsolationForestDetector();

    @Test
    void flagsOnlyTheSpikeOfTheDocumentedExampleAtEveryContamination() {
        for (double contamination : new double[] {0.01, 0.05, 0.10}) {
            DetectionResult result =
                    detector.detect(spikeExample(), DetectorParameters.contamination(Sensitivity.MEDIUM, contamination));

            assertThat(flagged(result)).as("contamination %s", contamination).containsExactly(SPIKE_EXAMPLE_INDEX);
        }
    }

    @Test
    void spikeHasTheHighestIsolationScore() {
        DetectionResult result = detector.detect(spikeExample(), DetectorParameters.contamination(Sensitivity.MEDIUM, 0.05));

        double spike = result.score(SPIKE_EXAMPLE_INDEX);
        for (int i = 0; i < result.size(); i++) {
            if (i != SPIKE_EXAMPLE_INDEX) {
                assertThat(result.score(i)).isLessThan(spike);
            }
        }
        assertThat(result.threshold()).isLessThan(spike);
        assertThat(result.reason(SPIKE_EXAMPLE_INDEX)).contains("isolated early");
    }

    @Test
    void differentSeedStillScoresEveryPoint() {
        DetectorParameters parameters = DetectorParameters.contamination(Sensitivity.MEDIUM, 0.05)
                .withOptions(Map.of(IsolationForestDetector.OPTION_SEED, 7.0, IsolationForestDetector.OPTION_TREES, 25.0));

        DetectionResult result = detector.detect(spikeExample(), parameters);

        assertThat(result.size()).isEqualTo(10);
        assertThat(result.anomalyCount()).isEqualTo(1);
    }

    @Test
    void averagePathLengthMatchesTheBinarySearchTreeFormula() {
        assertThat(IsolationForestDetector.averagePathLength(1)).isZero();
        assertThat(IsolationForestDetector.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationForestDetector.averagePathLength(256)).isCloseTo(10.245, within(0.001));
    }
}
