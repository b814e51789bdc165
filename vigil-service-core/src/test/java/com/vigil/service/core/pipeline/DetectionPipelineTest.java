package com.vigil.service.core.pipeline;

import static com.vigil.service.core.detect.SeriesFixtures.METRIC;
import static com.vigil.service.core.detect.SeriesFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vigil.metric.model.MetricPoint;
import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import com.vigil.metric.model.StreamKey;
import com.vigil.metric.validation.DefaultSeriesValidator;
import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.config.DetectionSettings.PipelineSettings;
import com.vigil.service.core.detect.AnomalyDetector;
import com.vigil.service.core.detect.DetectorCategory;
import com.vigil.service.core.detect.DetectorDescriptor;
import com.vigil.service.core.detect.DetectorOutput;
import com.vigil.service.core.detect.DetectorParameters;
import com.vigil.service.core.detect.DetectorRegistry;
import com.vigil.service.core.detect.ParameterKind;
import com.vigil.service.core.detect.SeriesFixtures;
import com.vigil.service.core.detect.method.ForecastIntervalDetector;
import com.vigil.service.core.detect.method.IsolationForestDetector;
import com.vigil.service.core.detect.method.LocalOutlierFactorDetector;
import com.vigil.service.core.detect.method.MatrixProfileDetector;
import com.vigil.service.core.detect.method.MovingAverageDetector;
import com.vigil.service.core.detect.method.ZScoreDetector;
import com.vigil.service.core.error.ComputationException;
import com.vigil.service.core.error.DetectorUnavailableException;
import com.vigil.service.core.error.InsufficientDataException;
import com.vigil.service.core.error.InvalidInputException;
import com.vigil.service.core.event.EventGrouper;
import com.vigil.service.core.event.InMemoryOpenEventStore;
import com.vigil.service.core.priority.PriorityScorer;
import com.vigil.service.core.repo.InMemoryAnomalyEventRepository;
import com.vigil.service.core.repo.InMemoryDetectionHistoryRepository;
import com.vigil.service.core.sensitivity.SensitivityResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DetectionPipelineTest {

    private static final Instant NOW = Instant.parse("2025-12-29T00:00:00Z");

    private final CountDownLatch neverReleased = new CountDownLatch(1);
    private final CountDownLatch spinRelease = new CountDownLatch(1);

    private InMemoryOpenEventStore openEvents;
    private InMemoryAnomalyEventRepository eventRepository;
    private InMemoryDetectionHistoryRepository historyRepository;
    private DetectionExecutor executor;
    private DetectionPipeline pipeline;

    @BeforeEach
    void setUp() {
        DetectionSettings settings = DetectionSettings.defaults()
                .withPipeline(new PipelineSettings(4, Duration.ofSeconds(2), 3));
        List<AnomalyDetector> detectors = List.of(
                new ZScoreDetector(),
                new MovingAverageDetector(),
                new IsolationForestDetector(),
                new LocalOutlierFactorDetector(),
                new ForecastIntervalDetector(),
                new MatrixProfileDetector(),
                new StubDetector(neverReleased, spinRelease));
        DetectorRegistry registry = new DetectorRegistry(detectors, settings);
        eventRepository = new InMemoryAnomalyEventRepository();
        historyRepository = new InMemoryDetectionHistoryRepository();
        openEvents = new InMemoryOpenEventStore(settings);
        executor = new DetectionExecutor(settings);
        executor.init(settings.pipeline().workers());
        pipeline = new DetectionPipeline(
                new DefaultSeriesValidator(),
                registry,
                new SensitivityResolver(registry, settings),
                new EventGrouper(openEvents, settings),
                new PriorityScorer(eventRepository, settings),
                eventRepository,
                historyRepository,
                executor,
                settings,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        neverReleased.countDown();
        spinRelease.countDown();
        executor.stop();
    }

    private static MetricSeries series(String resource, double... values) {
        return SeriesFixtures.series(resource, METRIC, T0, Duration.ofMinutes(1), values);
    }

    @Test
    void constantSeriesHasNoAnomalies() {
        BatchDetectionResult result = pipeline.detect(
                new DetectionBatch(List.of(SeriesFixtures.constant(10, 10.0)), "z-score", Sensitivity.HIGH));

        SeriesDetection detection = result.results().get(0);
        assertThat(detection.status()).isEqualTo(SeriesStatus.OK);
        assertThat(detection.anomalyCount()).isZero();
        assertThat(detection.events()).isEmpty();
        assertThat(result.totalAnomalies()).isZero();
    }

    @Test
    void shortSeriesFailsAloneWhileTheRestOfTheBatchSucceeds() {
        MetricSeries shortSeries = series("pod-short", 1, 2, 3, 4, 5, 6, 7, 8, 9);
        MetricSeries example = SeriesFixtures.spikeExample();

        BatchDetectionResult result =
                pipeline.detect(new DetectionBatch(List.of(shortSeries, example), "isolation-forest", Sensitivity.MEDIUM));

        SeriesDetection failed = result.results().get(0);
        assertThat(failed.status()).isEqualTo(SeriesStatus.INSUFFICIENT_DATA);
        assertThat(failed.errorCode()).isEqualTo(InsufficientDataException.CODE);
        assertThat(failed.error()).contains("isolation-forest").contains("at least 10");
        assertThat(failed.result()).isNull();
        assertThat(result.results().get(1).status()).isEqualTo(SeriesStatus.OK);
        assertThat(result.results().get(1).anomalyCount()).isEqualTo(1);
    }

    @Test
    void documentedExampleProducesOneScoredEventAtTheSpike() {
        BatchDetectionResult result =
                pipeline.detect(new DetectionBatch(List.of(SeriesFixtures.spikeExample()), null, null));

        assertThat(result.method()).isEqualTo("isolation-forest");
        assertThat(result.sensitivity()).isEqualTo(Sensitivity.MEDIUM);
        SeriesDetection detection = result.results().get(0);
        assertThat(detection.anomalyCount()).isEqualTo(1);
        assertThat(detection.anomalyPercentage()).isEqualTo(10.0);
        assertThat(detection.events()).singleElement().satisfies(event -> {
            assertThat(event.getPeakTime()).isEqualTo(T0.plusSeconds(300));
            assertThat(event.getPeakValue()).isEqualTo(45.2);
            assertThat(event.getPointCount()).isEqualTo(1);
            assertThat(event.isScored()).isTrue();
        });
        StreamKey key = new StreamKey(SeriesFixtures.RESOURCE, METRIC);
        assertThat(eventRepository.findByStream(key)).containsExactlyElementsOf(detection.events());
        assertThat(historyRepository.findRecent(key, 5)).singleElement().satisfies(entry -> {
            assertThat(entry.method()).isEqualTo("isolation-forest");
            assertThat(entry.totalPoints()).isEqualTo(10);
            assertThat(entry.anomalyCount()).isEqualTo(1);
            assertThat(entry.createdAt()).isEqualTo(NOW);
        });
    }

    @Test
    void repeatingARequestYieldsIdenticalResults() {
        DetectionBatch batch = new DetectionBatch(List.of(SeriesFixtures.spikeExample()), "isolation-forest", Sensitivity.MEDIUM);

        SeriesDetection first = pipeline.detect(batch).results().get(0);
        SeriesDetection second = pipeline.detect(batch).results().get(0);

        assertThat(second.result().scores()).containsExactly(first.result().scores());
        assertThat(second.events()).isEqualTo(first.events());
        assertThat(historyRepository.findRecent(new StreamKey(SeriesFixtures.RESOURCE, METRIC), 5)).hasSize(2);
    }

    @Test
    void resultsFollowRequestOrder() {
        double[] values = SeriesFixtures.SPIKE_EXAMPLE;
        List<MetricSeries> series = List.of(series("pod-c", values), series("pod-a", values), series("pod-b", values));

        BatchDetectionResult result = pipeline.detect(new DetectionBatch(series, "z-score", Sensitivity.HIGH));

        assertThat(result.results())
                .extracting(r -> r.series().resourceId())
                .containsExactly("pod-c", "pod-a", "pod-b");
        assertThat(result.totalSeries()).isEqualTo(3);
        assertThat(result.totalEvents()).isEqualTo(3);
        assertThat(result.rankedEvents()).hasSize(3);
    }

    @Test
    void failingSeriesIsReportedInline() {
        List<MetricSeries> series = List.of(series("broken", ramp()), series("healthy", ramp()));

        BatchDetectionResult result = pipeline.detect(new DetectionBatch(series, StubDetector.NAME, Sensitivity.MEDIUM));

        SeriesDetection broken = result.results().get(0);
        assertThat(broken.status()).isEqualTo(SeriesStatus.COMPUTATION_ERROR);
        assertThat(broken.errorCode()).isEqualTo(ComputationException.CODE);
        assertThat(broken.error()).contains("solver diverged");
        assertThat(result.results().get(1).status()).isEqualTo(SeriesStatus.OK);
        assertThat(result.results().get(1).events()).hasSize(1);
    }

    @Test
    void seriesStillRunningAtTheDeadlineAreMarkedTimedOut() {
        List<MetricSeries> series = List.of(series("stuck", ramp()), series("healthy", ramp()));

        BatchDetectionResult result = pipeline.detect(new DetectionBatch(series, StubDetector.NAME, Sensitivity.MEDIUM));

        assertThat(result.results().get(0).status()).isEqualTo(SeriesStatus.TIMED_OUT);
        assertThat(result.results().get(0).errorCode()).isEqualTo("timed-out");
        assertThat(result.results().get(1).status()).isEqualTo(SeriesStatus.OK);
    }

    @Test
    void workerFinishingAfterTheDeadlineLeavesNoEventBehind() {
        MetricSeries late = series("spinning", ramp());

        BatchDetectionResult result = pipeline.detect(new DetectionBatch(List.of(late), StubDetector.NAME, Sensitivity.MEDIUM));
        assertThat(result.results().get(0).status()).isEqualTo(SeriesStatus.TIMED_OUT);

        spinRelease.countDown();
        executor.stop();

        assertThat(openEvents.latest(late.streamKey())).isEmpty();
        assertThat(eventRepository.findByStream(late.streamKey())).isEmpty();
        assertThat(historyRepository.findRecent(late.streamKey(), 5)).isEmpty();
    }

    @Test
    void rejectsBatchesLargerThanTheLimit() {
        double[] values = SeriesFixtures.SPIKE_EXAMPLE;
        List<MetricSeries> series =
                List.of(series("a", values), series("b", values), series("c", values), series("d", values));

        assertThatThrownBy(() -> pipeline.detect(new DetectionBatch(series, "z-score", Sensitivity.LOW)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("at most 3 series");
    }

    @Test
    void rejectsEmptyAndMalformedBatches() {
        MetricSeries duplicated = new MetricSeries(
                "pod-dup", METRIC, List.of(MetricPoint.of(T0, 1.0), MetricPoint.of(T0, 2.0)));

        assertThatThrownBy(() -> pipeline.detect(new DetectionBatch(List.of(), "z-score", Sensitivity.LOW)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> pipeline.detect(
                        new DetectionBatch(List.of(SeriesFixtures.spikeExample(), duplicated), "z-score", Sensitivity.LOW)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("series[1]")
                .hasMessageContaining("strictly increasing");
        assertThatThrownBy(() -> pipeline.detect(null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void unknownMethodIsNeverSubstituted() {
        DetectionBatch batch = new DetectionBatch(List.of(SeriesFixtures.spikeExample()), "autoencoder", Sensitivity.LOW);

        assertThatThrownBy(() -> pipeline.detect(batch))
                .isInstanceOf(DetectorUnavailableException.class)
                .hasMessageContaining("autoencoder");
        assertThat(historyRepository.findRecent(new StreamKey(SeriesFixtures.RESOURCE, METRIC), 5)).isEmpty();
    }

    private static double[] ramp() {
        double[] values = new double[12];
        Arrays.setAll(values, i -> i);
        return values;
    }

    /**
     * Scores the last point as anomalous. "broken" resources fail, "stuck" ones block until
     * interrupted, "spinning" ones ignore interrupts and only return once released.
     */
    static class StubDetector implements AnomalyDetector {

        static final String NAME = "stub";

        private final CountDownLatch gate;
        private final CountDownLatch spin;

        StubDetector(CountDownLatch gate, CountDownLatch spin) {
            this.gate = gate;
            this.spin = spin;
        }

        @Override
        public DetectorDescriptor descriptor() {
            return DetectorDescriptor.of(NAME, DetectorCategory.STATISTICAL, "test double", List.of(), 10);
        }

        @Override
        public ParameterKind parameterKind() {
            return ParameterKind.THRESHOLD;
        }

        @Override
        public Map<Sensitivity, Double> defaultSensitivity() {
            return Map.of(Sensitivity.LOW, 3.0, Sensitivity.MEDIUM, 2.0, Sensitivity.HIGH, 1.0);
        }

        @Override
        public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
            if (series.resourceId().equals("broken")) {
                throw new ArithmeticException("solver diverged");
            }
            if (series.resourceId().equals("stuck")) {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
            }
            if (series.resourceId().equals("spinning")) {
                while (spin.getCount() > 0) {
                    Thread.onSpinWait();
                }
            }
            double[] scores = new double[series.size()];
            scores[scores.length - 1] = 0.9;
            return new DetectorOutput(scores, 0.5);
        }
    }
}
