package com.vigil.service.core.pipeline;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.validation.SeriesValidator;
import com.vigil.service.core.config.DetectionSettings;
import com.vigil.service.core.detect.AnomalyDetector;
import com.vigil.service.core.detect.DetectionResult;
import com.vigil.service.core.detect.DetectorParameters;
import com.vigil.service.core.detect.DetectorRegistry;
import com.vigil.service.core.error.ComputationException;
import com.vigil.service.core.error.InsufficientDataException;
import com.vigil.service.core.error.InvalidInputException;
import com.vigil.service.core.event.AnomalyEvent;
import com.vigil.service.core.event.EventGrouper;
import com.vigil.service.core.priority.PriorityScorer;
import com.vigil.service.core.repo.AnomalyEventRepository;
import com.vigil.service.core.repo.DetectionHistoryEntry;
import com.vigil.service.core.repo.DetectionHistoryRepository;
import com.vigil.service.core.sensitivity.SensitivityResolver;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a batch end to end: envelope validation, detector and parameter resolution, then per-series
 * detection, grouping, scoring and persistence on the {@link DetectionExecutor}.
 *
 * <p>Envelope problems reject the whole batch. Anything that goes wrong with a single series is
 * reported on that series only. Results come back in request order; series still running when the
 * deadline passes are cancelled and reported as {@link SeriesStatus#TIMED_OUT}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetectionPipeline {

    private final SeriesValidator validator;
    private final DetectorRegistry registry;
    private final SensitivityResolver sensitivityResolver;
    private final EventGrouper grouper;
    private final PriorityScorer scorer;
    private final AnomalyEventRepository eventRepository;
    private final DetectionHistoryRepository historyRepository;
    private final DetectionExecutor executor;
    private final DetectionSettings settings;
    private final Clock clock;

    /**
     * @throws InvalidInputException if the envelope is malformed
     * @throws com.vigil.service.core.error.DetectorUnavailableException if the method cannot be used
     */
    public BatchDetectionResult detect(DetectionBatch batch) {
        validateEnvelope(batch);
        AnomalyDetector detector = registry.resolve(batch.method());
        DetectorParameters parameters = sensitivityResolver.resolve(detector.name(), batch.sensitivity());

        long started = System.nanoTime();
        long deadline = started + settings.pipeline().deadline().toNanos();
        List<MetricSeries> series = batch.series();
        List<Future<SeriesDetection>> futures = new ArrayList<>(series.size());
        for (MetricSeries s : series) {
            futures.add(executor.submit(() -> process(s, detector, parameters, deadline)));
        }

        List<SeriesDetection> results = new ArrayList<>(series.size());
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), series.get(i), started, deadline));
        }

        BatchDetectionResult result = new BatchDetectionResult(detector.name(), batch.sensitivity(), results);
        log.info(
                "Detection complete method={} sensitivity={} series={} anomalies={} events={} failed={} tookMs={}",
                result.method(),
                result.sensitivity().configValue(),
                result.totalSeries(),
                result.totalAnomalies(),
                result.totalEvents(),
                results.stream().filter(r -> !r.isOk()).count(),
                elapsedMs(started));
        return result;
    }

    private void validateEnvelope(DetectionBatch batch) {
        if (batch == null) {
            throw new InvalidInputException("request body is required");
        }
        int maxSeries = settings.pipeline().maxSeries();
        if (batch.series().size() > maxSeries) {
            throw new InvalidInputException(String.format(
                    "at most %d series per request (got %d)", maxSeries, batch.series().size()));
        }
        try {
            validator.validateAll(batch.series());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(e.getMessage(), e);
        }
    }

    private SeriesDetection await(Future<SeriesDetection> future, MetricSeries series, long started, long deadline) {
        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException | CancellationException e) {
            future.cancel(true);
            log.warn("Detection timed out stream={} after {}ms", series.streamKey(), elapsedMs(started));
            return SeriesDetection.timedOut(series, elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return SeriesDetection.timedOut(series, elapsedMs(started));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Detection worker failed stream={}", series.streamKey(), cause);
            return SeriesDetection.failed(
                    series, SeriesStatus.COMPUTATION_ERROR, ComputationException.CODE, String.valueOf(cause.getMessage()), elapsedMs(started));
        }
    }

    /**
     * Detects, groups, scores and saves one series. Once the deadline has passed or the worker has
     * been cancelled nothing more is written: the open-event store only advances after the events
     * are saved, inside the stream's lock.
     */
    SeriesDetection process(MetricSeries series, AnomalyDetector detector, DetectorParameters parameters, long deadline) {
        long started = System.nanoTime();
        try {
            DetectionResult result = detector.detect(series, parameters);
            ensureLive(deadline);
            List<AnomalyEvent> events = grouper.group(result, grouped -> {
                List<AnomalyEvent> scored = scorer.score(grouped);
                ensureLive(deadline);
                scored.forEach(eventRepository::save);
                return scored;
            });
            long tookMs = elapsedMs(started);
            SeriesDetection detection = SeriesDetection.ok(result, events, tookMs);
            historyRepository.record(new DetectionHistoryEntry(
                    series.resourceId(),
                    series.metricName(),
                    detector.name(),
                    parameters.sensitivity(),
                    series.size(),
                    result.anomalyCount(),
                    detection.anomalyPercentage(),
                    tookMs,
                    clock.instant()));
            log.debug(
                    "Series processed stream={} points={} anomalies={} events={} tookMs={}",
                    series.streamKey(), series.size(), result.anomalyCount(), events.size(), tookMs);
            return detection;
        } catch (CancellationException e) {
            log.debug("Series abandoned stream={} after {}ms: {}", series.streamKey(), elapsedMs(started), e.getMessage());
            return SeriesDetection.timedOut(series, elapsedMs(started));
        } catch (InsufficientDataException e) {
            log.warn("Series skipped stream={}: {}", series.streamKey(), e.getMessage());
            return SeriesDetection.failed(
                    series, SeriesStatus.INSUFFICIENT_DATA, e.getCode(), e.getMessage(), elapsedMs(started));
        } catch (ComputationException e) {
            log.warn("Series failed stream={} method={}: {}", series.streamKey(), detector.name(), e.getMessage(), e);
            return SeriesDetection.failed(
                    series, SeriesStatus.COMPUTATION_ERROR, e.getCode(), e.getMessage(), elapsedMs(started));
        } catch (RuntimeException e) {
            log.error("Unexpected failure stream={} method={}", series.streamKey(), detector.name(), e);
            return SeriesDetection.failed(
                    series,
                    SeriesStatus.COMPUTATION_ERROR,
                    ComputationException.CODE,
                    "unexpected failure: " + e.getMessage(),
                    elapsedMs(started));
        }
    }

    private static void ensureLive(long deadline) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("worker interrupted");
        }
        if (System.nanoTime() - deadline > 0) {
            throw new CancellationException("deadline passed");
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
