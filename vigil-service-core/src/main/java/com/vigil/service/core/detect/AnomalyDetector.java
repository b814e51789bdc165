package com.vigil.service.core.detect;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.error.ComputationException;
import com.vigil.service.core.error.DetectionException;
import com.vigil.service.core.error.InsufficientDataException;
import java.util.Map;

/**
 * A pluggable detection method. Implementations are stateless and shared across threads; methods
 * that need a trained model return a fitted instance from {@link #fit}.
 */
public interface AnomalyDetector {

    DetectorDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }

    default int minimumPoints() {
        return descriptor().minimumPoints();
    }

    ParameterKind parameterKind();

    /** Default knob value per sensitivity level, before configuration overrides. */
    Map<Sensitivity, Double> defaultSensitivity();

    /** Default sensitivity-independent options, before configuration overrides. */
    default Map<String, Double> defaultOptions() {
        return Map.of();
    }

    /**
     * Scores every point of the series. Scores are normalized into [0, 1], higher is more anomalous,
     * and the returned array has exactly one entry per point.
     */
    DetectorOutput score(MetricSeries series, DetectorParameters parameters);

    /** Trains on {@code series}; stateless methods return themselves. */
    default AnomalyDetector fit(MetricSeries series, DetectorParameters parameters) {
        return this;
    }

    default String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        return String.format("anomaly score %.3f", score);
    }

    /**
     * Runs the method end to end: minimum-length check, zero-variance short-circuit, fit, score and
     * output validation.
     *
     * @throws InsufficientDataException if the series is shorter than {@link #minimumPoints()}
     * @throws ComputationException if fitting or scoring fails or produces unusable output
     */
    default DetectionResult detect(MetricSeries series, DetectorParameters parameters) {
        int required = minimumPoints();
        if (series.size() < required) {
            throw new InsufficientDataException(name(), required, series.size());
        }
        double[] values = series.values();
        AnomalyDetector model = this;
        DetectorOutput output;
        if (SeriesStatistics.isConstant(values)) {
            output = DetectorOutput.silent(values.length);
        } else {
            try {
                model = fit(series, parameters);
                output = model.score(series, parameters);
            } catch (DetectionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ComputationException(
                        String.format("method '%s' failed on %s: %s", name(), series.streamKey(), e.getMessage()), e);
            }
        }
        verify(output, values.length);

        double[] scores = output.scores();
        String[] reasons = new String[scores.length];
        for (int i = 0; i < scores.length; i++) {
            if (scores[i] > output.threshold()) {
                reasons[i] = model.explain(series, i, scores[i], parameters);
            }
        }
        return new DetectionResult(series, name(), parameters.sensitivity(), scores, output.threshold(), reasons);
    }

    private void verify(DetectorOutput output, int expected) {
        if (output == null || output.scores() == null) {
            throw new ComputationException(String.format("method '%s' produced no scores", name()));
        }
        if (output.scores().length != expected) {
            throw new ComputationException(String.format(
                    "method '%s' produced %d scores for %d points", name(), output.scores().length, expected));
        }
        if (!Double.isFinite(output.threshold())) {
            throw new ComputationException(String.format("method '%s' produced a non-finite threshold", name()));
        }
        for (int i = 0; i < expected; i++) {
            if (!Double.isFinite(output.scores()[i])) {
                throw new ComputationException(
                        String.format("method '%s' produced a non-finite score at index %d", name(), i));
            }
        }
    }
}
