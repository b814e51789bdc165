package com.vigil.service.core.detect;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome of evaluating one series with one (method, sensitivity). Flags are derived from the scores
 * on construction ({@code flag[i] == score[i] > threshold}); arrays are copied in and out, so an
 * instance never changes after it is built.
 */
public final class DetectionResult {

    private final MetricSeries series;
    private final String method;
    private final Sensitivity sensitivity;
    private final double threshold;
    private final double[] scores;
    private final boolean[] flags;
    private final String[] reasons;
    private final int anomalyCount;

    public DetectionResult(
            MetricSeries series,
            String method,
            Sensitivity sensitivity,
            double[] scores,
            double threshold,
            String[] reasons) {
        this.series = Objects.requireNonNull(series, "series");
        this.method = Objects.requireNonNull(method, "method");
        this.sensitivity = Objects.requireNonNull(sensitivity, "sensitivity");
        Objects.requireNonNull(scores, "scores");
        if (scores.length != series.size()) {
            throw new IllegalArgumentException(String.format(
                    "score count %d does not match point count %d", scores.length, series.size()));
        }
        if (reasons != null && reasons.length != scores.length) {
            throw new IllegalArgumentException("reason count does not match point count");
        }
        this.threshold = threshold;
        this.scores = scores.clone();
        this.flags = new boolean[scores.length];
        this.reasons = new String[scores.length];
        int count = 0;
        for (int i = 0; i < scores.length; i++) {
            flags[i] = scores[i] > threshold;
            if (flags[i]) {
                count++;
                this.reasons[i] = reasons == null ? null : reasons[i];
            }
        }
        this.anomalyCount = count;
    }

    public MetricSeries series() {
        return series;
    }

    public String method() {
        return method;
    }

    public Sensitivity sensitivity() {
        return sensitivity;
    }

    public double threshold() {
        return threshold;
    }

    public int size() {
        return scores.length;
    }

    public double score(int index) {
        return scores[index];
    }

    public boolean isAnomaly(int index) {
        return flags[index];
    }

    /** Human-readable explanation for a flagged point, {@code null} for normal points. */
    public String reason(int index) {
        return reasons[index];
    }

    public double[] scores() {
        return scores.clone();
    }

    public boolean[] flags() {
        return flags.clone();
    }

    public int anomalyCount() {
        return anomalyCount;
    }

    public int[] anomalyIndices() {
        int[] indices = new int[anomalyCount];
        int next = 0;
        for (int i = 0; i < flags.length; i++) {
            if (flags[i]) {
                indices[next++] = i;
            }
        }
        return indices;
    }

    @Override
    public String toString() {
        return "DetectionResult{"
                + "stream=" + series.streamKey()
                + ", method='" + method + '\''
                + ", sensitivity=" + sensitivity
                + ", threshold=" + threshold
                + ", anomalies=" + anomalyCount + "/" + scores.length
                + ", flagged=" + Arrays.toString(anomalyIndices())
                + '}';
    }
}
