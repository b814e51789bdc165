package com.vigil.service.core.detect.method;

import com.vigil.metric.model.MetricSeries;
import com.vigil.metric.model.Sensitivity;
import com.vigil.service.core.detect.AnomalyDetector;
import com.vigil.service.core.detect.DetectorCategory;
import com.vigil.service.core.detect.DetectorDescriptor;
import com.vigil.service.core.detect.DetectorOutput;
import com.vigil.service.core.detect.DetectorParameters;
import com.vigil.service.core.detect.ParameterKind;
import com.vigil.service.core.detect.SeriesStatistics;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Matrix-profile discords. Each subsequence of length {@code m} is paired with its nearest
 * non-trivial match (Euclidean distance, exclusion zone {@code ceil(m / 2)}); a point's discord is
 * the smallest profile value among the subsequences that cover it.
 *
 * <p>Discords are standardized with the median and {@code 1.4826 * MAD}, falling back to mean and
 * standard deviation when the MAD is zero. A point is flagged when its discord lies more than
 * {@code k} scale units above the centre; the score is {@code min(1, z / 2k)}.
 */
@Component
@Order(60)
@Slf4j
public class MatrixProfileDetector implements AnomalyDetector {

    public static final String NAME = "matrix-profile";
    public static final String OPTION_SUBSEQUENCE_LENGTH = "subsequence-length";

    private static final DetectorDescriptor DESCRIPTOR = DetectorDescriptor.of(
            NAME,
            DetectorCategory.ADVANCED,
            "Matrix profile discords. Finds subsequences unlike any other part of the series.",
            List.of("pattern anomalies", "repeating signals", "shape changes"),
            10);

    static final double FLAG_SCORE = 0.5;
    private static final int DEFAULT_SUBSEQUENCE_LENGTH = 4;
    private static final double MAD_TO_SIGMA = 1.4826;

    @Override
    public DetectorDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public ParameterKind parameterKind() {
        return ParameterKind.THRESHOLD;
    }

    @Override
    public Map<Sensitivity, Double> defaultSensitivity() {
        return Map.of(Sensitivity.LOW, 3.5, Sensitivity.MEDIUM, 3.0, Sensitivity.HIGH, 2.0);
    }

    @Override
    public Map<String, Double> defaultOptions() {
        return Map.of(OPTION_SUBSEQUENCE_LENGTH, (double) DEFAULT_SUBSEQUENCE_LENGTH);
    }

    @Override
    public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
        double[] values = series.values();
        int n = values.length;
        int m = subsequenceLength(parameters.intOption(OPTION_SUBSEQUENCE_LENGTH, DEFAULT_SUBSEQUENCE_LENGTH), n);
        double[] profile = profile(values, m);
        double[] discords = pointDiscords(profile, m, n);

        double centre = SeriesStatistics.median(discords);
        double scale = MAD_TO_SIGMA * SeriesStatistics.mad(discords);
        if (!(scale > 0)) {
            centre = SeriesStatistics.mean(discords);
            scale = SeriesStatistics.stddev(discords);
        }
        if (!(scale > 0)) {
            return DetectorOutput.silent(n);
        }
        double k = parameters.value();
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double z = (discords[i] - centre) / scale;
            scores[i] = SeriesStatistics.clamp01(z / (2 * k));
        }
        log.debug("matrix-profile fitted stream={} points={} m={} centre={} scale={}", series.streamKey(), n, m, centre, scale);
        return new DetectorOutput(scores, FLAG_SCORE);
    }

    @Override
    public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        return String.format(
                "value %.2f belongs to a subsequence unlike the rest of the series (discord score %.3f)",
                series.value(index), score);
    }

    static int subsequenceLength(int requested, int n) {
        int upper = Math.max(2, n / 4);
        return Math.max(2, Math.min(requested, upper));
    }

    /** Nearest non-trivial neighbour distance for every subsequence start. */
    static double[] profile(double[] values, int m) {
        int windows = values.length - m + 1;
        int exclusion = (int) Math.ceil(m / 2.0);
        double[] profile = new double[windows];
        Arrays.fill(profile, Double.POSITIVE_INFINITY);
        for (int i = 0; i < windows; i++) {
            for (int j = i + exclusion + 1; j < windows; j++) {
                double sum = 0.0;
                for (int t = 0; t < m; t++) {
                    double d = values[i + t] - values[j + t];
                    sum += d * d;
                }
                double distance = Math.sqrt(sum);
                profile[i] = Math.min(profile[i], distance);
                profile[j] = Math.min(profile[j], distance);
            }
        }
        for (int i = 0; i < windows; i++) {
            if (Double.isInfinite(profile[i])) {
                profile[i] = 0.0;
            }
        }
        return profile;
    }

    private static double[] pointDiscords(double[] profile, int m, int n) {
        double[] discords = new double[n];
        for (int p = 0; p < n; p++) {
            int first = Math.max(0, p - m + 1);
            int last = Math.min(p, profile.length - 1);
            double min = Double.POSITIVE_INFINITY;
            for (int w = first; w <= last; w++) {
                min = Math.min(min, profile[w]);
            }
            discords[p] = min;
        }
        return discords;
    }
}
