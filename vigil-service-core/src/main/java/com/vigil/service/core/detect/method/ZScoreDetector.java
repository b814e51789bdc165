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
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Global z-score. A point is flagged when {@code |x - mean| / stddev > k}; the score is
 * {@code min(1, |z| / 2k)} so the flag boundary sits at 0.5.
 */
@Component
@Order(10)
@Slf4j
public class ZScoreDetector implements AnomalyDetector {

    public static final String NAME = "z-score";

    private static final DetectorDescriptor DESCRIPTOR = DetectorDescriptor.of(
            NAME,
            DetectorCategory.STATISTICAL,
            "Deviation from the global mean in standard deviations. Simple and fast.",
            List.of("stationary series", "fast detection", "baseline"),
            10);

    static final double FLAG_SCORE = 0.5;

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
    public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.stddev(values);
        if (std == 0.0) {
            return DetectorOutput.silent(values.length);
        }
        double k = parameters.value();
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double z = Math.abs(values[i] - mean) / std;
            scores[i] = SeriesStatistics.clamp01(z / (2 * k));
        }
        log.debug("z-score fitted stream={} mean={} std={} k={}", series.streamKey(), mean, std, k);
        return new DetectorOutput(scores, FLAG_SCORE);
    }

    @Override
    public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        double[] values = series.values();
        double std = SeriesStatistics.stddev(values);
        double sigma = std == 0.0 ? 0.0 : Math.abs(values[index] - SeriesStatistics.mean(values)) / std;
        return String.format("value %.2f is %.1f standard deviations from the mean", values[index], sigma);
    }
}
