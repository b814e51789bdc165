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
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Trailing-window z-score. Each point is compared with the mean and standard deviation of the
 * {@code window} points before it; points without a full window score 0.
 */
@Component
@Order(20)
public class MovingAverageDetector implements AnomalyDetector {

    public static final String NAME = "moving-average";
    public static final String OPTION_WINDOW = "window";

    private static final DetectorDescriptor DESCRIPTOR = DetectorDescriptor.of(
            NAME,
            DetectorCategory.STATISTICAL,
            "Rolling mean and deviation; captures local regime changes.",
            List.of("trending series", "pattern changes", "seasonality"),
            10);

    static final double FLAG_SCORE = 0.5;
    private static final int DEFAULT_WINDOW = 5;

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
        return Map.of(OPTION_WINDOW, (double) DEFAULT_WINDOW);
    }

    @Override
    public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
        double[] values = series.values();
        int window = window(parameters);
        double k = parameters.value();
        double[] scores = new double[values.length];
        for (int i = window; i < values.length; i++) {
            if (isFlat(values, i - window, i)) {
                scores[i] = values[i] == values[i - 1] ? 0.0 : 1.0;
                continue;
            }
            double mean = SeriesStatistics.mean(values, i - window, i);
            double std = SeriesStatistics.stddev(values, i - window, i);
            double z = Math.abs(values[i] - mean) / std;
            scores[i] = SeriesStatistics.clamp01(z / (2 * k));
        }
        return new DetectorOutput(scores, FLAG_SCORE);
    }

    @Override
    public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        return String.format(
                "value %.2f diverges from the moving average of the previous %d points",
                series.value(index), window(parameters));
    }

    private static boolean isFlat(double[] values, int from, int to) {
        for (int i = from + 1; i < to; i++) {
            if (values[i] != values[from]) {
                return false;
            }
        }
        return true;
    }

    private static int window(DetectorParameters parameters) {
        int window = parameters.intOption(OPTION_WINDOW, DEFAULT_WINDOW);
        if (window < 2) {
            throw new IllegalArgumentException("moving-average window must be >= 2, got " + window);
        }
        return window;
    }
}
