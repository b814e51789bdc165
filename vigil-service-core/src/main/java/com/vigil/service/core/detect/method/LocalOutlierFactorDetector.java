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
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Local Outlier Factor over the same change features as the isolation forest. The raw LOF values
 * are min-max normalized; the contamination fraction picks the {@code (1 - contamination)}
 * percentile as the threshold.
 */
@Component
@Order(40)
@Slf4j
public class LocalOutlierFactorDetector implements AnomalyDetector {

    public static final String NAME = "lof";
    public static final String OPTION_NEIGHBORS = "neighbors";

    private static final DetectorDescriptor DESCRIPTOR = DetectorDescriptor.of(
            NAME,
            DetectorCategory.ML,
            "Local Outlier Factor. Finds points in regions of unusually low density.",
            List.of("local anomalies", "variable density", "clusters"),
            10);

    private static final int DEFAULT_NEIGHBORS = 20;
    private static final double MIN_REACH_DENSITY = 1e-10;

    @Override
    public DetectorDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public ParameterKind parameterKind() {
        return ParameterKind.CONTAMINATION;
    }

    @Override
    public Map<Sensitivity, Double> defaultSensitivity() {
        return Map.of(Sensitivity.LOW, 0.01, Sensitivity.MEDIUM, 0.05, Sensitivity.HIGH, 0.10);
    }

    @Override
    public Map<String, Double> defaultOptions() {
        return Map.of(OPTION_NEIGHBORS, (double) DEFAULT_NEIGHBORS);
    }

    @Override
    public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
        double[][] features = SeriesStatistics.changeFeatures(series.values());
        int n = features.length;
        int k = Math.min(parameters.intOption(OPTION_NEIGHBORS, DEFAULT_NEIGHBORS), n - 1);
        if (k < 2) {
            log.warn("lof skipped stream={} points={} neighbors={}: too few neighbours", series.streamKey(), n, k);
            return DetectorOutput.silent(n);
        }

        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = euclidean(features[i], features[j]);
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }

        int[][] neighbors = new int[n][];
        double[] kDistance = new double[n];
        for (int i = 0; i < n; i++) {
            neighbors[i] = nearest(distances[i], i, k);
            kDistance[i] = distances[i][neighbors[i][k - 1]];
        }

        double[] reachDensity = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j : neighbors[i]) {
                sum += Math.max(kDistance[j], distances[i][j]);
            }
            reachDensity[i] = 1.0 / (sum / k + MIN_REACH_DENSITY);
        }

        double[] lof = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int j : neighbors[i]) {
                sum += reachDensity[j];
            }
            lof[i] = sum / k / reachDensity[i];
        }

        double[] scores = SeriesStatistics.minMaxNormalize(lof);
        double threshold = SeriesStatistics.percentile(scores, 100.0 * (1.0 - parameters.value()));
        log.debug("lof fitted stream={} points={} neighbors={} threshold={}", series.streamKey(), n, k, threshold);
        return new DetectorOutput(scores, threshold);
    }

    @Override
    public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        return String.format(
                "value %.2f lies in a sparse neighbourhood (density score %.3f)", series.value(index), score);
    }

    private static int[] nearest(double[] row, int self, int k) {
        Integer[] order = new Integer[row.length - 1];
        int c = 0;
        for (int j = 0; j < row.length; j++) {
            if (j != self) {
                order[c++] = j;
            }
        }
        // stable sort keeps ties in index order
        Arrays.sort(order, Comparator.comparingDouble(j -> row[j]));
        int[] result = new int[k];
        for (int i = 0; i < k; i++) {
            result[i] = order[i];
        }
        return result;
    }

    private static double euclidean(double[] a, double[] b) {
        double sum = 0.0;
        for (int f = 0; f < a.length; f++) {
            double d = a[f] - b[f];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
