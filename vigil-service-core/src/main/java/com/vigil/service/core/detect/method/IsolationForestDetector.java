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
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Isolation Forest over per-point change features (value, delta, relative delta).
 *
 * <p>Points are scored with the usual {@code 2^(-E[h(x)] / c(psi))}. The contamination fraction
 * picks the decision threshold as the {@code (1 - contamination)} percentile of the scores; a point
 * whose decision {@code threshold - score} is negative is flagged. Trees are grown from a fixed seed
 * so identical input always yields identical scores.
 */
@Component
@Order(30)
@Slf4j
public class IsolationForestDetector implements AnomalyDetector {

    public static final String NAME = "isolation-forest";
    public static final String OPTION_TREES = "trees";
    public static final String OPTION_SAMPLE_SIZE = "sample-size";
    public static final String OPTION_SEED = "seed";

    private static final DetectorDescriptor DESCRIPTOR = DetectorDescriptor.of(
            NAME,
            DetectorCategory.ML,
            "Isolates anomalies with random partitioning trees. Robust and scalable.",
            List.of("multivariate signals", "complex anomalies", "production"),
            10);

    private static final int DEFAULT_TREES = 100;
    private static final int DEFAULT_SAMPLE_SIZE = 256;
    private static final long DEFAULT_SEED = 42L;
    private static final double EULER_GAMMA = 0.5772156649015329;

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
        return Map.of(
                OPTION_TREES, (double) DEFAULT_TREES,
                OPTION_SAMPLE_SIZE, (double) DEFAULT_SAMPLE_SIZE,
                OPTION_SEED, (double) DEFAULT_SEED);
    }

    @Override
    public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
        return fit(series, parameters).score(series, parameters);
    }

    @Override
    public AnomalyDetector fit(MetricSeries series, DetectorParameters parameters) {
        double[][] features = SeriesStatistics.changeFeatures(series.values());
        int trees = parameters.intOption(OPTION_TREES, DEFAULT_TREES);
        int sampleSize = Math.min(parameters.intOption(OPTION_SAMPLE_SIZE, DEFAULT_SAMPLE_SIZE), features.length);
        long seed = (long) parameters.option(OPTION_SEED, DEFAULT_SEED);
        if (trees < 1 || sampleSize < 2) {
            throw new IllegalArgumentException(
                    String.format("isolation-forest needs trees >= 1 and sample-size >= 2 (got %d/%d)", trees, sampleSize));
        }
        Random random = new Random(seed);
        int heightLimit = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        Node[] forest = new Node[trees];
        for (int t = 0; t < trees; t++) {
            int[] sample = sample(features.length, sampleSize, random);
            forest[t] = grow(features, sample, sample.length, 0, heightLimit, random);
        }
        log.debug("isolation-forest fitted stream={} points={} trees={} psi={}", series.streamKey(), features.length, trees, sampleSize);
        return new FittedForest(this, forest, sampleSize);
    }

    @Override
    public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
        return String.format(
                "value %.2f isolated early (isolation score %.3f, contamination %.2f)",
                series.value(index), score, parameters.value());
    }

    /** Average unsuccessful-search path length in a binary search tree of {@code n} points. */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static int[] sample(int population, int size, Random random) {
        int[] indices = new int[population];
        for (int i = 0; i < population; i++) {
            indices[i] = i;
        }
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(indices, 0, sample, 0, size);
        return sample;
    }

    private static Node grow(double[][] data, int[] rows, int count, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || count <= 1) {
            return Node.leaf(count);
        }
        int features = data[0].length;
        double[] mins = new double[features];
        double[] maxs = new double[features];
        int splittable = 0;
        for (int f = 0; f < features; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < count; i++) {
                double v = data[rows[i]][f];
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            mins[f] = min;
            maxs[f] = max;
            if (max > min) {
                splittable++;
            }
        }
        if (splittable == 0) {
            return Node.leaf(count);
        }
        int pick = random.nextInt(splittable);
        int feature = -1;
        for (int f = 0; f < features; f++) {
            if (maxs[f] > mins[f] && pick-- == 0) {
                feature = f;
                break;
            }
        }
        double split = mins[feature] + random.nextDouble() * (maxs[feature] - mins[feature]);

        int[] left = new int[count];
        int[] right = new int[count];
        int l = 0;
        int r = 0;
        for (int i = 0; i < count; i++) {
            int row = rows[i];
            if (data[row][feature] < split) {
                left[l++] = row;
            } else {
                right[r++] = row;
            }
        }
        return Node.split(
                feature,
                split,
                grow(data, left, l, depth + 1, heightLimit, random),
                grow(data, right, r, depth + 1, heightLimit, random));
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int feature, double split, Node left, Node right) {
            return new Node(feature, split, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }

        double pathLength(double[] row) {
            Node node = this;
            int depth = 0;
            while (!node.isLeaf()) {
                node = row[node.feature] < node.split ? node.left : node.right;
                depth++;
            }
            return depth + averagePathLength(node.size);
        }
    }

    /** A trained forest; scores any series against the trees grown by {@link #fit}. */
    static final class FittedForest implements AnomalyDetector {
        private final IsolationForestDetector method;
        private final Node[] forest;
        private final double normalizer;

        FittedForest(IsolationForestDetector method, Node[] forest, int sampleSize) {
            this.method = method;
            this.forest = forest;
            this.normalizer = averagePathLength(sampleSize);
        }

        @Override
        public DetectorDescriptor descriptor() {
            return method.descriptor();
        }

        @Override
        public ParameterKind parameterKind() {
            return method.parameterKind();
        }

        @Override
        public Map<Sensitivity, Double> defaultSensitivity() {
            return method.defaultSensitivity();
        }

        @Override
        public Map<String, Double> defaultOptions() {
            return method.defaultOptions();
        }

        @Override
        public DetectorOutput score(MetricSeries series, DetectorParameters parameters) {
            double[][] features = SeriesStatistics.changeFeatures(series.values());
            double[] scores = new double[features.length];
            for (int i = 0; i < features.length; i++) {
                double total = 0.0;
                for (Node tree : forest) {
                    total += tree.pathLength(features[i]);
                }
                double meanPath = total / forest.length;
                scores[i] = Math.pow(2.0, -meanPath / normalizer);
            }
            double threshold = SeriesStatistics.percentile(scores, 100.0 * (1.0 - parameters.value()));
            return new DetectorOutput(scores, threshold);
        }

        @Override
        public String explain(MetricSeries series, int index, double score, DetectorParameters parameters) {
            return method.explain(series, index, score, parameters);
        }
    }
}
