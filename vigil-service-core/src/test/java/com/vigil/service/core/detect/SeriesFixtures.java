package com.vigil.service.core.detect;

import com.vigil.metric.model.MetricPoint;
import com.vigil.metric.model.MetricSeries;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/** Deterministic metric series shared by the service-core tests. */
public final class SeriesFixtures {

    public static final Instant T0 = Instant.parse("2025-12-28T22:00:00Z");
    public static final String RESOURCE = "pod-web-001";
    public static final String METRIC = "cpu";

    /** The documented example: ten one-minute CPU samples with a single spike at index 5. */
    public static final double[] SPIKE_EXAMPLE = {10.2, 10.5, 10.1, 10.8, 11.2, 45.2, 10.6, 10.9, 10.3, 10.7};

    public static final int SPIKE_EXAMPLE_INDEX = 5;

    private SeriesFixtures() {}

    public static MetricSeries series(double... values) {
        return series(RESOURCE, METRIC, T0, Duration.ofMinutes(1), values);
    }

    public static MetricSeries series(String resource, String metric, Instant start, Duration step, double... values) {
        List<MetricPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(MetricPoint.of(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new MetricSeries(resource, metric, points);
    }

    public static MetricSeries spikeExample() {
        return series(SPIKE_EXAMPLE);
    }

    public static MetricSeries constant(int size, double value) {
        double[] values = new double[size];
        Arrays.fill(values, value);
        return series(values);
    }

    /** Gently oscillating series around 50 with seeded noise and +40 spikes at the given indices. */
    public static double[] noisyWithSpikes(int size, int... spikes) {
        Random random = new Random(7L);
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = 50.0 + 2.0 * Math.sin(i / 5.0) + random.nextGaussian() * 0.5;
        }
        for (int spike : spikes) {
            values[spike] += 40.0;
        }
        return values;
    }

    /** Indices of the flagged points. */
    public static List<Integer> flagged(DetectionResult result) {
        List<Integer> indices = new ArrayList<>();
        for (int i : result.anomalyIndices()) {
            indices.add(i);
        }
        return indices;
    }
}
