package com.vigil.service.core.detect;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/** Numeric helpers shared by the detectors, on top of commons-math3 descriptive statistics. */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static boolean isConstant(double[] values) {
        if (values.length == 0) {
            return true;
        }
        double first = values[0];
        for (double v : values) {
            if (Double.compare(v, first) != 0) {
                return false;
            }
        }
        return true;
    }

    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    /** Mean of {@code values[from, to)}. */
    public static double mean(double[] values, int from, int to) {
        return new Mean().evaluate(values, from, to - from);
    }

    /** Population standard deviation. */
    public static double stddev(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /** Population standard deviation of {@code values[from, to)}. */
    public static double stddev(double[] values, int from, int to) {
        return new StandardDeviation(false).evaluate(values, from, to - from);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /** Median absolute deviation from the median. */
    public static double mad(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    /**
     * Percentile with linear interpolation between closest ranks ({@link EstimationType#R_7}),
     * {@code q} in [0, 100].
     */
    public static double percentile(double[] values, double q) {
        if (values.length == 0) {
            throw new IllegalArgumentException("percentile of empty array");
        }
        if (q <= 0.0) {
            return StatUtils.min(values);
        }
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, Math.min(100.0, q));
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Per-point feature rows: the value, the change from the previous point and the relative
     * change from the previous point (0 when the previous value is 0). The first point has no
     * predecessor, so both changes are 0.
     */
    public static double[][] changeFeatures(double[] values) {
        double[][] rows = new double[values.length][3];
        for (int i = 0; i < values.length; i++) {
            rows[i][0] = values[i];
            if (i > 0) {
                double diff = values[i] - values[i - 1];
                rows[i][1] = diff;
                rows[i][2] = values[i - 1] != 0.0 ? diff / values[i - 1] : 0.0;
            }
        }
        return rows;
    }

    /** Min-max rescale into [0, 1]; a flat input maps to all zeros. */
    public static double[] minMaxNormalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double[] normalized = new double[values.length];
        double range = max - min;
        if (!(range > 0)) {
            return normalized;
        }
        for (int i = 0; i < values.length; i++) {
            normalized[i] = (values[i] - min) / range;
        }
        return normalized;
    }
}
