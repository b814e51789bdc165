package com.vigil.service.core.detect;

/**
 * Raw detector output: one normalized score per point and the score a point must exceed to be
 * flagged.
 */
public record DetectorOutput(double[] scores, double threshold) {

    /** Output for series that carry no signal; nothing can exceed the threshold. */
    public static DetectorOutput silent(int length) {
        return new DetectorOutput(new double[length], 1.0);
    }
}
