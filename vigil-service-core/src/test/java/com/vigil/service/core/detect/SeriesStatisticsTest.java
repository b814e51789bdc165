package com.vigil.service.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SeriesStatisticsTest {

    private static final double[] ONE_TO_TEN = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

    @Test
    void percentileInterpolatesLinearlyBetweenClosestRanks() {
        double[] values = {4, 1, 3, 2};

        assertThat(SeriesStatistics.percentile(values, 25)).isCloseTo(1.75, within(1e-12));
        assertThat(SeriesStatistics.percentile(ONE_TO_TEN, 90)).isCloseTo(9.1, within(1e-12));
        assertThat(SeriesStatistics.percentile(values, 0)).isEqualTo(1.0);
        assertThat(SeriesStatistics.percentile(values, 100)).isEqualTo(4.0);
        assertThat(values).containsExactly(4, 1, 3, 2);
    }

    @Test
    void medianAndMadOfOddAndEvenLengths() {
        assertThat(SeriesStatistics.median(new double[] {3, 1, 2})).isEqualTo(2.0);
        assertThat(SeriesStatistics.median(new double[] {1, 2, 3, 4})).isEqualTo(2.5);
        assertThat(SeriesStatistics.mad(new double[] {1, 1, 2, 2, 4, 6, 9})).isEqualTo(1.0);
    }

    @Test
    void standardDeviationIsThePopulationOne() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(SeriesStatistics.mean(values)).isEqualTo(5.0);
        assertThat(SeriesStatistics.stddev(values)).isCloseTo(2.0, within(1e-12));
        assertThat(SeriesStatistics.mean(values, 1, 4)).isEqualTo(4.0);
        assertThat(SeriesStatistics.stddev(values, 1, 4)).isZero();
    }

    @Test
    void percentileOfNothingIsRejected() {
        assertThatThrownBy(() -> SeriesStatistics.percentile(new double[0], 50))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
