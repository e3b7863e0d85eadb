package com.scout.core.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalPrimitives}.
 */
class StatisticalPrimitivesTest {

    @Test
    @DisplayName("Should compute the sample standard deviation")
    void shouldComputeSampleStdDev() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(StatisticalPrimitives.mean(values)).isEqualTo(5.0);
        assertThat(StatisticalPrimitives.sampleStdDev(values)).isCloseTo(Math.sqrt(32.0 / 7), within(1e-9));
        assertThat(StatisticalPrimitives.sampleStdDev(new double[] {3})).isZero();
    }

    @Test
    @DisplayName("Should report no anomalies for a constant series")
    void shouldNotFlagConstantSeries() {
        double[] constant = {100, 100, 100, 100, 100, 100};

        assertThat(StatisticalPrimitives.zScoreAnomalies(constant)).noneMatch(OutlierScore::isAnomaly);
        assertThat(StatisticalPrimitives.iqrAnomalies(constant)).noneMatch(OutlierScore::isAnomaly);
        assertThat(StatisticalPrimitives.consensus(constant, 2.0, 1.5)).noneMatch(ConsensusScore::isAnomaly);
    }

    @Test
    @DisplayName("Should treat too-short series as normal rather than failing")
    void shouldTreatShortSeriesAsNormal() {
        List<OutlierScore> z = StatisticalPrimitives.zScoreAnomalies(new double[] {1, 1000});
        List<OutlierScore> iqr = StatisticalPrimitives.iqrAnomalies(new double[] {1, 2, 1000});

        assertThat(z).hasSize(2).noneMatch(OutlierScore::isAnomaly);
        assertThat(iqr).hasSize(3).noneMatch(OutlierScore::isAnomaly);
    }

    @Test
    @DisplayName("Should flag an extreme z-score outlier even when the IQR is zero")
    void shouldFlagZScoreOutlier() {
        double[] values = {10, 10, 10, 10, 10, 10, 10, 10, 10, 100};

        List<ConsensusScore> scores = StatisticalPrimitives.consensus(values, 2.0, 1.5);

        assertThat(scores).filteredOn(ConsensusScore::isAnomaly)
                .singleElement()
                .satisfies(s -> {
                    assertThat(s.getIndex()).isEqualTo(9);
                    assertThat(s.isZScoreAnomaly()).isTrue();
                    assertThat(s.isIqrAnomaly()).isFalse();
                    assertThat(s.getSeverity()).isGreaterThan(2.0);
                });
    }

    @Test
    @DisplayName("Should flag a point beyond the IQR fence")
    void shouldFlagIqrOutlier() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 100};

        List<OutlierScore> scores = StatisticalPrimitives.iqrAnomalies(values, 1.5);

        assertThat(scores).filteredOn(OutlierScore::isAnomaly)
                .extracting(OutlierScore::getIndex)
                .containsExactly(7);
    }

    @Test
    @DisplayName("Should score against a baseline and return zero without spread")
    void shouldScoreAgainstBaseline() {
        assertThat(StatisticalPrimitives.zScoreAgainstBaseline(new double[] {100, 100, 100}, 500)).isZero();
        assertThat(StatisticalPrimitives.zScoreAgainstBaseline(new double[] {100}, 500)).isZero();
        assertThat(StatisticalPrimitives.zScoreAgainstBaseline(new double[] {90, 110}, 130))
                .isCloseTo(30 / Math.sqrt(200), within(1e-9));
    }
}
