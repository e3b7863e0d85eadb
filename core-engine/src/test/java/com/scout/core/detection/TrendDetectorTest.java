package com.scout.core.detection;

import com.scout.core.config.TrendSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.Priority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.scout.core.TestDatasets.CLOCK;
import static com.scout.core.TestDatasets.concat;
import static com.scout.core.TestDatasets.dataset;
import static com.scout.core.TestDatasets.repeat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link TrendDetector}.
 */
class TrendDetectorTest {

    private TrendDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TrendDetector(new TrendSettings(), CLOCK);
    }

    /** 30 baseline days, 30 recent days and the latest day. */
    private static double[] series(double baseline, double recent) {
        return concat(repeat(baseline, 30), repeat(recent, 30), new double[] {recent});
    }

    @Test
    @DisplayName("Should fire a P3 upward trend at exactly 15%")
    void shouldFireAtThreshold() {
        List<Anomaly> alerts = detector.detect(dataset("p1", series(100, 115)));

        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.getClassification()).isEqualTo("trend_up");
            assertThat(a.getPriority()).isEqualTo(Priority.P3);
            assertThat(a.getValue()).isEqualTo(115.0);
            assertThat(a.getBaseline()).isEqualTo(100.0);
            assertThat(a.getDeviation()).isCloseTo(15.0, within(1e-9));
            assertThat(a.getBusinessImpact()).isEqualTo(45);
        });
    }

    @Test
    @DisplayName("Should NOT fire at 14.9%")
    void shouldNotFireBelowThreshold() {
        assertThat(detector.detect(dataset("p1", series(100, 114.9)))).isEmpty();
    }

    @Test
    @DisplayName("Should fire a P2 downward trend")
    void shouldFireDownwardTrend() {
        List<Anomaly> alerts = detector.detect(dataset("p1", series(100, 80)));

        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.getClassification()).isEqualTo("trend_down");
            assertThat(a.getPriority()).isEqualTo(Priority.P2);
            assertThat(a.getBusinessImpact()).isEqualTo(60);
            assertThat(a.getActionRequired()).isEqualTo("Address declining traffic");
        });
    }

    @Test
    @DisplayName("Should NOT fire without a baseline beyond the recent window")
    void shouldNotFireWithoutBaseline() {
        assertThat(detector.detect(dataset("p1", repeat(100, 31)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on low-volume series")
    void shouldNotFireOnLowVolume() {
        assertThat(detector.detect(dataset("p1", series(20, 40)))).isEmpty();
    }
}
