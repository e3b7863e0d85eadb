package com.scout.core.detection;

import com.scout.core.config.SegmentSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Metric;
import com.scout.core.model.Priority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.scout.core.TestDatasets.CLOCK;
import static com.scout.core.TestDatasets.END;
import static com.scout.core.TestDatasets.concat;
import static com.scout.core.TestDatasets.dataset;
import static com.scout.core.TestDatasets.repeat;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SegmentAnomalyDetector}.
 */
class SegmentAnomalyDetectorTest {

    private SegmentAnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new SegmentAnomalyDetector(new SegmentSettings(), CLOCK);
    }

    @Test
    @DisplayName("Should flag a recent sessions drop as a P2 segment anomaly")
    void shouldFlagRecentDrop() {
        List<Anomaly> alerts = detector.detect(dataset("p1", concat(repeat(100, 29), new double[] {10})));

        assertThat(alerts).filteredOn(a -> a.getMetric() == Metric.SESSIONS)
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.getDetectorType()).isEqualTo(DetectorType.SEGMENT);
                    assertThat(a.getDate()).isEqualTo(END);
                    assertThat(a.getClassification()).isEqualTo("drop");
                    assertThat(a.getPriority()).isEqualTo(Priority.P2);
                    assertThat(a.getBusinessImpact()).isEqualTo(100);
                });
    }

    @Test
    @DisplayName("Should NOT flag a constant series")
    void shouldNotFlagConstantSeries() {
        assertThat(detector.detect(dataset("p1", repeat(100, 30)))).isEmpty();
    }

    @Test
    @DisplayName("Should weight business impact by metric, direction and magnitude")
    void shouldScoreBusinessImpact() {
        // 60 * 1.0 * 1.3 (drop) * 1.2 (50% off the mean) = 93.6
        assertThat(SegmentAnomalyDetector.businessImpact(Metric.SESSIONS, 3.0, 50, 100)).isEqualTo(94);
        // 40 * 0.8 = 32, spike of 10%
        assertThat(SegmentAnomalyDetector.businessImpact(Metric.PAGE_VIEWS, 2.0, 110, 100)).isEqualTo(32);
        // capped
        assertThat(SegmentAnomalyDetector.businessImpact(Metric.CONVERSIONS, 10.0, 0, 100)).isEqualTo(100);
    }
}
