package com.scout.core.detection;

import com.scout.core.config.DisasterSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DailyMetrics;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Metric;
import com.scout.core.model.Priority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.scout.core.TestDatasets.CLOCK;
import static com.scout.core.TestDatasets.END;
import static com.scout.core.TestDatasets.dataset;
import static com.scout.core.TestDatasets.rows;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link DisasterDetector}.
 */
class DisasterDetectorTest {

    private DisasterDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DisasterDetector(new DisasterSettings(), CLOCK);
    }

    @Test
    @DisplayName("Should fire near-zero traffic and catastrophic drop for [100, 100, 100, 5]")
    void shouldFireOnCollapse() {
        List<Anomaly> alerts = detector.detect(dataset("p1", 100, 100, 100, 5));

        assertThat(alerts).extracting(Anomaly::getClassification)
                .containsExactly("near_zero_traffic", "catastrophic_drop");
        assertThat(alerts).allSatisfy(a -> {
            assertThat(a.getPriority()).isEqualTo(Priority.P0);
            assertThat(a.getDetectorType()).isEqualTo(DetectorType.DISASTER);
            assertThat(a.getBusinessImpact()).isEqualTo(100);
            assertThat(a.getDate()).isEqualTo(END);
        });
        assertThat(alerts.get(1).getDeviation()).isCloseTo(95.0, within(1e-9));
        assertThat(alerts.get(1).getBaseline()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Should fire tracking failure when conversions drop to zero on healthy traffic")
    void shouldFireOnTrackingFailure() {
        List<DailyMetrics> rows = rows(100, 100, 100, 98);
        rows.get(3).setConversions(0);

        List<Anomaly> alerts = detector.detect(dataset("p1", rows));

        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.getClassification()).isEqualTo("tracking_failure");
            assertThat(a.getMetric()).isEqualTo(Metric.CONVERSIONS);
            assertThat(a.getValue()).isZero();
        });
    }

    @Test
    @DisplayName("Should NOT fire tracking failure on low-traffic sites")
    void shouldNotFireTrackingFailureOnLowTraffic() {
        List<DailyMetrics> rows = rows(30, 30, 30, 30);
        rows.get(3).setConversions(0);

        assertThat(detector.detect(dataset("p1", rows))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT fire on normal traffic or a single day of data")
    void shouldNotFireOnNormalData() {
        assertThat(detector.detect(dataset("p1", 100, 100, 100, 95))).isEmpty();
        assertThat(detector.detect(dataset("p1", 5))).isEmpty();
    }

    @Test
    @DisplayName("Should use every prior day as the baseline for a catastrophic drop")
    void shouldUseFullHistoryAsBaseline() {
        double[] sessions = series(26, 1000, 3, 50, 60);

        List<Anomaly> alerts = detector.detect(dataset("p1", sessions));

        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.getClassification()).isEqualTo("catastrophic_drop");
            assertThat(a.getBaseline()).isCloseTo(26150.0 / 29, within(1e-9));
            assertThat(a.getDeviation()).isCloseTo((26150.0 / 29 - 60) / (26150.0 / 29) * 100.0, within(1e-9));
        });
    }

    @Test
    @DisplayName("Should judge tracking failure against the mean of the whole history")
    void shouldFireTrackingFailureAgainstFullHistory() {
        List<DailyMetrics> rows = rows(series(20, 200, 3, 20, 20));
        rows.get(rows.size() - 1).setConversions(0);

        assertThat(detector.detect(dataset("p1", rows)))
                .extracting(Anomaly::getClassification)
                .containsExactly("tracking_failure");
    }

    @Test
    @DisplayName("Should honour a configured baseline bound")
    void shouldHonourBoundedBaseline() {
        DisasterSettings settings = new DisasterSettings();
        settings.setBaselineDays(3);
        DisasterDetector bounded = new DisasterDetector(settings, CLOCK);

        assertThat(bounded.detect(dataset("p1", series(26, 1000, 3, 50, 60)))).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** {@code longDays} of {@code longValue}, {@code shortDays} of {@code shortValue}, then {@code latest}. */
    private static double[] series(int longDays, double longValue, int shortDays, double shortValue, double latest) {
        double[] sessions = new double[longDays + shortDays + 1];
        Arrays.fill(sessions, 0, longDays, longValue);
        Arrays.fill(sessions, longDays, longDays + shortDays, shortValue);
        sessions[sessions.length - 1] = latest;
        return sessions;
    }
}
