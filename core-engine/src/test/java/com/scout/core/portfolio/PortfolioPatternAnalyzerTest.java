package com.scout.core.portfolio;

import com.scout.core.config.PortfolioSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.ConfidenceLevel;
import com.scout.core.model.CorrelationStrength;
import com.scout.core.model.Metric;
import com.scout.core.model.Pattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static com.scout.core.TestDatasets.END;
import static com.scout.core.TestDatasets.anomaly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PortfolioPatternAnalyzer}.
 */
class PortfolioPatternAnalyzerTest {

    private static final List<String> PORTFOLIO = List.of(
            "p01", "p02", "p03", "p04", "p05", "p06", "p07", "p08", "p09", "p10");

    private PortfolioPatternAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new PortfolioPatternAnalyzer(new PortfolioSettings());
    }

    @Test
    @DisplayName("Should detect a simultaneous pattern when 30% of the portfolio is hit on the same day")
    void shouldDetectSimultaneousAtThreshold() {
        List<Anomaly> anomalies = sameDay(END, Metric.SESSIONS, "p01", "p02", "p03");

        PortfolioAnalysis analysis = analyzer.analyze(PORTFOLIO, anomalies);

        assertThat(analysis.getSimultaneous()).singleElement().satisfies(p -> {
            assertThat(p.getDate()).isEqualTo(END);
            assertThat(p.getMetric()).isEqualTo(Metric.SESSIONS);
            assertThat(p.getAffectedEntities()).containsExactly("p01", "p02", "p03");
            assertThat(p.getConfidence()).isCloseTo(0.45, within(1e-9));
            assertThat(p.getConfidenceLevel()).isEqualTo(ConfidenceLevel.LOW);
            assertThat(p.getLikelyCause()).isEqualTo(PortfolioPatternAnalyzer.CAUSE_TECHNICAL);
        });
        assertThat(analysis.isPortfolioWide(anomalies.get(0))).isTrue();
        assertThat(analysis.getInsights()).singleElement()
                .satisfies(i -> assertThat(i.getHeadline()).isEqualTo("Major portfolio impact on " + END));
    }

    @Test
    @DisplayName("Should NOT detect a simultaneous pattern below the threshold")
    void shouldNotDetectSimultaneousBelowThreshold() {
        List<Anomaly> anomalies = sameDay(END, Metric.SESSIONS, "p01", "p02");

        PortfolioAnalysis analysis = analyzer.analyze(PORTFOLIO, anomalies);

        assertThat(analysis.getSimultaneous()).isEmpty();
        assertThat(analysis.isPortfolioWide(anomalies.get(0))).isFalse();
        assertThat(analysis.getInsights()).isEmpty();
    }

    @Test
    @DisplayName("Should attribute a Monday majority pattern to a platform event and weekend recovery")
    void shouldExplainMondayMajorityPattern() {
        LocalDate monday = LocalDate.of(2024, 6, 10);
        List<Anomaly> anomalies = sameDay(monday, Metric.USERS,
                "p01", "p02", "p03", "p04", "p05", "p06", "p07", "p08");

        PortfolioAnalysis analysis = analyzer.analyze(PORTFOLIO, anomalies);

        Pattern pattern = analysis.getSimultaneous().get(0);
        assertThat(pattern.getConfidence()).isEqualTo(1.0);
        assertThat(pattern.getConfidenceLevel()).isEqualTo(ConfidenceLevel.VERY_HIGH);
        assertThat(pattern.getLikelyCause()).isEqualTo(PortfolioPatternAnalyzer.CAUSE_PLATFORM);
        assertThat(analysis.getPatternCauses()).singleElement()
                .satisfies(c -> assertThat(c.getLikelyCauses())
                        .extracting(CauseHypothesis::getCause)
                        .containsExactly("Google Algorithm Update", "Weekend Effect Recovery"));
    }

    @Test
    @DisplayName("Should detect a cascade spreading one property per day")
    void shouldDetectCascade() {
        List<Anomaly> anomalies = List.of(
                anomaly("p01", END.minusDays(2), Metric.SESSIONS, 50),
                anomaly("p02", END.minusDays(1), Metric.SESSIONS, 50),
                anomaly("p03", END, Metric.SESSIONS, 50));

        PortfolioAnalysis analysis = analyzer.analyze(PORTFOLIO, anomalies);

        assertThat(analysis.getSimultaneous()).isEmpty();
        assertThat(analysis.getCascading()).singleElement().satisfies(p -> {
            assertThat(p.getStartDate()).isEqualTo(END.minusDays(2));
            assertThat(p.getEndDate()).isEqualTo(END);
            assertThat(p.getDurationDays()).isEqualTo(3);
            assertThat(p.getSpreadRate()).isEqualTo(1.0);
            assertThat(p.getConfidenceLevel()).isEqualTo(ConfidenceLevel.MEDIUM);
            assertThat(p.getLikelyCause()).isEqualTo(PortfolioPatternAnalyzer.CAUSE_ROLLOUT);
        });
        assertThat(analysis.isPortfolioWide(anomalies.get(1))).isTrue();
    }

    @Test
    @DisplayName("Should NOT detect a cascade spanning fewer than three dates")
    void shouldNotDetectShortCascade() {
        List<Anomaly> anomalies = List.of(
                anomaly("p01", END.minusDays(1), Metric.SESSIONS, 50),
                anomaly("p02", END, Metric.SESSIONS, 50),
                anomaly("p03", END, Metric.SESSIONS, 50));

        assertThat(analyzer.analyze(PORTFOLIO, anomalies).getCascading()).isEmpty();
    }

    @Test
    @DisplayName("Should report metric pairs co-occurring at least three times")
    void shouldDetectMetricCorrelation() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            anomalies.add(anomaly("p01", END.minusDays(i), Metric.USERS, 50));
            anomalies.add(anomaly("p01", END.minusDays(i), Metric.SESSIONS, 50));
        }

        PortfolioAnalysis analysis = analyzer.analyze(PORTFOLIO, anomalies);

        assertThat(analysis.getCorrelations()).singleElement().satisfies(p -> {
            assertThat(p.getMetric()).isEqualTo(Metric.SESSIONS);
            assertThat(p.getCorrelatedMetric()).isEqualTo(Metric.USERS);
            assertThat(p.getOccurrenceCount()).isEqualTo(3);
            assertThat(p.getStrength()).isEqualTo(CorrelationStrength.WEAK);
            assertThat(p.getConfidence()).isCloseTo(0.1, within(1e-9));
        });
    }

    @Test
    @DisplayName("Should count properties that produced no anomalies in the portfolio total")
    void shouldCountQuietProperties() {
        PortfolioAnalysis analysis = analyzer.analyze(PORTFOLIO,
                List.of(anomaly("p01", END, Metric.SESSIONS, 50)));

        assertThat(analysis.getTotalProperties()).isEqualTo(10);
        assertThat(analysis.getTotalAnomalies()).isEqualTo(1);
        assertThat(analysis.getHealthScore()).isEqualTo(99);
    }

    @Test
    @DisplayName("Should recommend a tracking review when anomaly activity is elevated")
    void shouldRecommendReviewOnElevatedActivity() {
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            anomalies.add(anomaly("p01", END.minusDays(i * 10L), Metric.CONVERSIONS, 50));
        }

        PortfolioAnalysis analysis = analyzer.analyze(List.of("p01"), anomalies);

        assertThat(analysis.getRecommendations()).singleElement()
                .satisfies(r -> assertThat(r.getPriority()).isEqualTo("high"));
    }

    @Test
    @DisplayName("Should compute the health score and clamp it to [0, 100]")
    void shouldComputeHealthScore() {
        assertThat(PortfolioPatternAnalyzer.healthScore(10, 3, 1)).isEqualTo(92);
        assertThat(PortfolioPatternAnalyzer.healthScore(2, 40, 20)).isZero();
        assertThat(PortfolioPatternAnalyzer.healthScore(0, 0, 0)).isEqualTo(100);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<Anomaly> sameDay(LocalDate date, Metric metric, String... propertyIds) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (String id : propertyIds) {
            anomalies.add(anomaly(id, date, metric, 60));
        }
        return anomalies;
    }
}
