package com.scout.core.prediction;

import com.scout.core.config.PortfolioSettings;
import com.scout.core.config.PredictionSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.ConfidenceLevel;
import com.scout.core.model.DailyMetrics;
import com.scout.core.model.EventType;
import com.scout.core.model.ExternalEvent;
import com.scout.core.model.ImpactLevel;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricSeries;
import com.scout.core.model.Prediction;
import com.scout.core.model.PropertyDataset;
import com.scout.core.portfolio.PortfolioAnalysis;
import com.scout.core.portfolio.PortfolioPatternAnalyzer;
import com.scout.core.rootcause.EventCalendar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.scout.core.TestDatasets.END;
import static com.scout.core.TestDatasets.anomaly;
import static com.scout.core.TestDatasets.concat;
import static com.scout.core.TestDatasets.dataset;
import static com.scout.core.TestDatasets.repeat;
import static com.scout.core.TestDatasets.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PredictiveEngine}.
 */
class PredictiveEngineTest {

    private final PredictiveEngine engine = new PredictiveEngine(new PredictionSettings(), EventCalendar.empty());

    // ---------------------------------------------------------------
    // Trend projection
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should project a strong weekly trend outside the recent range")
    void shouldProjectTrend() {
        PropertyDataset p1 = dataset("p1", concat(repeat(100, 7), repeat(150, 7)));

        List<Prediction> predictions = engine.fromTrend(p1.overall(Metric.SESSIONS), END);

        assertThat(predictions).hasSize(7);
        Prediction first = predictions.get(0);
        assertThat(first.getPredictionDate()).isEqualTo(END.plusDays(1));
        assertThat(first.getPredictedValue()).isCloseTo(217.5, within(1e-6));
        assertThat(first.getExpectedLow()).isEqualTo(150.0);
        assertThat(first.getExpectedHigh()).isEqualTo(150.0);
        assertThat(first.getAnomalyProbability()).isCloseTo(0.9, within(1e-9));
        assertThat(first.getConfidence()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(first.getPredictionBasis()).isEqualTo("Trend projection (50.0% change/week)");
        assertThat(first.getRecommendedAction()).isEqualTo("Sessions rapidly growing - monitor site performance");
        assertThat(first.getPotentialImpact()).isCloseTo(25.0, within(1e-9));
        assertThat(predictions.get(1).getAnomalyProbability()).isCloseTo(0.81, within(1e-9));
    }

    @Test
    @DisplayName("Should NOT project a flat series")
    void shouldNotProjectFlatSeries() {
        PropertyDataset p1 = dataset("p1", repeat(100, 14));

        assertThat(engine.fromTrend(p1.overall(Metric.SESSIONS), END)).isEmpty();
    }

    @Test
    @DisplayName("Should NOT project a trend from fewer than fourteen points")
    void shouldNotProjectShortSeries() {
        PropertyDataset p1 = dataset("p1", concat(repeat(100, 6), repeat(150, 7)));

        assertThat(engine.fromTrend(p1.overall(Metric.SESSIONS), END)).isEmpty();
    }

    @Test
    @DisplayName("Should phrase trend actions per metric and pace")
    void shouldPhraseTrendActions() {
        assertThat(PredictiveEngine.trendAction(Metric.CONVERSIONS, -0.1))
                .isEqualTo("Conversions steadily declining - review funnel and campaigns");
        assertThat(PredictiveEngine.trendAction(Metric.USERS, -0.3))
                .isEqualTo("User acquisition rapidly declining - check traffic sources");
        assertThat(PredictiveEngine.trendAction(Metric.PAGE_VIEWS, 0.1))
                .isEqualTo("Engagement steadily growing - review content strategy");
    }

    // ---------------------------------------------------------------
    // Weekly seasonality
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should predict a weekday that typically differs from the last week")
    void shouldPredictWeekdaySeasonality() {
        PropertyDataset p1 = dataset("p1", thursdayPeaks(28));

        List<Prediction> predictions = engine.fromSeasonality(p1.overall(Metric.SESSIONS), END);

        LocalDate thursday = END.plusDays(1);
        assertThat(thursday.getDayOfWeek()).isEqualTo(DayOfWeek.THURSDAY);
        assertThat(predictions).filteredOn(p -> p.getPredictionDate().equals(thursday))
                .singleElement().satisfies(p -> {
                    assertThat(p.getPredictedValue()).isEqualTo(300.0);
                    assertThat(p.getAnomalyProbability()).isEqualTo(0.6);
                    assertThat(p.getPotentialImpact()).isEqualTo(30.0);
                    assertThat(p.getPredictionBasis())
                            .isEqualTo("Weekly pattern (Thursday typically 133.3% different)");
                    assertThat(p.getRecommendedAction())
                            .isEqualTo("Expected Thursday variation - monitor for unusual deviation");
                });
    }

    @Test
    @DisplayName("Should NOT look for weekly patterns in fewer than 28 points")
    void shouldNotPredictSeasonalityOnShortSeries() {
        PropertyDataset p1 = dataset("p1", thursdayPeaks(27));

        assertThat(engine.fromSeasonality(p1.overall(Metric.SESSIONS), END)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Calendar events
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should predict the impact of events inside the horizon only")
    void shouldPredictUpcomingEvents() {
        EventCalendar calendar = new EventCalendar("test", List.of(
                event(END.plusDays(3), "Summer sale", EventType.HOLIDAY, ImpactLevel.HIGH),
                event(END.plusDays(5), "Tracking migration", EventType.TECHNICAL, ImpactLevel.MEDIUM),
                event(END.plusDays(8), "Too late", EventType.HOLIDAY, ImpactLevel.CRITICAL)));
        PredictiveEngine withEvents = new PredictiveEngine(new PredictionSettings(), calendar);
        PropertyDataset p1 = dataset("p1", repeat(100, 7));

        List<Prediction> predictions = withEvents.fromEvents("p1", overall(p1), END);

        assertThat(predictions).hasSize(4);
        assertThat(predictions).filteredOn(p -> p.getPredictionBasis().equals("Upcoming event: Summer sale"))
                .extracting(Prediction::getMetric, Prediction::getPredictedValue, Prediction::getAnomalyProbability)
                .containsExactly(
                        tuple(Metric.SESSIONS, 70.0, 0.75),
                        tuple(Metric.CONVERSIONS, 15.0, 0.75));
        assertThat(predictions).filteredOn(p -> p.getPredictionBasis().equals("Upcoming event: Tracking migration"))
                .allSatisfy(p -> {
                    assertThat(p.getAnomalyProbability()).isEqualTo(0.5);
                    assertThat(p.getPotentialImpact()).isEqualTo(40.0);
                    assertThat(p.getRecommendedAction())
                            .isEqualTo("Prepare for Tracking migration impact - Tracking migration description");
                });
    }

    // ---------------------------------------------------------------
    // Pattern propagation
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should warn properties a fast cascade has not reached yet")
    void shouldPredictPropagation() {
        List<PropertyDataset> datasets = new ArrayList<>();
        List<String> ids = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            String id = String.format("p%02d", i);
            ids.add(id);
            datasets.add(dataset(id, repeat(100, 7)));
        }
        List<Anomaly> anomalies = List.of(
                anomaly("p01", END.minusDays(2), Metric.SESSIONS, 60),
                anomaly("p02", END.minusDays(2), Metric.SESSIONS, 60),
                anomaly("p03", END.minusDays(1), Metric.SESSIONS, 60),
                anomaly("p04", END.minusDays(1), Metric.SESSIONS, 60),
                anomaly("p05", END, Metric.SESSIONS, 60),
                anomaly("p06", END, Metric.SESSIONS, 60));
        PortfolioAnalysis portfolio = new PortfolioPatternAnalyzer(new PortfolioSettings()).analyze(ids, anomalies);

        List<Prediction> predictions = engine.predict(datasets, portfolio);

        assertThat(portfolio.getCascading()).hasSize(1);
        assertThat(predictions).extracting(Prediction::getEntity)
                .containsExactly("p07", "p08", "p09", "p10");
        assertThat(predictions).allSatisfy(p -> {
            assertThat(p.getPredictionDate()).isEqualTo(END.plusDays(1));
            assertThat(p.getAnomalyProbability()).isCloseTo(0.4, within(1e-9));
            assertThat(p.getExpectedLow()).isCloseTo(80.0, within(1e-9));
            assertThat(p.getExpectedHigh()).isCloseTo(120.0, within(1e-9));
            assertThat(p.getPredictionBasis()).isEqualTo("Cascading pattern spreading (sessions)");
        });
    }

    @Test
    @DisplayName("Should NOT warn when the cascade spreads too slowly")
    void shouldIgnoreSlowCascade() {
        List<String> ids = List.of("p01", "p02", "p03", "p04", "p05", "p06", "p07", "p08", "p09", "p10");
        List<PropertyDataset> datasets = ids.stream().map(id -> dataset(id, repeat(100, 7))).toList();
        List<Anomaly> anomalies = List.of(
                anomaly("p01", END.minusDays(2), Metric.SESSIONS, 60),
                anomaly("p02", END.minusDays(1), Metric.SESSIONS, 60),
                anomaly("p03", END, Metric.SESSIONS, 60));
        PortfolioAnalysis portfolio = new PortfolioPatternAnalyzer(new PortfolioSettings()).analyze(ids, anomalies);

        assertThat(engine.predict(datasets, portfolio)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Consolidation and reference date
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should average probabilities of predictions sharing a key and keep the longer basis")
    void shouldConsolidateDuplicates() {
        Prediction trend = prediction("p1", 0.9, "Trend projection (30.0% change/week)", "trend action");
        Prediction event = prediction("p1", 0.5, "Upcoming event: X", "event action");
        Prediction other = prediction("p2", 0.6, "Upcoming event: Y", "other action");

        List<Prediction> consolidated = PredictiveEngine.consolidate(List.of(event, other, trend));

        assertThat(consolidated).hasSize(2);
        Prediction merged = consolidated.get(0);
        assertThat(merged.getEntity()).isEqualTo("p1");
        assertThat(merged.getAnomalyProbability()).isCloseTo(0.7, within(1e-9));
        assertThat(merged.getConfidence()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(merged.getPredictionBasis()).isEqualTo("Trend projection (30.0% change/week)");
        assertThat(merged.getRecommendedAction()).isEqualTo("trend action");
        assertThat(consolidated.get(1).getEntity()).isEqualTo("p2");
    }

    @Test
    @DisplayName("Should anchor the horizon on the latest date observed in the portfolio")
    void shouldUseLatestObservedDate() {
        PropertyDataset older = dataset("p1", List.of(row(END.minusDays(3), 100)));
        PropertyDataset newer = dataset("p2", List.of(row(END, 100)));

        assertThat(PredictiveEngine.referenceDate(List.of(older, newer))).contains(END);
        assertThat(PredictiveEngine.referenceDate(List.of())).isEmpty();
    }

    @Test
    @DisplayName("Should produce identical predictions for identical input")
    void shouldBeDeterministic() {
        List<PropertyDataset> datasets = List.of(
                dataset("p1", concat(repeat(100, 7), repeat(150, 7))),
                dataset("p2", thursdayPeaks(28)));
        PortfolioAnalysis portfolio = new PortfolioPatternAnalyzer(new PortfolioSettings())
                .analyze(List.of("p1", "p2"), List.of());

        assertThat(engine.predict(datasets, portfolio)).isEqualTo(engine.predict(datasets, portfolio));
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Sessions of 100, except 300 on Thursdays. */
    private static List<DailyMetrics> thursdayPeaks(int days) {
        List<DailyMetrics> rows = new ArrayList<>();
        for (int i = days - 1; i >= 0; i--) {
            LocalDate date = END.minusDays(i);
            rows.add(row(date, date.getDayOfWeek() == DayOfWeek.THURSDAY ? 300 : 100));
        }
        return rows;
    }

    private static Map<Metric, MetricSeries> overall(PropertyDataset dataset) {
        Map<Metric, MetricSeries> series = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            series.put(metric, dataset.overall(metric));
        }
        return series;
    }

    private static ExternalEvent event(LocalDate date, String name, EventType type, ImpactLevel level) {
        return ExternalEvent.builder()
                .date(date)
                .eventType(type)
                .name(name)
                .description(name + " description")
                .impactLevel(level)
                .affectedMetrics(Metric.SESSIONS, Metric.CONVERSIONS)
                .confidenceBoost(0.8)
                .build();
    }

    private static Prediction prediction(String entity, double probability, String basis, String action) {
        return Prediction.builder()
                .entity(entity)
                .metric(Metric.SESSIONS)
                .predictionDate(END.plusDays(2))
                .predictedValue(100)
                .expectedRange(80, 120)
                .anomalyProbability(probability)
                .predictionBasis(basis)
                .recommendedAction(action)
                .potentialImpact(50)
                .build();
    }
}
