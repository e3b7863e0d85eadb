package com.scout.core.prediction;

import com.scout.core.config.PredictionSettings;
import com.scout.core.model.ExternalEvent;
import com.scout.core.model.ImpactLevel;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricObservation;
import com.scout.core.model.MetricSeries;
import com.scout.core.model.Pattern;
import com.scout.core.model.Prediction;
import com.scout.core.model.PropertyDataset;
import com.scout.core.portfolio.PortfolioAnalysis;
import com.scout.core.rootcause.EventCalendar;
import com.scout.core.stats.StatisticalPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Forward-looking anomaly predictions over a fixed horizon.
 *
 * <p>
 * Four methods contribute candidates, all computed on the site-wide series
 * of each property:
 * </p>
 * <ul>
 *   <li><b>trend</b>: last week versus the week before, projected with a
 *       per-day decay and flagged when it leaves {@code recent ± 2·stdev}</li>
 *   <li><b>seasonal</b>: day-of-week averages that sit far from the last
 *       week's average</li>
 *   <li><b>event</b>: calendar events falling inside the horizon</li>
 *   <li><b>propagation</b>: cascading patterns that may reach properties
 *       they have not yet affected</li>
 * </ul>
 *
 * <p>
 * Candidates sharing {@code (entity, metric, date)} are consolidated by
 * averaging their probabilities. The horizon starts the day after the
 * latest date observed anywhere in the portfolio, which keeps runs over the
 * same input reproducible.
 * </p>
 *
 * @since 1.0.0
 */
public class PredictiveEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PredictiveEngine.class);

    static final int WEEK = 7;
    static final int MIN_WEEKDAY_VALUES = 3;
    static final double SEASONAL_PROBABILITY = 0.6;
    static final double TREND_PROBABILITY_CAP = 0.9;
    static final double PROPAGATION_PROBABILITY_CAP = 0.7;

    private static final Comparator<Prediction> RANKING = Comparator
            .comparingDouble(Prediction::getAnomalyProbability).reversed()
            .thenComparing(Prediction::getEntity)
            .thenComparing(Prediction::getMetric)
            .thenComparing(Prediction::getPredictionDate);

    private final PredictionSettings settings;
    private final EventCalendar calendar;

    public PredictiveEngine(PredictionSettings settings, EventCalendar calendar) {
        this.settings = Objects.requireNonNull(settings, "PredictionSettings must not be null");
        this.calendar = Objects.requireNonNull(calendar, "EventCalendar must not be null");
    }

    /**
     * Predict anomalies for every property over the configured horizon.
     *
     * @param datasets  loaded properties
     * @param portfolio the run's portfolio analysis
     * @return consolidated predictions, most probable first
     */
    public List<Prediction> predict(Collection<PropertyDataset> datasets, PortfolioAnalysis portfolio) {
        Objects.requireNonNull(datasets, "datasets must not be null");
        Objects.requireNonNull(portfolio, "portfolio must not be null");

        Optional<LocalDate> reference = referenceDate(datasets);
        if (reference.isEmpty()) {
            LOG.info("No observed dates in the portfolio, skipping predictions");
            return List.of();
        }
        LocalDate referenceDate = reference.get();

        List<Prediction> candidates = new ArrayList<>();
        for (PropertyDataset dataset : datasets) {
            Map<Metric, MetricSeries> series = overallSeries(dataset);
            series.values().forEach(s -> candidates.addAll(fromTrend(s, referenceDate)));
            series.values().forEach(s -> candidates.addAll(fromSeasonality(s, referenceDate)));
            candidates.addAll(fromEvents(dataset.getPropertyId(), series, referenceDate));
        }
        candidates.addAll(fromPatterns(datasets, portfolio, referenceDate));

        List<Prediction> predictions = consolidate(candidates);
        LOG.info("Generated {} prediction(s) from {} candidate(s) for {} day(s) after {}",
                predictions.size(), candidates.size(), settings.getHorizonDays(), referenceDate);
        return predictions;
    }

    /**
     * @return the latest date observed in any property's site-wide series
     */
    public static Optional<LocalDate> referenceDate(Collection<PropertyDataset> datasets) {
        return datasets.stream()
                .map(PropertyDataset::latestDate)
                .flatMap(Optional::stream)
                .max(LocalDate::compareTo);
    }

    // ---------------------------------------------------------------
    // Trend projection
    // ---------------------------------------------------------------

    List<Prediction> fromTrend(MetricSeries series, LocalDate referenceDate) {
        if (series.size() < settings.getMinTrendPoints() || series.size() <= WEEK) {
            return List.of();
        }
        List<MetricObservation> lastTwoWeeks = series.tail(2 * WEEK);
        double[] older = MetricSeries.toValues(lastTwoWeeks.subList(0, lastTwoWeeks.size() - WEEK));
        double[] recent = MetricSeries.toValues(lastTwoWeeks.subList(lastTwoWeeks.size() - WEEK, lastTwoWeeks.size()));

        double recentAvg = StatisticalPrimitives.mean(recent);
        double olderAvg = StatisticalPrimitives.mean(older);
        double trendChange = olderAvg > 0 ? (recentAvg - olderAvg) / olderAvg : 0.0;
        double stdev = recent.length > 1 ? StatisticalPrimitives.sampleStdDev(recent) : recentAvg * 0.1;
        double low = recentAvg - 2 * stdev;
        double high = recentAvg + 2 * stdev;

        List<Prediction> predictions = new ArrayList<>();
        for (int day = 1; day <= settings.getHorizonDays(); day++) {
            double predictedChange = trendChange * Math.pow(settings.getTrendDecay(), day);
            double predicted = recentAvg * (1 + predictedChange);
            if (predicted >= low && predicted <= high) {
                continue;
            }
            predictions.add(Prediction.builder()
                    .entity(series.getPropertyId())
                    .metric(series.getMetric())
                    .predictionDate(referenceDate.plusDays(day))
                    .predictedValue(predicted)
                    .expectedRange(low, high)
                    .anomalyProbability(Math.min(Math.abs(predictedChange) * 2, TREND_PROBABILITY_CAP))
                    .predictionBasis(String.format(Locale.ROOT, "Trend projection (%.1f%% change/week)",
                            trendChange * 100))
                    .recommendedAction(trendAction(series.getMetric(), trendChange))
                    .potentialImpact(Math.abs(trendChange) * 50)
                    .build());
        }
        if (!predictions.isEmpty()) {
            LOG.debug("Trend projection for {}: change={} predictions={}", series.describe(), trendChange,
                    predictions.size());
        }
        return predictions;
    }

    static String trendAction(Metric metric, double trendChange) {
        String direction = trendChange < 0 ? "declining" : "growing";
        String pace = Math.abs(trendChange) > 0.2 ? "rapidly" : "steadily";
        return switch (metric) {
            case CONVERSIONS -> "Conversions " + pace + " " + direction + " - review funnel and campaigns";
            case USERS -> "User acquisition " + pace + " " + direction + " - check traffic sources";
            case SESSIONS -> "Sessions " + pace + " " + direction + " - monitor site performance";
            case PAGE_VIEWS -> "Engagement " + pace + " " + direction + " - review content strategy";
        };
    }

    // ---------------------------------------------------------------
    // Weekly seasonality
    // ---------------------------------------------------------------

    List<Prediction> fromSeasonality(MetricSeries series, LocalDate referenceDate) {
        if (series.size() < settings.getMinSeasonalPoints()) {
            return List.of();
        }
        Map<DayOfWeek, List<MetricObservation>> byWeekday = new EnumMap<>(DayOfWeek.class);
        for (MetricObservation o : series.getObservations()) {
            byWeekday.computeIfAbsent(o.getDate().getDayOfWeek(), k -> new ArrayList<>()).add(o);
        }
        double recentAvg = StatisticalPrimitives.mean(MetricSeries.toValues(series.tail(WEEK)));

        List<Prediction> predictions = new ArrayList<>();
        for (int day = 1; day <= settings.getHorizonDays(); day++) {
            LocalDate date = referenceDate.plusDays(day);
            List<MetricObservation> sameDay = byWeekday.getOrDefault(date.getDayOfWeek(), List.of());
            if (sameDay.size() < MIN_WEEKDAY_VALUES) {
                continue;
            }
            double[] values = MetricSeries.toValues(sameDay);
            double dowAvg = StatisticalPrimitives.mean(values);
            double dowStdev = StatisticalPrimitives.sampleStdDev(values);
            if (Math.abs(dowAvg - recentAvg) <= 2 * dowStdev) {
                continue;
            }
            String weekday = date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
            double percentDifferent = recentAvg > 0 ? (dowAvg / recentAvg - 1) * 100 : 0.0;
            predictions.add(Prediction.builder()
                    .entity(series.getPropertyId())
                    .metric(series.getMetric())
                    .predictionDate(date)
                    .predictedValue(dowAvg)
                    .expectedRange(dowAvg - dowStdev, dowAvg + dowStdev)
                    .anomalyProbability(SEASONAL_PROBABILITY)
                    .predictionBasis(String.format(Locale.ROOT, "Weekly pattern (%s typically %.1f%% different)",
                            weekday, percentDifferent))
                    .recommendedAction("Expected " + weekday + " variation - monitor for unusual deviation")
                    .potentialImpact(30)
                    .build());
        }
        return predictions;
    }

    // ---------------------------------------------------------------
    // Calendar events
    // ---------------------------------------------------------------

    List<Prediction> fromEvents(String propertyId, Map<Metric, MetricSeries> series, LocalDate referenceDate) {
        List<ExternalEvent> upcoming = calendar.between(referenceDate.plusDays(1),
                referenceDate.plusDays(settings.getHorizonDays()));
        List<Prediction> predictions = new ArrayList<>();
        for (ExternalEvent event : upcoming) {
            boolean high = event.getImpactLevel().isAtLeast(ImpactLevel.HIGH);
            for (Metric metric : event.getAffectedMetrics()) {
                MetricSeries s = series.get(metric);
                if (s == null || s.isEmpty()) {
                    continue;
                }
                double baseline = StatisticalPrimitives.mean(MetricSeries.toValues(s.tail(WEEK)));
                predictions.add(Prediction.builder()
                        .entity(propertyId)
                        .metric(metric)
                        .predictionDate(event.getDate())
                        .predictedValue(baseline * EventImpact.multiplier(event.getEventType(), metric))
                        .expectedRange(baseline * 0.8, baseline * 1.2)
                        .anomalyProbability(high ? 0.75 : 0.5)
                        .predictionBasis("Upcoming event: " + event.getName())
                        .recommendedAction("Prepare for " + event.getName() + " impact - " + event.getDescription())
                        .potentialImpact(high ? 70 : 40)
                        .build());
            }
        }
        return predictions;
    }

    // ---------------------------------------------------------------
    // Pattern propagation
    // ---------------------------------------------------------------

    List<Prediction> fromPatterns(Collection<PropertyDataset> datasets, PortfolioAnalysis portfolio,
            LocalDate referenceDate) {
        List<Prediction> predictions = new ArrayList<>();
        int daysSince = 1;
        for (Pattern pattern : portfolio.getCascading()) {
            double spreadRate = pattern.getSpreadRate();
            if (spreadRate <= 0) {
                continue;
            }
            double probability = Math.min(spreadRate * daysSince * 0.2, PROPAGATION_PROBABILITY_CAP);
            if (probability <= settings.getMinPropagationProbability()) {
                LOG.trace("Cascading pattern {} too slow to propagate (p={})", pattern, probability);
                continue;
            }
            for (PropertyDataset dataset : datasets) {
                String propertyId = dataset.getPropertyId();
                if (pattern.involves(propertyId)) {
                    continue;
                }
                double recentAvg = StatisticalPrimitives.mean(
                        MetricSeries.toValues(dataset.overall(pattern.getMetric()).tail(WEEK)));
                predictions.add(Prediction.builder()
                        .entity(propertyId)
                        .metric(pattern.getMetric())
                        .predictionDate(referenceDate.plusDays(daysSince))
                        .predictedValue(recentAvg)
                        .expectedRange(recentAvg * 0.8, recentAvg * 1.2)
                        .anomalyProbability(probability)
                        .predictionBasis("Cascading pattern spreading (" + pattern.getMetric().getId() + ")")
                        .recommendedAction("Monitor for pattern propagation from other clients")
                        .potentialImpact(50)
                        .build());
            }
        }
        return predictions;
    }

    // ---------------------------------------------------------------
    // Consolidation
    // ---------------------------------------------------------------

    static List<Prediction> consolidate(List<Prediction> candidates) {
        Map<String, Prediction> byKey = new LinkedHashMap<>();
        for (Prediction candidate : candidates) {
            byKey.merge(candidate.getKey(), candidate, PredictiveEngine::merge);
        }
        List<Prediction> result = new ArrayList<>(byKey.size());
        for (Prediction p : byKey.values()) {
            result.add(p.toBuilder().confidence(null).build());
        }
        result.sort(RANKING);
        return result;
    }

    private static Prediction merge(Prediction existing, Prediction incoming) {
        Prediction.Builder merged = existing.toBuilder()
                .anomalyProbability((existing.getAnomalyProbability() + incoming.getAnomalyProbability()) / 2);
        if (length(incoming.getPredictionBasis()) > length(existing.getPredictionBasis())) {
            merged.predictionBasis(incoming.getPredictionBasis())
                    .recommendedAction(incoming.getRecommendedAction());
        }
        return merged.build();
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }

    private static Map<Metric, MetricSeries> overallSeries(PropertyDataset dataset) {
        Map<Metric, MetricSeries> series = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            MetricSeries s = dataset.overall(metric);
            if (!s.isEmpty()) {
                series.put(metric, s);
            }
        }
        return series;
    }
}
