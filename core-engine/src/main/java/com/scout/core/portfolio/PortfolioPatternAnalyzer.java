package com.scout.core.portfolio;

import com.scout.core.config.PortfolioSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.ConfidenceLevel;
import com.scout.core.model.CorrelationStrength;
import com.scout.core.model.Metric;
import com.scout.core.model.Pattern;
import com.scout.core.model.PatternType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Aggregates every property's anomalies for a run into cross-property
 * patterns.
 *
 * <h3>Pattern families</h3>
 * <ul>
 * <li><b>Simultaneous</b>: anomalies on the same {@code (date, metric)} in at
 * least {@code patternThreshold} of the portfolio; confidence is
 * {@code min(ratio * 1.5, 1)}.</li>
 * <li><b>Cascading</b>: per metric, windows of up to
 * {@code cascadeWindowDays} distinct anomaly dates within
 * {@code cascadeWindowDays} days of the window start, spanning at least
 * {@code minCascadeDates} dates, whose affected-property union reaches the
 * threshold.</li>
 * <li><b>Metric correlation</b>: metric pairs that co-occur on the same
 * property and date at least {@code minCorrelationCount} times across the
 * portfolio.</li>
 * </ul>
 *
 * <p>
 * This is the run's synchronisation barrier: it must only be called once
 * every property's detection has finished.
 * </p>
 *
 * @since 1.0.0
 */
public class PortfolioPatternAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PortfolioPatternAnalyzer.class);

    static final String CAUSE_PLATFORM = "External platform or algorithm event";
    static final String CAUSE_INDUSTRY = "Industry-wide or seasonal event";
    static final String CAUSE_TECHNICAL = "Common technical issue";
    static final String CAUSE_ROLLOUT = "Gradual rollout or propagating issue";

    /** Average anomalies per property above which the portfolio is flagged. */
    static final int ELEVATED_ACTIVITY_PER_PROPERTY = 5;

    private final PortfolioSettings settings;

    public PortfolioPatternAnalyzer(PortfolioSettings settings) {
        this.settings = Objects.requireNonNull(settings, "PortfolioSettings must not be null");
    }

    /**
     * Analyse a run.
     *
     * @param propertyIds every property of the run, including ones whose
     *                    detection failed (they count towards the total)
     * @param anomalies   all anomalies of the run
     * @return the analysis
     */
    public PortfolioAnalysis analyze(Collection<String> propertyIds, List<Anomaly> anomalies) {
        Objects.requireNonNull(propertyIds, "propertyIds must not be null");
        Objects.requireNonNull(anomalies, "anomalies must not be null");

        Set<String> portfolio = new TreeSet<>(propertyIds);
        anomalies.forEach(a -> portfolio.add(a.getPropertyId()));
        int total = portfolio.size();

        List<Pattern> simultaneous = detectSimultaneous(anomalies, total);
        List<Pattern> cascading = detectCascading(anomalies, total);
        List<Pattern> correlations = detectCorrelations(anomalies, total);
        int health = healthScore(total, anomalies.size(), simultaneous.size());

        List<PatternCause> causes = inferCauses(simultaneous, cascading);
        List<PortfolioInsight> insights = new ArrayList<>();
        List<PortfolioInsight> recommendations = new ArrayList<>();
        simultaneous.stream()
                .max(Comparator.comparingDouble(Pattern::getAffectedRatio))
                .ifPresent(top -> insights.add(PortfolioInsight.insight(
                        "Major portfolio impact on " + top.getDate(),
                        top.getAffectedEntities().size() + " properties affected by "
                                + top.getMetric().getId() + " anomalies",
                        "Investigate external factors for this date")));
        if (anomalies.size() > total * ELEVATED_ACTIVITY_PER_PROPERTY) {
            recommendations.add(PortfolioInsight.recommendation("high",
                    "Portfolio showing elevated anomaly activity",
                    "Review tracking implementation across all properties"));
        }

        PortfolioAnalysis analysis = new PortfolioAnalysis(total, anomalies.size(), simultaneous, cascading,
                correlations, health, causes, insights, recommendations);
        LOG.info("Portfolio analysis complete: {}", analysis);
        return analysis;
    }

    // ---------------------------------------------------------------
    // Simultaneous
    // ---------------------------------------------------------------

    List<Pattern> detectSimultaneous(List<Anomaly> anomalies, int total) {
        SortedMap<LocalDate, Map<Metric, Set<String>>> byDate = new TreeMap<>();
        for (Anomaly a : anomalies) {
            byDate.computeIfAbsent(a.getDate(), d -> new EnumMap<>(Metric.class))
                    .computeIfAbsent(a.getMetric(), m -> new TreeSet<>())
                    .add(a.getPropertyId());
        }

        List<Pattern> patterns = new ArrayList<>();
        byDate.forEach((date, metrics) -> metrics.forEach((metric, properties) -> {
            double ratio = total == 0 ? 0.0 : (double) properties.size() / total;
            if (ratio >= settings.getPatternThreshold()) {
                LOG.debug("Simultaneous pattern on {} for {}: {}/{}", date, metric.getId(), properties.size(), total);
                patterns.add(Pattern.builder(PatternType.SIMULTANEOUS)
                        .date(date)
                        .metric(metric)
                        .affectedEntities(properties)
                        .totalEntities(total)
                        .confidence(Math.min(ratio * 1.5, 1.0))
                        .confidenceLevel(ratioLevel(ratio))
                        .likelyCause(simultaneousCause(ratio))
                        .build());
            }
        }));
        return patterns;
    }

    static ConfidenceLevel ratioLevel(double ratio) {
        if (ratio > 0.7) {
            return ConfidenceLevel.VERY_HIGH;
        }
        if (ratio > 0.5) {
            return ConfidenceLevel.HIGH;
        }
        if (ratio > 0.3) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    static String simultaneousCause(double ratio) {
        if (ratio > 0.7) {
            return CAUSE_PLATFORM;
        }
        if (ratio > 0.5) {
            return CAUSE_INDUSTRY;
        }
        return CAUSE_TECHNICAL;
    }

    // ---------------------------------------------------------------
    // Cascading
    // ---------------------------------------------------------------

    List<Pattern> detectCascading(List<Anomaly> anomalies, int total) {
        Map<Metric, TreeMap<LocalDate, Set<String>>> timelines = new EnumMap<>(Metric.class);
        for (Anomaly a : anomalies) {
            timelines.computeIfAbsent(a.getMetric(), m -> new TreeMap<>())
                    .computeIfAbsent(a.getDate(), d -> new TreeSet<>())
                    .add(a.getPropertyId());
        }

        int windowDays = settings.getCascadeWindowDays();
        List<Pattern> patterns = new ArrayList<>();
        timelines.forEach((metric, timeline) -> {
            List<LocalDate> dates = new ArrayList<>(timeline.keySet());
            for (int i = 0; i + settings.getMinCascadeDates() <= dates.size(); i++) {
                LocalDate start = dates.get(i);
                List<LocalDate> window = new ArrayList<>();
                for (int j = i; j < Math.min(i + windowDays, dates.size()); j++) {
                    if (ChronoUnit.DAYS.between(start, dates.get(j)) <= windowDays) {
                        window.add(dates.get(j));
                    }
                }
                if (window.size() < settings.getMinCascadeDates()) {
                    continue;
                }

                Set<String> affected = new TreeSet<>();
                window.forEach(d -> affected.addAll(timeline.get(d)));
                if (affected.size() < total * settings.getPatternThreshold()) {
                    continue;
                }

                LocalDate end = window.get(window.size() - 1);
                LOG.debug("Cascading pattern for {} {}..{}: {} properties", metric.getId(), start, end, affected.size());
                patterns.add(Pattern.builder(PatternType.CASCADING)
                        .range(start, end)
                        .metric(metric)
                        .affectedEntities(affected)
                        .totalEntities(total)
                        .durationDays(window.size())
                        .confidence((double) affected.size() / total)
                        .confidenceLevel(affected.size() > total * 0.5 ? ConfidenceLevel.HIGH : ConfidenceLevel.MEDIUM)
                        .likelyCause(CAUSE_ROLLOUT)
                        .build());
            }
        });
        return patterns;
    }

    // ---------------------------------------------------------------
    // Metric correlation
    // ---------------------------------------------------------------

    List<Pattern> detectCorrelations(List<Anomaly> anomalies, int total) {
        Map<String, Map<LocalDate, Set<Metric>>> metricsByPropertyDate = new TreeMap<>();
        for (Anomaly a : anomalies) {
            metricsByPropertyDate.computeIfAbsent(a.getPropertyId(), p -> new TreeMap<>())
                    .computeIfAbsent(a.getDate(), d -> EnumSet.noneOf(Metric.class))
                    .add(a.getMetric());
        }

        // pair -> property -> co-occurrence count
        Map<MetricPair, Map<String, Integer>> pairCounts = new TreeMap<>();
        metricsByPropertyDate.forEach((property, byDate) -> byDate.values().forEach(metrics -> {
            List<Metric> list = new ArrayList<>(metrics);
            for (int i = 0; i < list.size(); i++) {
                for (int j = i + 1; j < list.size(); j++) {
                    pairCounts.computeIfAbsent(new MetricPair(list.get(i), list.get(j)), k -> new TreeMap<>())
                            .merge(property, 1, Integer::sum);
                }
            }
        }));

        List<Pattern> patterns = new ArrayList<>();
        pairCounts.forEach((pair, perProperty) -> {
            int occurrences = perProperty.values().stream().mapToInt(Integer::intValue).sum();
            if (occurrences < settings.getMinCorrelationCount()) {
                return;
            }
            double ratio = total == 0 ? 0.0 : (double) perProperty.size() / total;
            patterns.add(Pattern.builder(PatternType.METRIC_CORRELATION)
                    .metric(pair.first)
                    .correlatedMetric(pair.second)
                    .affectedEntities(perProperty.keySet())
                    .totalEntities(total)
                    .occurrenceCount(occurrences)
                    .strength(CorrelationStrength.fromOccurrences(occurrences))
                    .confidence(ratio)
                    .confidenceLevel(ConfidenceLevel.fromScore(ratio))
                    .build());
        });
        return patterns;
    }

    /** Unordered metric pair, normalised to declaration order. */
    private static final class MetricPair implements Comparable<MetricPair> {
        private final Metric first;
        private final Metric second;

        MetricPair(Metric a, Metric b) {
            this.first = a.compareTo(b) <= 0 ? a : b;
            this.second = a.compareTo(b) <= 0 ? b : a;
        }

        @Override
        public int compareTo(MetricPair o) {
            int c = first.compareTo(o.first);
            return c != 0 ? c : second.compareTo(o.second);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof MetricPair that && first == that.first && second == that.second;
        }

        @Override
        public int hashCode() {
            return Objects.hash(first, second);
        }
    }

    // ---------------------------------------------------------------
    // Health and causes
    // ---------------------------------------------------------------

    /**
     * {@code 100 - min(avg * 10, 50) - 5 * simultaneous}, clamped to [0, 100].
     */
    static int healthScore(int totalProperties, int totalAnomalies, int simultaneousCount) {
        if (totalProperties == 0) {
            return 100;
        }
        double avg = (double) totalAnomalies / totalProperties;
        double health = 100.0 - Math.min(avg * 10.0, 50.0) - 5.0 * simultaneousCount;
        return (int) Math.max(0.0, Math.min(100.0, health));
    }

    List<PatternCause> inferCauses(List<Pattern> simultaneous, List<Pattern> cascading) {
        List<PatternCause> causes = new ArrayList<>();
        for (Pattern p : simultaneous) {
            List<CauseHypothesis> hypotheses = new ArrayList<>();
            double ratio = p.getAffectedRatio();
            if (ratio > 0.7) {
                hypotheses.add(new CauseHypothesis("Google Algorithm Update", 0.85,
                        p.getAffectedEntities().size() + " properties affected simultaneously"));
            } else if (ratio > 0.5) {
                hypotheses.add(new CauseHypothesis("Industry-wide Event", 0.7, "Majority of portfolio impacted"));
            }
            if (p.getDate().getDayOfWeek() == DayOfWeek.MONDAY) {
                hypotheses.add(new CauseHypothesis("Weekend Effect Recovery", 0.6, "Monday anomaly pattern detected"));
            }
            causes.add(new PatternCause(p, hypotheses));
        }
        for (Pattern p : cascading) {
            causes.add(new PatternCause(p, List.of(new CauseHypothesis("Gradual Rollout or Propagating Issue", 0.75,
                    "Spread over " + p.getDurationDays() + " days across " + p.getAffectedEntities().size()
                            + " properties"))));
        }
        return causes;
    }
}
