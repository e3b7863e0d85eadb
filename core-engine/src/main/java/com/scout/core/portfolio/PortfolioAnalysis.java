package com.scout.core.portfolio;

import com.scout.core.model.Anomaly;
import com.scout.core.model.Pattern;

import java.util.List;
import java.util.Objects;

/**
 * Result of one portfolio pass: the three pattern families, the health
 * score, inferred pattern causes and headline insights.
 *
 * @since 1.0.0
 */
public final class PortfolioAnalysis {

    private final int totalProperties;
    private final int totalAnomalies;
    private final List<Pattern> simultaneous;
    private final List<Pattern> cascading;
    private final List<Pattern> correlations;
    private final int healthScore;
    private final List<PatternCause> patternCauses;
    private final List<PortfolioInsight> insights;
    private final List<PortfolioInsight> recommendations;

    PortfolioAnalysis(int totalProperties, int totalAnomalies, List<Pattern> simultaneous,
            List<Pattern> cascading, List<Pattern> correlations, int healthScore,
            List<PatternCause> patternCauses, List<PortfolioInsight> insights,
            List<PortfolioInsight> recommendations) {
        this.totalProperties = totalProperties;
        this.totalAnomalies = totalAnomalies;
        this.simultaneous = List.copyOf(simultaneous);
        this.cascading = List.copyOf(cascading);
        this.correlations = List.copyOf(correlations);
        this.healthScore = healthScore;
        this.patternCauses = List.copyOf(patternCauses);
        this.insights = List.copyOf(insights);
        this.recommendations = List.copyOf(recommendations);
    }

    /**
     * Whether an anomaly belongs to a simultaneous pattern (same date, metric
     * and property) or to a cascading pattern (same metric, date in range,
     * property affected).
     *
     * @param anomaly the anomaly
     * @return {@code true} when the anomaly is part of a portfolio-wide pattern
     */
    public boolean isPortfolioWide(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        for (Pattern p : simultaneous) {
            if (matches(p, anomaly)) {
                return true;
            }
        }
        for (Pattern p : cascading) {
            if (matches(p, anomaly)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(Pattern pattern, Anomaly anomaly) {
        return pattern.getMetric() == anomaly.getMetric()
                && pattern.covers(anomaly.getDate())
                && pattern.involves(anomaly.getPropertyId());
    }

    public int getTotalProperties() {
        return totalProperties;
    }

    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    public List<Pattern> getSimultaneous() {
        return simultaneous;
    }

    public List<Pattern> getCascading() {
        return cascading;
    }

    public List<Pattern> getCorrelations() {
        return correlations;
    }

    public int getHealthScore() {
        return healthScore;
    }

    public List<PatternCause> getPatternCauses() {
        return patternCauses;
    }

    public List<PortfolioInsight> getInsights() {
        return insights;
    }

    public List<PortfolioInsight> getRecommendations() {
        return recommendations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PortfolioAnalysis that))
            return false;
        return totalProperties == that.totalProperties
                && totalAnomalies == that.totalAnomalies
                && healthScore == that.healthScore
                && simultaneous.equals(that.simultaneous)
                && cascading.equals(that.cascading)
                && correlations.equals(that.correlations)
                && patternCauses.equals(that.patternCauses)
                && insights.equals(that.insights)
                && recommendations.equals(that.recommendations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalProperties, totalAnomalies, simultaneous, cascading, correlations, healthScore);
    }

    @Override
    public String toString() {
        return "PortfolioAnalysis{properties=" + totalProperties
                + ", anomalies=" + totalAnomalies
                + ", simultaneous=" + simultaneous.size()
                + ", cascading=" + cascading.size()
                + ", correlations=" + correlations.size()
                + ", health=" + healthScore + '}';
    }
}
