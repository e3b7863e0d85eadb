package com.scout.core.rootcause;

import com.scout.core.config.RootCauseSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.CandidateCause;
import com.scout.core.model.ExternalEvent;
import com.scout.core.model.ImpactLevel;
import com.scout.core.model.RootCause;
import com.scout.core.model.RootCauseCorrelation;
import com.scout.core.portfolio.PortfolioAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlates anomalies with the external event calendar.
 *
 * <h3>Scoring</h3>
 * <p>
 * A candidate event's score starts at its {@code confidence_boost} and is
 * multiplied by 1.2 when the event affects the anomaly's metric (0.7
 * otherwise), by a severity factor matching the event's impact level against
 * the anomaly's business impact, and by {@code portfolioBoost} for
 * platform-wide events when the anomaly is part of a portfolio pattern. The
 * score is capped at 1.0 and candidates must exceed {@code minScore}.
 * </p>
 *
 * <p>
 * Mondays additionally get a synthetic weekend-recovery candidate.
 * </p>
 *
 * @since 1.0.0
 */
public class RootCauseCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(RootCauseCorrelator.class);

    private static final Comparator<CandidateCause> RANKING = Comparator
            .comparingDouble(CandidateCause::getCorrelationScore).reversed()
            .thenComparing(c -> c.getEvent().getDate())
            .thenComparing(c -> c.getEvent().getName());

    private final RootCauseSettings settings;
    private final EventCalendar calendar;

    public RootCauseCorrelator(RootCauseSettings settings, EventCalendar calendar) {
        this.settings = Objects.requireNonNull(settings, "RootCauseSettings must not be null");
        this.calendar = Objects.requireNonNull(calendar, "EventCalendar must not be null");
    }

    /**
     * Enrich every anomaly of a run with a root cause.
     *
     * @param anomalies the run's anomalies
     * @param portfolio the run's portfolio analysis
     * @return enriched copies plus the correlations found
     */
    public RootCauseAnalysis analyze(List<Anomaly> anomalies, PortfolioAnalysis portfolio) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Objects.requireNonNull(portfolio, "portfolio must not be null");

        List<Anomaly> enriched = new ArrayList<>(anomalies.size());
        List<RootCauseCorrelation> correlations = new ArrayList<>();
        for (Anomaly anomaly : anomalies) {
            Optional<RootCauseCorrelation> correlation = correlate(anomaly, portfolio.isPortfolioWide(anomaly));
            correlation.ifPresent(correlations::add);
            enriched.add(anomaly.withRootCause(correlation.map(RootCauseCorrelator::toRootCause)
                    .orElseGet(RootCause::unknown)));
        }
        LOG.info("Correlated {} of {} anomalies with external events ({})", correlations.size(),
                anomalies.size(), calendar);
        return new RootCauseAnalysis(enriched, correlations);
    }

    /**
     * Rank the candidate causes of one anomaly.
     *
     * @param anomaly       the anomaly
     * @param portfolioWide whether the anomaly is part of a portfolio pattern
     * @return the correlation, or empty when no candidate exceeds the minimum score
     */
    public Optional<RootCauseCorrelation> correlate(Anomaly anomaly, boolean portfolioWide) {
        List<ExternalEvent> events = new ArrayList<>(calendar.around(anomaly.getDate(), settings.getWindowDays()));
        if (anomaly.getDate().getDayOfWeek() == DayOfWeek.MONDAY) {
            events.add(ExternalEvent.weekendRecovery(anomaly.getDate()));
        }

        List<CandidateCause> candidates = new ArrayList<>();
        for (ExternalEvent event : events) {
            double score = score(anomaly, event, portfolioWide);
            if (score > settings.getMinScore()) {
                candidates.add(new CandidateCause(event, score));
            }
        }
        if (candidates.isEmpty()) {
            LOG.trace("No candidate cause for {}", anomaly);
            return Optional.empty();
        }

        candidates.sort(RANKING);
        List<CandidateCause> top = candidates.subList(0, Math.min(settings.getMaxCandidates(), candidates.size()));
        LOG.debug("Root cause for {}: {}", anomaly, top.get(0));
        return Optional.of(new RootCauseCorrelation(anomaly.getPropertyId(), anomaly.getDate(),
                anomaly.getMetric(), anomaly.getBusinessImpact(), top));
    }

    /**
     * Correlation score of one event for one anomaly, capped at 1.0.
     */
    public double score(Anomaly anomaly, ExternalEvent event, boolean portfolioWide) {
        double score = event.getConfidenceBoost();
        score *= event.affects(anomaly.getMetric()) ? 1.2 : 0.7;
        score *= severityFactor(event.getImpactLevel(), anomaly.getBusinessImpact());
        if (portfolioWide && event.getEventType().isPlatformWide()) {
            score *= settings.getPortfolioBoost();
        }
        return Math.min(score, 1.0);
    }

    static double severityFactor(ImpactLevel level, int severity) {
        return switch (level) {
            case CRITICAL -> severity > 80 ? 1.3 : 0.8;
            case HIGH -> severity > 60 ? 1.2 : 0.8;
            case MEDIUM -> severity > 40 ? 1.1 : 0.8;
            case LOW -> severity < 40 ? 1.0 : 0.8;
        };
    }

    private static RootCause toRootCause(RootCauseCorrelation correlation) {
        CandidateCause top = correlation.getTopCause();
        return new RootCause(correlation.getPrimaryCause(), correlation.getPrimaryConfidence(),
                CauseNarrator.explain(top), CauseNarrator.recommend(top));
    }
}
