package com.scout.core.rootcause;

import com.scout.core.model.Anomaly;
import com.scout.core.model.RootCauseCorrelation;

import java.util.List;

/**
 * Enriched anomalies of a run together with the correlations behind them.
 */
public final class RootCauseAnalysis {

    private final List<Anomaly> enrichedAnomalies;
    private final List<RootCauseCorrelation> correlations;
    private final RootCauseSummary summary;

    RootCauseAnalysis(List<Anomaly> enrichedAnomalies, List<RootCauseCorrelation> correlations) {
        this.enrichedAnomalies = List.copyOf(enrichedAnomalies);
        this.correlations = List.copyOf(correlations);
        this.summary = RootCauseSummary.of(this.correlations);
    }

    /** Same order as the input anomalies; every element carries a root cause. */
    public List<Anomaly> getEnrichedAnomalies() {
        return enrichedAnomalies;
    }

    public List<RootCauseCorrelation> getCorrelations() {
        return correlations;
    }

    public RootCauseSummary getSummary() {
        return summary;
    }
}
