package com.scout.core.pipeline;

import com.scout.core.alerting.RankedAlert;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Prediction;
import com.scout.core.portfolio.PortfolioAnalysis;
import com.scout.core.prediction.PredictionReport;
import com.scout.core.rootcause.RootCauseAnalysis;

import java.util.List;

/**
 * Everything one portfolio run produced.
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final List<PropertyOutcome> outcomes;
    private final PortfolioAnalysis portfolio;
    private final RootCauseAnalysis rootCauses;
    private final List<Prediction> predictions;
    private final PredictionReport predictionReport;
    private final List<RankedAlert> rankedAlerts;

    PipelineResult(List<PropertyOutcome> outcomes, PortfolioAnalysis portfolio, RootCauseAnalysis rootCauses,
            List<Prediction> predictions, PredictionReport predictionReport, List<RankedAlert> rankedAlerts) {
        this.outcomes = List.copyOf(outcomes);
        this.portfolio = portfolio;
        this.rootCauses = rootCauses;
        this.predictions = List.copyOf(predictions);
        this.predictionReport = predictionReport;
        this.rankedAlerts = List.copyOf(rankedAlerts);
    }

    public List<PropertyOutcome> getOutcomes() {
        return outcomes;
    }

    public long getSucceededCount() {
        return outcomes.stream().filter(PropertyOutcome::isSucceeded).count();
    }

    public long getFailedCount() {
        return outcomes.size() - getSucceededCount();
    }

    /** Root-cause enriched anomalies, in property then detector order. */
    public List<Anomaly> getAnomalies() {
        return rootCauses.getEnrichedAnomalies();
    }

    public List<Anomaly> getAnomalies(DetectorType type) {
        return getAnomalies().stream().filter(a -> a.getDetectorType() == type).toList();
    }

    public PortfolioAnalysis getPortfolio() {
        return portfolio;
    }

    public RootCauseAnalysis getRootCauses() {
        return rootCauses;
    }

    public List<Prediction> getPredictions() {
        return predictions;
    }

    public PredictionReport getPredictionReport() {
        return predictionReport;
    }

    public List<RankedAlert> getRankedAlerts() {
        return rankedAlerts;
    }
}
