package com.scout.core.prediction;

import com.scout.core.model.ConfidenceLevel;
import com.scout.core.model.Metric;
import com.scout.core.model.Prediction;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of a run's predictions: totals per confidence, counts per date and
 * the highest-risk entries.
 */
public final class PredictionReport {

    static final int TOP_RISKS = 5;

    private final int totalPredictions;
    private final int highConfidence;
    private final int mediumConfidence;
    private final String predictionHorizon;
    private final Map<LocalDate, Integer> byDate;
    private final List<Risk> topRisks;

    private PredictionReport(int totalPredictions, int highConfidence, int mediumConfidence,
            String predictionHorizon, Map<LocalDate, Integer> byDate, List<Risk> topRisks) {
        this.totalPredictions = totalPredictions;
        this.highConfidence = highConfidence;
        this.mediumConfidence = mediumConfidence;
        this.predictionHorizon = predictionHorizon;
        this.byDate = Collections.unmodifiableMap(byDate);
        this.topRisks = List.copyOf(topRisks);
    }

    public static PredictionReport of(List<Prediction> predictions, int horizonDays) {
        Map<LocalDate, Integer> byDate = new TreeMap<>();
        int high = 0;
        int medium = 0;
        for (Prediction p : predictions) {
            byDate.merge(p.getPredictionDate(), 1, Integer::sum);
            if (p.getConfidence() == ConfidenceLevel.HIGH) {
                high++;
            } else if (p.getConfidence() == ConfidenceLevel.MEDIUM) {
                medium++;
            }
        }
        List<Risk> risks = predictions.stream()
                .sorted(Comparator.comparingDouble(Prediction::getRiskScore).reversed()
                        .thenComparing(Prediction::getKey))
                .limit(TOP_RISKS)
                .map(Risk::new)
                .toList();
        return new PredictionReport(predictions.size(), high, medium, horizonDays + " days", byDate, risks);
    }

    public int getTotalPredictions() {
        return totalPredictions;
    }

    public int getHighConfidence() {
        return highConfidence;
    }

    public int getMediumConfidence() {
        return mediumConfidence;
    }

    public String getPredictionHorizon() {
        return predictionHorizon;
    }

    public Map<LocalDate, Integer> getByDate() {
        return byDate;
    }

    public List<Risk> getTopRisks() {
        return topRisks;
    }

    /** One of the highest {@code probability × potential impact} predictions. */
    public static final class Risk {
        private final String client;
        private final Metric metric;
        private final LocalDate date;
        private final String probability;
        private final String action;

        Risk(Prediction prediction) {
            this.client = prediction.getEntity();
            this.metric = prediction.getMetric();
            this.date = prediction.getPredictionDate();
            this.probability = String.format(Locale.ROOT, "%.1f%%", prediction.getAnomalyProbability() * 100);
            this.action = prediction.getRecommendedAction();
        }

        public String getClient() {
            return client;
        }

        public Metric getMetric() {
            return metric;
        }

        public LocalDate getDate() {
            return date;
        }

        public String getProbability() {
            return probability;
        }

        public String getAction() {
            return action;
        }
    }
}
