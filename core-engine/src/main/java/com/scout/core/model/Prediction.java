package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Forecast of a possible anomaly for one property and metric on a future date.
 *
 * @since 1.0.0
 */
public final class Prediction {

    private final String entity;
    private final Metric metric;
    private final LocalDate predictionDate;
    private final double predictedValue;
    private final double expectedLow;
    private final double expectedHigh;
    private final double anomalyProbability;
    private final ConfidenceLevel confidence;
    private final String predictionBasis;
    private final String recommendedAction;
    private final double potentialImpact;

    private Prediction(Builder builder) {
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.predictionDate = Objects.requireNonNull(builder.predictionDate, "predictionDate must not be null");
        this.predictedValue = builder.predictedValue;
        this.expectedLow = builder.expectedLow;
        this.expectedHigh = builder.expectedHigh;
        if (builder.anomalyProbability < 0.0 || builder.anomalyProbability > 1.0) {
            throw new IllegalArgumentException("anomalyProbability must be within [0, 1], got: "
                    + builder.anomalyProbability);
        }
        this.anomalyProbability = builder.anomalyProbability;
        this.confidence = builder.confidence != null
                ? builder.confidence
                : ConfidenceLevel.fromProbability(builder.anomalyProbability);
        this.predictionBasis = builder.predictionBasis;
        this.recommendedAction = builder.recommendedAction;
        this.potentialImpact = builder.potentialImpact;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .entity(entity)
                .metric(metric)
                .predictionDate(predictionDate)
                .predictedValue(predictedValue)
                .expectedRange(expectedLow, expectedHigh)
                .anomalyProbability(anomalyProbability)
                .confidence(confidence)
                .predictionBasis(predictionBasis)
                .recommendedAction(recommendedAction)
                .potentialImpact(potentialImpact);
    }

    public static class Builder {
        private String entity;
        private Metric metric;
        private LocalDate predictionDate;
        private double predictedValue;
        private double expectedLow;
        private double expectedHigh;
        private double anomalyProbability;
        private ConfidenceLevel confidence;
        private String predictionBasis;
        private String recommendedAction;
        private double potentialImpact;

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder metric(Metric metric) {
            this.metric = metric;
            return this;
        }

        public Builder predictionDate(LocalDate predictionDate) {
            this.predictionDate = predictionDate;
            return this;
        }

        public Builder predictedValue(double predictedValue) {
            this.predictedValue = predictedValue;
            return this;
        }

        public Builder expectedRange(double low, double high) {
            this.expectedLow = low;
            this.expectedHigh = high;
            return this;
        }

        public Builder anomalyProbability(double anomalyProbability) {
            this.anomalyProbability = anomalyProbability;
            return this;
        }

        /** Explicit confidence; when unset it is derived from the probability. */
        public Builder confidence(ConfidenceLevel confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder predictionBasis(String predictionBasis) {
            this.predictionBasis = predictionBasis;
            return this;
        }

        public Builder recommendedAction(String recommendedAction) {
            this.recommendedAction = recommendedAction;
            return this;
        }

        public Builder potentialImpact(double potentialImpact) {
            this.potentialImpact = potentialImpact;
            return this;
        }

        public Prediction build() {
            return new Prediction(this);
        }
    }

    /**
     * @return {@code entity|metric|date}, the consolidation key
     */
    @JsonIgnore
    public String getKey() {
        return entity + '|' + metric.getId() + '|' + predictionDate;
    }

    /**
     * @param actual observed value
     * @return whether {@code actual} falls outside the expected range
     */
    public boolean isOutsideExpectedRange(double actual) {
        return actual < expectedLow || actual > expectedHigh;
    }

    /** Ranking score for top risks. */
    @JsonIgnore
    public double getRiskScore() {
        return anomalyProbability * potentialImpact;
    }

    public String getEntity() {
        return entity;
    }

    public Metric getMetric() {
        return metric;
    }

    public LocalDate getPredictionDate() {
        return predictionDate;
    }

    public double getPredictedValue() {
        return predictedValue;
    }

    @JsonProperty("expected_range")
    public List<Double> getExpectedRange() {
        return List.of(expectedLow, expectedHigh);
    }

    @JsonIgnore
    public double getExpectedLow() {
        return expectedLow;
    }

    @JsonIgnore
    public double getExpectedHigh() {
        return expectedHigh;
    }

    public double getAnomalyProbability() {
        return anomalyProbability;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public String getPredictionBasis() {
        return predictionBasis;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }

    public double getPotentialImpact() {
        return potentialImpact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Prediction that))
            return false;
        return Double.compare(predictedValue, that.predictedValue) == 0
                && Double.compare(expectedLow, that.expectedLow) == 0
                && Double.compare(expectedHigh, that.expectedHigh) == 0
                && Double.compare(anomalyProbability, that.anomalyProbability) == 0
                && Double.compare(potentialImpact, that.potentialImpact) == 0
                && entity.equals(that.entity)
                && metric == that.metric
                && predictionDate.equals(that.predictionDate)
                && confidence == that.confidence
                && Objects.equals(predictionBasis, that.predictionBasis)
                && Objects.equals(recommendedAction, that.recommendedAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, metric, predictionDate, anomalyProbability);
    }

    @Override
    public String toString() {
        return "Prediction{" + entity + ' ' + metric.getId() + ' ' + predictionDate
                + ", p=" + anomalyProbability + ", basis='" + predictionBasis + "'}";
    }
}
