package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Ranked candidate causes for one anomaly. Only produced when at least one
 * candidate scores above the minimum correlation score.
 *
 * @since 1.0.0
 */
public final class RootCauseCorrelation {

    private final String propertyId;
    private final LocalDate anomalyDate;
    private final Metric anomalyMetric;
    private final int anomalySeverity;
    private final List<CandidateCause> likelyCauses;

    /**
     * @param likelyCauses candidates ordered by descending score; must not be empty
     */
    public RootCauseCorrelation(String propertyId, LocalDate anomalyDate, Metric anomalyMetric,
            int anomalySeverity, List<CandidateCause> likelyCauses) {
        this.propertyId = propertyId;
        this.anomalyDate = Objects.requireNonNull(anomalyDate, "anomalyDate must not be null");
        this.anomalyMetric = Objects.requireNonNull(anomalyMetric, "anomalyMetric must not be null");
        this.anomalySeverity = anomalySeverity;
        if (likelyCauses == null || likelyCauses.isEmpty()) {
            throw new IllegalArgumentException("A correlation requires at least one candidate cause");
        }
        this.likelyCauses = List.copyOf(likelyCauses);
    }

    @JsonIgnore
    public CandidateCause getTopCause() {
        return likelyCauses.get(0);
    }

    public String getPrimaryCause() {
        return getTopCause().getEvent().getName();
    }

    public ConfidenceLevel getPrimaryConfidence() {
        return getTopCause().getConfidence();
    }

    public String getPropertyId() {
        return propertyId;
    }

    public LocalDate getAnomalyDate() {
        return anomalyDate;
    }

    public Metric getAnomalyMetric() {
        return anomalyMetric;
    }

    public int getAnomalySeverity() {
        return anomalySeverity;
    }

    public List<CandidateCause> getLikelyCauses() {
        return likelyCauses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCauseCorrelation that))
            return false;
        return anomalySeverity == that.anomalySeverity
                && Objects.equals(propertyId, that.propertyId)
                && anomalyDate.equals(that.anomalyDate)
                && anomalyMetric == that.anomalyMetric
                && likelyCauses.equals(that.likelyCauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyId, anomalyDate, anomalyMetric, anomalySeverity, likelyCauses);
    }

    @Override
    public String toString() {
        return "RootCauseCorrelation{" + propertyId + ' ' + anomalyDate + ' ' + anomalyMetric.getId()
                + " -> " + getPrimaryCause() + " (" + getPrimaryConfidence().getId() + ")}";
    }
}
