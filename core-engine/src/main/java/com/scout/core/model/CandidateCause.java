package com.scout.core.model;

import java.util.Objects;

/**
 * One scored external event considered as the cause of an anomaly.
 */
public final class CandidateCause {

    private final ExternalEvent event;
    private final double correlationScore;
    private final ConfidenceLevel confidence;

    public CandidateCause(ExternalEvent event, double correlationScore) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.correlationScore = correlationScore;
        this.confidence = ConfidenceLevel.fromScore(correlationScore);
    }

    public ExternalEvent getEvent() {
        return event;
    }

    public double getCorrelationScore() {
        return correlationScore;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CandidateCause that))
            return false;
        return Double.compare(correlationScore, that.correlationScore) == 0 && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, correlationScore);
    }

    @Override
    public String toString() {
        return "CandidateCause{" + event.getName() + ", score=" + correlationScore + '}';
    }
}
