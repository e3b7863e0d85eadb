package com.scout.core.portfolio;

import java.util.Objects;

/**
 * One inferred cause of a portfolio pattern with its confidence and the
 * evidence it rests on.
 */
public final class CauseHypothesis {

    private final String cause;
    private final double confidence;
    private final String evidence;

    public CauseHypothesis(String cause, double confidence, String evidence) {
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
        this.confidence = confidence;
        this.evidence = evidence;
    }

    public String getCause() {
        return cause;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CauseHypothesis that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && cause.equals(that.cause)
                && Objects.equals(evidence, that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cause, confidence, evidence);
    }

    @Override
    public String toString() {
        return cause + " (" + confidence + ")";
    }
}
