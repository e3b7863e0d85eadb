package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Explanation attached to an enriched {@link Anomaly}.
 *
 * @since 1.0.0
 */
public final class RootCause {

    public static final String UNKNOWN_CAUSE = "Unknown";

    private final String primaryCause;
    private final ConfidenceLevel confidence;
    private final String explanation;
    private final String recommendedAction;

    public RootCause(String primaryCause, ConfidenceLevel confidence, String explanation,
            String recommendedAction) {
        this.primaryCause = Objects.requireNonNull(primaryCause, "primaryCause must not be null");
        this.confidence = Objects.requireNonNull(confidence, "confidence must not be null");
        this.explanation = explanation;
        this.recommendedAction = recommendedAction;
    }

    /**
     * @return the attachment used when no candidate cause qualifies
     */
    public static RootCause unknown() {
        return new RootCause(UNKNOWN_CAUSE, ConfidenceLevel.LOW,
                "No clear external cause identified",
                "Investigate client-specific factors");
    }

    @JsonIgnore
    public boolean isUnknown() {
        return UNKNOWN_CAUSE.equals(primaryCause);
    }

    public String getPrimaryCause() {
        return primaryCause;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public String getExplanation() {
        return explanation;
    }

    public String getRecommendedAction() {
        return recommendedAction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCause that))
            return false;
        return primaryCause.equals(that.primaryCause)
                && confidence == that.confidence
                && Objects.equals(explanation, that.explanation)
                && Objects.equals(recommendedAction, that.recommendedAction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primaryCause, confidence, explanation, recommendedAction);
    }

    @Override
    public String toString() {
        return "RootCause{" + primaryCause + ", confidence=" + confidence.getId() + '}';
    }
}
