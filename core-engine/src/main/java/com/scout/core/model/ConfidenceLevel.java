package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative confidence attached to root causes, patterns and predictions.
 *
 * @since 1.0.0
 */
public enum ConfidenceLevel {

    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Label a correlation score: {@code >0.8} very high, {@code >0.6} high,
     * {@code >0.4} medium, otherwise low.
     *
     * @param score correlation score in [0, 1]
     * @return confidence label
     */
    public static ConfidenceLevel fromScore(double score) {
        if (score > 0.8) {
            return VERY_HIGH;
        }
        if (score > 0.6) {
            return HIGH;
        }
        if (score > 0.4) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Label an anomaly probability: {@code >=0.7} high, {@code >=0.5} medium,
     * otherwise low. Predictions never reach {@link #VERY_HIGH}.
     *
     * @param probability probability in [0, 1]
     * @return confidence label
     */
    public static ConfidenceLevel fromProbability(double probability) {
        if (probability >= 0.7) {
            return HIGH;
        }
        if (probability >= 0.5) {
            return MEDIUM;
        }
        return LOW;
    }
}
