package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Strength of a metric co-occurrence across the portfolio.
 */
public enum CorrelationStrength {

    WEAK,
    MODERATE,
    STRONG;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param occurrences number of (property, date) groups in which the pair co-occurred
     * @return {@code strong} above 10, {@code moderate} above 5, otherwise {@code weak}
     */
    public static CorrelationStrength fromOccurrences(int occurrences) {
        if (occurrences > 10) {
            return STRONG;
        }
        if (occurrences > 5) {
            return MODERATE;
        }
        return WEAK;
    }
}
