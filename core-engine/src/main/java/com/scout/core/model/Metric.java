package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Daily analytics metric tracked per property.
 *
 * @since 1.0.0
 */
public enum Metric {

    SESSIONS("sessions", 1.0),
    USERS("users", 1.2),
    PAGE_VIEWS("page_views", 0.8),
    CONVERSIONS("conversions", 2.0);

    private final String id;

    /** Weight applied when scoring the business impact of an outlier. */
    private final double businessWeight;

    Metric(String id, double businessWeight) {
        this.id = id;
        this.businessWeight = businessWeight;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public double getBusinessWeight() {
        return businessWeight;
    }

    /**
     * Resolve a metric from its wire identifier (case-insensitive).
     *
     * @param id identifier such as {@code page_views}
     * @return matching metric
     * @throws IllegalArgumentException if the identifier is unknown
     */
    @JsonCreator
    public static Metric fromId(String id) {
        if (id != null) {
            String normalised = id.toLowerCase(Locale.ROOT);
            for (Metric m : values()) {
                if (m.id.equals(normalised)) {
                    return m;
                }
            }
        }
        throw new IllegalArgumentException("Unknown metric: '" + id
                + "'. Supported: sessions, users, page_views, conversions");
    }
}
