package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Slicing axis of a metric series.
 *
 * @since 1.0.0
 */
public enum Dimension {

    OVERALL("overall"),
    GEOGRAPHY("geography"),
    DEVICE("device"),
    TRAFFIC_SOURCE("traffic_source"),
    LANDING_PAGE("landing_page");

    /** Dimension value used for the single site-wide series. */
    public static final String SITE_WIDE = "site-wide";

    private final String id;

    Dimension(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Resolve a dimension from its wire identifier.
     *
     * @param id identifier such as {@code traffic_source}
     * @return matching dimension
     * @throws IllegalArgumentException if the identifier is unknown
     */
    public static Dimension fromId(String id) {
        for (Dimension d : values()) {
            if (d.id.equals(id.toLowerCase(Locale.ROOT))) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown dimension: '" + id + "'");
    }
}
