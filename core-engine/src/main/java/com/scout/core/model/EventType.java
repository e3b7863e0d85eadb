package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of an {@link ExternalEvent}.
 *
 * @since 1.0.0
 */
public enum EventType {

    GOOGLE_ALGO("google_algo"),
    GOOGLE_ADS("google_ads"),
    GA4_UPDATE("ga4_update"),
    HOLIDAY("holiday"),
    INDUSTRY("industry"),
    SEASONAL("seasonal"),
    TECHNICAL("technical"),
    ECONOMIC("economic"),
    WEEKEND_EFFECT("weekend_effect");

    private final String id;

    EventType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Platform-side events (ranking algorithms, analytics platform changes,
     * technical rollouts) that hit many properties at once.
     *
     * @return {@code true} for algorithm, GA4 and technical events
     */
    public boolean isPlatformWide() {
        return this == GOOGLE_ALGO || this == GA4_UPDATE || this == TECHNICAL;
    }

    @JsonCreator
    public static EventType fromId(String id) {
        if (id != null) {
            String normalised = id.toLowerCase(Locale.ROOT);
            for (EventType t : values()) {
                if (t.id.equals(normalised)) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown event type: '" + id + "'");
    }
}
