package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Expected impact of an {@link ExternalEvent}, ordered from weakest to strongest.
 */
public enum ImpactLevel {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(ImpactLevel other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static ImpactLevel fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Impact level must not be null");
        }
        return valueOf(id.toUpperCase(Locale.ROOT));
    }
}
