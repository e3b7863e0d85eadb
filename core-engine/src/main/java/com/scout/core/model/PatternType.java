package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of cross-property {@link Pattern}.
 */
public enum PatternType {

    SIMULTANEOUS("simultaneous"),
    CASCADING("cascading"),
    METRIC_CORRELATION("metric_correlation");

    private final String id;

    PatternType(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
