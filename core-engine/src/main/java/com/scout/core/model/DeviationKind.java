package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an anomaly's deviation value should be read.
 */
public enum DeviationKind {

    Z_SCORE("z_score"),
    DROP_PERCENTAGE("drop_percentage"),
    CHANGE_PERCENTAGE("change_percentage");

    private final String id;

    DeviationKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }
}
