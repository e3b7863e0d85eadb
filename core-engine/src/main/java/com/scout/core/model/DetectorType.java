package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Detector that produced an {@link Anomaly}.
 *
 * @since 1.0.0
 */
public enum DetectorType {

    DISASTER("disaster", "P0"),
    SPAM("spam", "P1"),
    RECORD("record", "P1-P3"),
    TREND("trend", "P2-P3"),
    SEGMENT("segment", "P2-P3");

    private final String id;
    private final String priorityRange;

    DetectorType(String id, String priorityRange) {
        this.id = id;
        this.priorityRange = priorityRange;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * @return the priority label printed in the detector's report header
     */
    public String getPriorityRange() {
        return priorityRange;
    }
}
