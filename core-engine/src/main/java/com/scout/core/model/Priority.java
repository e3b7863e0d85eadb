package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Alert priority. Declaration order is urgency order, so the natural
 * {@link Enum#compareTo(Enum) ordering} sorts the most urgent first.
 *
 * @since 1.0.0
 */
public enum Priority {

    /** Site down or tracking broken: act now. */
    P0,
    /** Spam traffic or worst-ever values. */
    P1,
    /** Sustained decline worth investigating. */
    P2,
    /** Good news or informational. */
    P3;

    @JsonValue
    public String getId() {
        return name();
    }

    public boolean isMoreUrgentThan(Priority other) {
        return compareTo(other) < 0;
    }
}
