package com.scout.core.prediction;

import com.scout.core.model.EventType;
import com.scout.core.model.Metric;

/**
 * Expected multiplier applied to a metric's baseline on the day of an event.
 */
final class EventImpact {

    private EventImpact() {
        // utility class
    }

    static double multiplier(EventType type, Metric metric) {
        return switch (type) {
            case HOLIDAY -> switch (metric) {
                case CONVERSIONS -> 1.5;
                case SESSIONS, USERS -> 0.7;
                default -> 1.0;
            };
            case GOOGLE_ALGO -> switch (metric) {
                case SESSIONS, PAGE_VIEWS -> 0.8;
                case USERS -> 0.85;
                default -> 1.0;
            };
            case TECHNICAL -> 0.6;
            case SEASONAL -> switch (metric) {
                case CONVERSIONS -> 1.2;
                case SESSIONS -> 1.1;
                default -> 1.0;
            };
            default -> 1.0;
        };
    }
}
