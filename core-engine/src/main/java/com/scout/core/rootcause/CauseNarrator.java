package com.scout.core.rootcause;

import com.scout.core.model.CandidateCause;
import com.scout.core.model.ExternalEvent;

/**
 * Human-readable explanation and recommended action for a correlated cause,
 * keyed off the event type.
 */
final class CauseNarrator {

    private CauseNarrator() {
        // utility class
    }

    static String explain(CandidateCause cause) {
        ExternalEvent event = cause.getEvent();
        String base = switch (event.getEventType()) {
            case GOOGLE_ALGO -> "This anomaly aligns with " + event.getName()
                    + ", which typically affects organic traffic for up to "
                    + event.getTypicalDurationDays() + " days.";
            case HOLIDAY -> "Traffic patterns affected by " + event.getName()
                    + ". This is expected seasonal behavior.";
            case GA4_UPDATE -> "GA4 platform change: " + event.getDescription()
                    + ". May require tracking adjustments.";
            case TECHNICAL -> "Technical factor: " + event.getDescription() + ". Monitor for persistent impact.";
            case SEASONAL -> "Seasonal pattern: " + event.getDescription() + ". Compare with previous year data.";
            case WEEKEND_EFFECT -> "Normal weekend recovery pattern. No action needed.";
            default -> "External event detected: " + event.getDescription();
        };
        return base + " (Confidence: " + cause.getConfidence().getId() + ")";
    }

    static String recommend(CandidateCause cause) {
        return switch (cause.getEvent().getEventType()) {
            case GOOGLE_ALGO -> "Review search rankings and content quality. "
                    + "Algorithm effects typically stabilize within 2 weeks.";
            case HOLIDAY -> "Expected variation. Compare with previous year's holiday performance.";
            case GA4_UPDATE -> "Check tracking implementation. May need configuration updates.";
            case TECHNICAL -> "Monitor closely. Contact development team if issues persist.";
            case SEASONAL -> "Normal seasonal variation. Adjust forecasts accordingly.";
            case WEEKEND_EFFECT -> "No action required. Normal weekly pattern.";
            default -> "Monitor situation and gather more data.";
        };
    }
}
