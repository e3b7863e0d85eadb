package com.scout.core.config;

import java.util.List;

/**
 * Thresholds for the P0 disaster detector.
 */
public class DisasterSettings {

    /** Latest sessions strictly below this value mean near-zero traffic. */
    private double nearZeroSessions = 10;

    /** Baseline mean sessions above which zero conversions mean broken tracking. */
    private double trackingFailureMinSessions = 50;

    /** Drop percentage (vs. baseline mean) that counts as catastrophic. */
    private double catastrophicDropPct = 90;

    /** Number of days before the latest one that form the baseline; 0 uses every prior day. */
    private int baselineDays = 0;

    void validate(List<String> errors) {
        if (nearZeroSessions < 0) {
            errors.add("disaster.nearZeroSessions must be >= 0");
        }
        if (trackingFailureMinSessions < 0) {
            errors.add("disaster.trackingFailureMinSessions must be >= 0");
        }
        if (catastrophicDropPct <= 0 || catastrophicDropPct > 100) {
            errors.add("disaster.catastrophicDropPct must be in (0, 100]");
        }
        if (baselineDays < 0) {
            errors.add("disaster.baselineDays must be >= 0");
        }
    }

    public double getNearZeroSessions() {
        return nearZeroSessions;
    }

    public void setNearZeroSessions(double nearZeroSessions) {
        this.nearZeroSessions = nearZeroSessions;
    }

    public double getTrackingFailureMinSessions() {
        return trackingFailureMinSessions;
    }

    public void setTrackingFailureMinSessions(double trackingFailureMinSessions) {
        this.trackingFailureMinSessions = trackingFailureMinSessions;
    }

    public double getCatastrophicDropPct() {
        return catastrophicDropPct;
    }

    public void setCatastrophicDropPct(double catastrophicDropPct) {
        this.catastrophicDropPct = catastrophicDropPct;
    }

    public int getBaselineDays() {
        return baselineDays;
    }

    public void setBaselineDays(int baselineDays) {
        this.baselineDays = baselineDays;
    }
}
