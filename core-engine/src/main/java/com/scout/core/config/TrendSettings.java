package com.scout.core.config;

import java.util.List;

/**
 * Window sizes and thresholds for the trend detector.
 */
public class TrendSettings {

    private int recentDays = 30;
    private int baselineDays = 150;
    private double minSessions = 50;
    private double thresholdPct = 15;

    /** Business impact points per percent of change. */
    private double impactPerPct = 3;

    void validate(List<String> errors) {
        if (recentDays < 1) {
            errors.add("trend.recentDays must be >= 1");
        }
        if (baselineDays < 1) {
            errors.add("trend.baselineDays must be >= 1");
        }
        if (minSessions < 0) {
            errors.add("trend.minSessions must be >= 0");
        }
        if (thresholdPct <= 0) {
            errors.add("trend.thresholdPct must be > 0");
        }
        if (impactPerPct <= 0) {
            errors.add("trend.impactPerPct must be > 0");
        }
    }

    public int getRecentDays() {
        return recentDays;
    }

    public void setRecentDays(int recentDays) {
        this.recentDays = recentDays;
    }

    public int getBaselineDays() {
        return baselineDays;
    }

    public void setBaselineDays(int baselineDays) {
        this.baselineDays = baselineDays;
    }

    public double getMinSessions() {
        return minSessions;
    }

    public void setMinSessions(double minSessions) {
        this.minSessions = minSessions;
    }

    public double getThresholdPct() {
        return thresholdPct;
    }

    public void setThresholdPct(double thresholdPct) {
        this.thresholdPct = thresholdPct;
    }

    public double getImpactPerPct() {
        return impactPerPct;
    }

    public void setImpactPerPct(double impactPerPct) {
        this.impactPerPct = impactPerPct;
    }
}
