package com.scout.core.config;

import java.util.List;

/**
 * Thresholds for cross-property pattern analysis.
 */
public class PortfolioSettings {

    /** Fraction of the portfolio that must be affected for a pattern. */
    private double patternThreshold = 0.3;

    private int cascadeWindowDays = 7;
    private int minCascadeDates = 3;
    private int minCorrelationCount = 3;

    void validate(List<String> errors) {
        if (patternThreshold <= 0 || patternThreshold > 1) {
            errors.add("portfolio.patternThreshold must be in (0, 1]");
        }
        if (cascadeWindowDays < 1) {
            errors.add("portfolio.cascadeWindowDays must be >= 1");
        }
        if (minCascadeDates < 2) {
            errors.add("portfolio.minCascadeDates must be >= 2");
        }
        if (minCorrelationCount < 1) {
            errors.add("portfolio.minCorrelationCount must be >= 1");
        }
    }

    public double getPatternThreshold() {
        return patternThreshold;
    }

    public void setPatternThreshold(double patternThreshold) {
        this.patternThreshold = patternThreshold;
    }

    public int getCascadeWindowDays() {
        return cascadeWindowDays;
    }

    public void setCascadeWindowDays(int cascadeWindowDays) {
        this.cascadeWindowDays = cascadeWindowDays;
    }

    public int getMinCascadeDates() {
        return minCascadeDates;
    }

    public void setMinCascadeDates(int minCascadeDates) {
        this.minCascadeDates = minCascadeDates;
    }

    public int getMinCorrelationCount() {
        return minCorrelationCount;
    }

    public void setMinCorrelationCount(int minCorrelationCount) {
        this.minCorrelationCount = minCorrelationCount;
    }
}
