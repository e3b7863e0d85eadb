package com.scout.core.config;

import java.util.List;

/**
 * Settings for correlating anomalies with the external event calendar.
 */
public class RootCauseSettings {

    /** Events within this many days either side of the anomaly are candidates. */
    private int windowDays = 2;

    /** Candidates must score strictly above this value. */
    private double minScore = 0.3;

    private int maxCandidates = 3;

    /** Multiplier for platform-wide events when the anomaly is part of a portfolio pattern. */
    private double portfolioBoost = 1.4;

    void validate(List<String> errors) {
        if (windowDays < 0) {
            errors.add("rootCause.windowDays must be >= 0");
        }
        if (minScore < 0 || minScore >= 1) {
            errors.add("rootCause.minScore must be in [0, 1)");
        }
        if (maxCandidates < 1) {
            errors.add("rootCause.maxCandidates must be >= 1");
        }
        if (portfolioBoost < 1) {
            errors.add("rootCause.portfolioBoost must be >= 1");
        }
    }

    public int getWindowDays() {
        return windowDays;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public double getPortfolioBoost() {
        return portfolioBoost;
    }

    public void setPortfolioBoost(double portfolioBoost) {
        this.portfolioBoost = portfolioBoost;
    }
}
