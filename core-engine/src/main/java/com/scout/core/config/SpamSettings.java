package com.scout.core.config;

import java.util.List;

/**
 * Thresholds for the P1 spam detector. Both the z-score test and the quality
 * gate must hold for an alert.
 */
public class SpamSettings {

    /** Minimum |z| of the latest value against its baseline. */
    private double sigmaThreshold = 3.0;
    private double bounceRateThreshold = 85;
    private double minSessionDurationSeconds = 10;
    private int baselineDays = 7;

    /** Business impact points per unit of |z|. */
    private double impactPerZ = 25;

    void validate(List<String> errors) {
        if (sigmaThreshold <= 0) {
            errors.add("spam.sigmaThreshold must be > 0");
        }
        if (bounceRateThreshold < 0 || bounceRateThreshold > 100) {
            errors.add("spam.bounceRateThreshold must be in [0, 100]");
        }
        if (minSessionDurationSeconds < 0) {
            errors.add("spam.minSessionDurationSeconds must be >= 0");
        }
        if (baselineDays < 2) {
            errors.add("spam.baselineDays must be >= 2");
        }
        if (impactPerZ <= 0) {
            errors.add("spam.impactPerZ must be > 0");
        }
    }

    public double getSigmaThreshold() {
        return sigmaThreshold;
    }

    public void setSigmaThreshold(double sigmaThreshold) {
        this.sigmaThreshold = sigmaThreshold;
    }

    public double getBounceRateThreshold() {
        return bounceRateThreshold;
    }

    public void setBounceRateThreshold(double bounceRateThreshold) {
        this.bounceRateThreshold = bounceRateThreshold;
    }

    public double getMinSessionDurationSeconds() {
        return minSessionDurationSeconds;
    }

    public void setMinSessionDurationSeconds(double minSessionDurationSeconds) {
        this.minSessionDurationSeconds = minSessionDurationSeconds;
    }

    public int getBaselineDays() {
        return baselineDays;
    }

    public void setBaselineDays(int baselineDays) {
        this.baselineDays = baselineDays;
    }

    public double getImpactPerZ() {
        return impactPerZ;
    }

    public void setImpactPerZ(double impactPerZ) {
        this.impactPerZ = impactPerZ;
    }
}
