package com.scout.core.config;

import java.util.List;

/**
 * Settings for the general consensus (z-score + IQR) segment detector.
 */
public class SegmentSettings {

    private boolean enabled = true;
    private double sigmaThreshold = 2.0;
    private double iqrMultiplier = 1.5;

    /** Trailing days used to compute the statistics. */
    private int windowDays = 30;

    /** Only anomalies within this many trailing days are reported. */
    private int reportDays = 7;

    void validate(List<String> errors) {
        if (sigmaThreshold <= 0) {
            errors.add("segment.sigmaThreshold must be > 0");
        }
        if (iqrMultiplier <= 0) {
            errors.add("segment.iqrMultiplier must be > 0");
        }
        if (windowDays < 4) {
            errors.add("segment.windowDays must be >= 4");
        }
        if (reportDays < 1 || reportDays > windowDays) {
            errors.add("segment.reportDays must be in [1, windowDays]");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getSigmaThreshold() {
        return sigmaThreshold;
    }

    public void setSigmaThreshold(double sigmaThreshold) {
        this.sigmaThreshold = sigmaThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public int getReportDays() {
        return reportDays;
    }

    public void setReportDays(int reportDays) {
        this.reportDays = reportDays;
    }
}
