package com.scout.core.config;

import java.util.List;

/**
 * Thresholds for the record high/low detector.
 */
public class RecordSettings {

    /** Latest sessions must reach this value for a segment to qualify. */
    private double minSessions = 100;

    /** Maximum number of prior days compared against. */
    private int historyDays = 90;

    void validate(List<String> errors) {
        if (minSessions < 0) {
            errors.add("record.minSessions must be >= 0");
        }
        if (historyDays < 1) {
            errors.add("record.historyDays must be >= 1");
        }
    }

    public double getMinSessions() {
        return minSessions;
    }

    public void setMinSessions(double minSessions) {
        this.minSessions = minSessions;
    }

    public int getHistoryDays() {
        return historyDays;
    }

    public void setHistoryDays(int historyDays) {
        this.historyDays = historyDays;
    }
}
