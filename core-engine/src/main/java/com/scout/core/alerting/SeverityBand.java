package com.scout.core.alerting;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Display band derived from an anomaly's business impact.
 */
public enum SeverityBand {

    CRITICAL,
    WARNING,
    NORMAL;

    static final int CRITICAL_FROM = 70;
    static final int WARNING_FROM = 40;

    public static SeverityBand of(int businessImpact) {
        if (businessImpact >= CRITICAL_FROM) {
            return CRITICAL;
        }
        if (businessImpact >= WARNING_FROM) {
            return WARNING;
        }
        return NORMAL;
    }

    @JsonValue
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
