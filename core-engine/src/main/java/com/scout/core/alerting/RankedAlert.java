package com.scout.core.alerting;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.scout.core.model.Anomaly;

import java.util.Objects;

/**
 * An enriched anomaly with its position in the ranked feed.
 */
public final class RankedAlert {

    private final int rank;
    private final SeverityBand severity;

    @JsonUnwrapped
    private final Anomaly anomaly;

    RankedAlert(int rank, Anomaly anomaly) {
        this.rank = rank;
        this.anomaly = Objects.requireNonNull(anomaly, "anomaly must not be null");
        this.severity = SeverityBand.of(anomaly.getBusinessImpact());
    }

    public int getRank() {
        return rank;
    }

    public SeverityBand getSeverity() {
        return severity;
    }

    public Anomaly getAnomaly() {
        return anomaly;
    }

    @Override
    public String toString() {
        return "#" + rank + " [" + severity.getId() + "] " + anomaly;
    }
}
