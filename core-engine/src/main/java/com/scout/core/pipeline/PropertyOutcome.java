package com.scout.core.pipeline;

import com.scout.core.model.Anomaly;

import java.util.List;
import java.util.Objects;

/**
 * Per-property result of the detection stage.
 */
public final class PropertyOutcome {

    private final String propertyId;
    private final boolean succeeded;
    private final List<Anomaly> anomalies;
    private final String error;

    private PropertyOutcome(String propertyId, boolean succeeded, List<Anomaly> anomalies, String error) {
        this.propertyId = Objects.requireNonNull(propertyId, "propertyId must not be null");
        this.succeeded = succeeded;
        this.anomalies = List.copyOf(anomalies);
        this.error = error;
    }

    public static PropertyOutcome success(String propertyId, List<Anomaly> anomalies) {
        return new PropertyOutcome(propertyId, true, anomalies, null);
    }

    /** A failed property contributes no anomalies. */
    public static PropertyOutcome failure(String propertyId, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new PropertyOutcome(propertyId, false, List.of(), message);
    }

    public String getPropertyId() {
        return propertyId;
    }

    public boolean isSucceeded() {
        return succeeded;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    /** Failure message, or {@code null} on success. */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return succeeded
                ? propertyId + ": ok (" + anomalies.size() + " anomalies)"
                : propertyId + ": FAILED (" + error + ")";
    }
}
