package com.scout.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Anomaly emitted when a detector rule fires for one series on one date.
 *
 * <p>
 * Instances are immutable. Root-cause enrichment never mutates an anomaly;
 * {@link #withRootCause(RootCause)} returns a copy carrying the attachment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code propertyId}, {@code date},
 * {@code detectorType}, {@code priority}, {@code metric} and
 * {@code detectedAt} are required; omitting any of them throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Anomaly {

    private final String propertyId;
    private final String domain;
    private final LocalDate date;
    private final DetectorType detectorType;
    private final Priority priority;
    private final Dimension dimension;
    private final String dimensionValue;
    private final Metric metric;
    private final double value;

    /** Baseline mean, or the previous record for record anomalies. */
    private final Double baseline;

    private final DeviationKind deviationKind;
    private final double deviation;
    private final String classification;

    /** Business impact score in [0, 100]. */
    private final int businessImpact;

    private final String message;
    private final String actionRequired;
    private final Instant detectedAt;
    private final RootCause rootCause;

    private Anomaly(Builder builder) {
        this.propertyId = Objects.requireNonNull(builder.propertyId, "propertyId must not be null");
        this.domain = builder.domain;
        this.date = Objects.requireNonNull(builder.date, "date must not be null");
        this.detectorType = Objects.requireNonNull(builder.detectorType, "detectorType must not be null");
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        this.dimension = builder.dimension != null ? builder.dimension : Dimension.OVERALL;
        this.dimensionValue = builder.dimensionValue != null ? builder.dimensionValue : Dimension.SITE_WIDE;
        this.metric = Objects.requireNonNull(builder.metric, "metric must not be null");
        this.value = builder.value;
        this.baseline = builder.baseline;
        this.deviationKind = builder.deviationKind;
        this.deviation = builder.deviation;
        this.classification = builder.classification;
        if (builder.businessImpact < 0 || builder.businessImpact > 100) {
            throw new IllegalArgumentException("businessImpact must be within [0, 100], got: "
                    + builder.businessImpact);
        }
        this.businessImpact = builder.businessImpact;
        this.message = builder.message;
        this.actionRequired = builder.actionRequired;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.rootCause = builder.rootCause;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with every field of this anomaly
     */
    public Builder toBuilder() {
        return new Builder()
                .propertyId(propertyId)
                .domain(domain)
                .date(date)
                .detectorType(detectorType)
                .priority(priority)
                .dimension(dimension)
                .dimensionValue(dimensionValue)
                .metric(metric)
                .value(value)
                .baseline(baseline)
                .deviation(deviationKind, deviation)
                .classification(classification)
                .businessImpact(businessImpact)
                .message(message)
                .actionRequired(actionRequired)
                .detectedAt(detectedAt)
                .rootCause(rootCause);
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String propertyId;
        private String domain;
        private LocalDate date;
        private DetectorType detectorType;
        private Priority priority;
        private Dimension dimension;
        private String dimensionValue;
        private Metric metric;
        private double value;
        private Double baseline;
        private DeviationKind deviationKind;
        private double deviation;
        private String classification;
        private int businessImpact;
        private String message;
        private String actionRequired;
        private Instant detectedAt;
        private RootCause rootCause;

        public Builder propertyId(String propertyId) {
            this.propertyId = propertyId;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder detectorType(DetectorType detectorType) {
            this.detectorType = detectorType;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder dimension(Dimension dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder dimensionValue(String dimensionValue) {
            this.dimensionValue = dimensionValue;
            return this;
        }

        public Builder metric(Metric metric) {
            this.metric = metric;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder baseline(Double baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder deviation(DeviationKind kind, double deviation) {
            this.deviationKind = kind;
            this.deviation = deviation;
            return this;
        }

        public Builder classification(String classification) {
            this.classification = classification;
            return this;
        }

        public Builder businessImpact(int businessImpact) {
            this.businessImpact = businessImpact;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder actionRequired(String actionRequired) {
            this.actionRequired = actionRequired;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder rootCause(RootCause rootCause) {
            this.rootCause = rootCause;
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link Anomaly}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if {@code businessImpact} is outside [0, 100]
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    /**
     * Copy of this anomaly with the given root-cause attachment.
     *
     * @param rootCause the attachment; must not be {@code null}
     * @return enriched copy
     */
    public Anomaly withRootCause(RootCause rootCause) {
        Objects.requireNonNull(rootCause, "rootCause must not be null");
        return toBuilder().rootCause(rootCause).build();
    }

    /**
     * Key identifying the observation this anomaly is about, independent of
     * which rule fired.
     *
     * @return {@code property|date|metric|dimension|value}
     */
    @JsonIgnore
    public String getSeriesKey() {
        return propertyId + '|' + date + '|' + metric.getId() + '|' + dimension.getId() + '|' + dimensionValue;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getPropertyId() {
        return propertyId;
    }

    public String getDomain() {
        return domain;
    }

    public LocalDate getDate() {
        return date;
    }

    public DetectorType getDetectorType() {
        return detectorType;
    }

    public Priority getPriority() {
        return priority;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public String getDimensionValue() {
        return dimensionValue;
    }

    public Metric getMetric() {
        return metric;
    }

    public double getValue() {
        return value;
    }

    public Double getBaseline() {
        return baseline;
    }

    public DeviationKind getDeviationKind() {
        return deviationKind;
    }

    public double getDeviation() {
        return deviation;
    }

    public String getClassification() {
        return classification;
    }

    public int getBusinessImpact() {
        return businessImpact;
    }

    public String getMessage() {
        return message;
    }

    public String getActionRequired() {
        return actionRequired;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public RootCause getRootCause() {
        return rootCause;
    }

    /** Equality ignores {@code detectedAt} so repeated runs over the same data compare equal. */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Double.compare(value, that.value) == 0
                && Double.compare(deviation, that.deviation) == 0
                && businessImpact == that.businessImpact
                && propertyId.equals(that.propertyId)
                && Objects.equals(domain, that.domain)
                && date.equals(that.date)
                && detectorType == that.detectorType
                && priority == that.priority
                && dimension == that.dimension
                && Objects.equals(dimensionValue, that.dimensionValue)
                && metric == that.metric
                && Objects.equals(baseline, that.baseline)
                && deviationKind == that.deviationKind
                && Objects.equals(classification, that.classification)
                && Objects.equals(message, that.message)
                && Objects.equals(actionRequired, that.actionRequired)
                && Objects.equals(rootCause, that.rootCause);
    }

    @Override
    public int hashCode() {
        return Objects.hash(propertyId, date, detectorType, priority, dimension, dimensionValue,
                metric, value, classification, businessImpact);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "propertyId='" + propertyId + '\'' +
                ", date=" + date +
                ", detector=" + detectorType.getId() +
                ", priority=" + priority.getId() +
                ", " + dimension.getId() + '=' + dimensionValue +
                ", metric=" + metric.getId() +
                ", classification='" + classification + '\'' +
                ", impact=" + businessImpact +
                '}';
    }
}
