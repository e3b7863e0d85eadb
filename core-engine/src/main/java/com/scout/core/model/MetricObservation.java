package com.scout.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single immutable daily value of one metric for one dimension value.
 *
 * @since 1.0.0
 */
public final class MetricObservation {

    private final LocalDate date;
    private final String propertyId;
    private final Dimension dimension;
    private final String dimensionValue;
    private final Metric metric;
    private final double value;
    private final Double bounceRate;
    private final Double avgSessionDuration;

    private MetricObservation(LocalDate date, String propertyId, Dimension dimension,
            String dimensionValue, Metric metric, double value,
            Double bounceRate, Double avgSessionDuration) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.propertyId = propertyId;
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        this.dimensionValue = dimensionValue;
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(
                    "Metric value must be a non-negative number, got: " + value + " for " + metric.getId()
                            + " on " + date);
        }
        this.value = value;
        this.bounceRate = bounceRate;
        this.avgSessionDuration = avgSessionDuration;
    }

    /**
     * Project one metric out of a delivered row.
     *
     * @param propertyId owning property
     * @param dimension  dimension the row was delivered under
     * @param row        the raw daily row
     * @param metric     metric to extract
     * @return new observation
     * @throws IllegalArgumentException if the value is negative
     */
    public static MetricObservation from(String propertyId, Dimension dimension,
            DailyMetrics row, Metric metric) {
        return new MetricObservation(row.getDate(), propertyId, dimension,
                row.dimensionValue(dimension), metric, row.valueOf(metric),
                row.getBounceRate(), row.getAvgSessionDuration());
    }

    public static MetricObservation of(LocalDate date, String propertyId, Dimension dimension,
            String dimensionValue, Metric metric, double value) {
        return new MetricObservation(date, propertyId, dimension, dimensionValue, metric, value, null, null);
    }

    public LocalDate getDate() {
        return date;
    }

    public String getPropertyId() {
        return propertyId;
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

    public Double getBounceRate() {
        return bounceRate;
    }

    public Double getAvgSessionDuration() {
        return avgSessionDuration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricObservation that))
            return false;
        return Double.compare(value, that.value) == 0
                && date.equals(that.date)
                && Objects.equals(propertyId, that.propertyId)
                && dimension == that.dimension
                && Objects.equals(dimensionValue, that.dimensionValue)
                && metric == that.metric;
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, propertyId, dimension, dimensionValue, metric, value);
    }

    @Override
    public String toString() {
        return "MetricObservation{" + date + ' ' + dimension.getId() + '=' + dimensionValue
                + ' ' + metric.getId() + '=' + value + '}';
    }
}
