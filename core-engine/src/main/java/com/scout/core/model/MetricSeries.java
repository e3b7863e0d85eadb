package com.scout.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Date-ordered observations for one (property, dimension, dimension value,
 * metric) tuple: the unit of statistical analysis.
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String propertyId;
    private final Dimension dimension;
    private final String dimensionValue;
    private final Metric metric;
    private final List<MetricObservation> observations;

    /**
     * @param observations observations of the tuple in any order; sorted by date here
     */
    public MetricSeries(String propertyId, Dimension dimension, String dimensionValue,
            Metric metric, List<MetricObservation> observations) {
        this.propertyId = propertyId;
        this.dimension = Objects.requireNonNull(dimension, "dimension must not be null");
        this.dimensionValue = dimensionValue;
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        List<MetricObservation> sorted = new ArrayList<>(
                Objects.requireNonNull(observations, "observations must not be null"));
        sorted.sort(Comparator.comparing(MetricObservation::getDate));
        this.observations = Collections.unmodifiableList(sorted);
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    /**
     * @return the most recent observation ("yesterday" for a daily run)
     * @throws IllegalStateException if the series is empty
     */
    public MetricObservation latest() {
        if (observations.isEmpty()) {
            throw new IllegalStateException("Series " + describe() + " is empty");
        }
        return observations.get(observations.size() - 1);
    }

    /**
     * Up to {@code maxPoints} observations immediately preceding the latest one.
     *
     * @param maxPoints maximum history length; {@code <= 0} means unbounded
     * @return history, oldest first
     */
    public List<MetricObservation> history(int maxPoints) {
        if (observations.size() < 2) {
            return List.of();
        }
        int end = observations.size() - 1;
        int start = maxPoints <= 0 ? 0 : Math.max(0, end - maxPoints);
        return observations.subList(start, end);
    }

    /**
     * @param maxPoints maximum number of trailing observations
     * @return the last {@code maxPoints} observations including the latest
     */
    public List<MetricObservation> tail(int maxPoints) {
        int start = Math.max(0, observations.size() - maxPoints);
        return observations.subList(start, observations.size());
    }

    public double[] values() {
        return toValues(observations);
    }

    public static double[] toValues(List<MetricObservation> observations) {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).getValue();
        }
        return values;
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

    public List<MetricObservation> getObservations() {
        return observations;
    }

    public String describe() {
        return propertyId + '/' + dimension.getId() + '=' + dimensionValue + '/' + metric.getId();
    }

    @Override
    public String toString() {
        return "MetricSeries{" + describe() + ", size=" + observations.size() + '}';
    }
}
