package com.scout.core.detection;

import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricObservation;
import com.scout.core.model.MetricSeries;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * View of one segment handed to a {@link SegmentRule}: the latest observation
 * ("yesterday"), a bounded history immediately preceding it, and access to the
 * segment's other metrics on the same date.
 *
 * @since 1.0.0
 */
public final class SegmentWindow {

    private final DetectorType detectorType;
    private final String domain;
    private final MetricSeries series;
    private final List<MetricObservation> history;
    private final Function<Metric, Optional<MetricSeries>> companions;
    private final Instant detectedAt;

    SegmentWindow(DetectorType detectorType, String domain, MetricSeries series, int historyPoints,
            Function<Metric, Optional<MetricSeries>> companions, Instant detectedAt) {
        this.detectorType = detectorType;
        this.domain = domain;
        this.series = series;
        this.history = series.history(historyPoints);
        this.companions = companions;
        this.detectedAt = detectedAt;
    }

    public MetricSeries getSeries() {
        return series;
    }

    public MetricObservation latest() {
        return series.latest();
    }

    public double latestValue() {
        return latest().getValue();
    }

    public LocalDate date() {
        return latest().getDate();
    }

    /** Observations before the latest one, oldest first. */
    public List<MetricObservation> history() {
        return history;
    }

    public double[] historyValues() {
        return MetricSeries.toValues(history);
    }

    /**
     * Value of another metric of the same segment on the latest date.
     *
     * @param metric the companion metric
     * @return its value, or empty when the segment has no such observation
     */
    public OptionalDouble latestValue(Metric metric) {
        if (metric == series.getMetric()) {
            return OptionalDouble.of(latestValue());
        }
        LocalDate date = date();
        return companions.apply(metric)
                .flatMap(s -> s.getObservations().stream()
                        .filter(o -> o.getDate().equals(date))
                        .findFirst())
                .map(o -> OptionalDouble.of(o.getValue()))
                .orElse(OptionalDouble.empty());
    }

    /**
     * Human-readable segment label used in messages.
     *
     * @return {@code "Site"} for the overall dimension, otherwise the dimension value
     */
    public String label() {
        return series.getDimension() == Dimension.OVERALL ? "Site" : series.getDimensionValue();
    }

    /**
     * Builder pre-populated with this segment's identity and latest observation.
     *
     * @return anomaly builder
     */
    public Anomaly.Builder anomaly() {
        return anomalyAt(latest());
    }

    /**
     * Builder pre-populated for an arbitrary observation of this segment.
     *
     * @param observation the anomalous observation
     * @return anomaly builder
     */
    public Anomaly.Builder anomalyAt(MetricObservation observation) {
        return Anomaly.builder()
                .propertyId(series.getPropertyId())
                .domain(domain)
                .date(observation.getDate())
                .detectorType(detectorType)
                .dimension(series.getDimension())
                .dimensionValue(series.getDimensionValue())
                .metric(series.getMetric())
                .value(observation.getValue())
                .detectedAt(detectedAt);
    }
}
