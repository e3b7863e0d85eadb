package com.scout.core.detection;

import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricSeries;
import com.scout.core.model.PropertyDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Shared windowing driver behind every detector.
 *
 * <p>
 * For each configured dimension present in a dataset, splits the rows into
 * one series per dimension value, skips series shorter than
 * {@code minPoints}, bounds the history to {@code historyPoints} (0 for no
 * bound) and applies
 * a {@link SegmentRule} to the resulting {@link SegmentWindow}. Dimensions
 * missing from the dataset are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public final class DimensionalSeriesComparator {

    private static final Logger LOG = LoggerFactory.getLogger(DimensionalSeriesComparator.class);

    private final DetectorType detectorType;
    private final Set<Dimension> dimensions;
    private final int minPoints;
    private final int historyPoints;
    private final Clock clock;

    /**
     * @param detectorType  type stamped on emitted anomalies
     * @param dimensions    dimensions to inspect, in report order
     * @param minPoints     minimum series length (latest included)
     * @param historyPoints maximum number of prior observations in a window;
     *                      {@code 0} keeps the whole history
     * @param clock         source of {@code detectedAt}
     */
    public DimensionalSeriesComparator(DetectorType detectorType, Set<Dimension> dimensions,
            int minPoints, int historyPoints, Clock clock) {
        this.detectorType = Objects.requireNonNull(detectorType, "detectorType must not be null");
        this.dimensions = Collections.unmodifiableSet(EnumSet.copyOf(dimensions));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (minPoints < 1) {
            throw new IllegalArgumentException("minPoints must be >= 1, got: " + minPoints);
        }
        if (historyPoints < 0) {
            throw new IllegalArgumentException("historyPoints must be >= 0, got: " + historyPoints);
        }
        this.minPoints = minPoints;
        this.historyPoints = historyPoints;
    }

    /**
     * Apply {@code rule} to every qualifying segment of {@code metric}.
     *
     * @param dataset the property's extract
     * @param metric  metric whose series are windowed
     * @param rule    comparison to apply
     * @return anomalies in dimension order, then first-appearance order of values
     */
    public List<Anomaly> compare(PropertyDataset dataset, Metric metric, SegmentRule rule) {
        Objects.requireNonNull(dataset, "dataset must not be null");
        Objects.requireNonNull(rule, "rule must not be null");

        Instant detectedAt = clock.instant();
        List<Anomaly> anomalies = new ArrayList<>();
        for (Dimension dimension : dimensions) {
            if (!dataset.hasDimension(dimension)) {
                LOG.trace("[{}] {} has no {} rows - skipping", detectorType.getId(),
                        dataset.getPropertyId(), dimension.getId());
                continue;
            }
            Map<Metric, Map<String, MetricSeries>> companionCache = new EnumMap<>(Metric.class);
            for (MetricSeries series : dataset.series(dimension, metric)) {
                if (series.size() < minPoints) {
                    LOG.trace("[{}] {} has {} point(s), needs {} - skipping", detectorType.getId(),
                            series.describe(), series.size(), minPoints);
                    continue;
                }
                String value = series.getDimensionValue();
                SegmentWindow window = new SegmentWindow(detectorType, dataset.domain(), series, historyPoints,
                        other -> Optional.ofNullable(companionCache
                                .computeIfAbsent(other, m -> byValue(dataset.series(dimension, m)))
                                .get(value)),
                        detectedAt);
                anomalies.addAll(rule.evaluate(window));
            }
        }
        return anomalies;
    }

    public Set<Dimension> getDimensions() {
        return dimensions;
    }

    public DetectorType getDetectorType() {
        return detectorType;
    }

    private static Map<String, MetricSeries> byValue(List<MetricSeries> series) {
        Map<String, MetricSeries> map = new LinkedHashMap<>();
        for (MetricSeries s : series) {
            map.put(s.getDimensionValue(), s);
        }
        return map;
    }
}
