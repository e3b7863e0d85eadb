package com.scout.core.detection;

import com.scout.core.config.SegmentSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.DeviationKind;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricObservation;
import com.scout.core.model.MetricSeries;
import com.scout.core.model.Priority;
import com.scout.core.model.PropertyDataset;
import com.scout.core.stats.ConsensusScore;
import com.scout.core.stats.StatisticalPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * General per-metric detector using consensus z-score/IQR outliers.
 *
 * <p>
 * All four metrics are analysed on the site-wide series; segment dimensions
 * are analysed on sessions only. Statistics cover the trailing
 * {@code windowDays}; only outliers dated within the trailing
 * {@code reportDays} are reported.
 * </p>
 *
 * <h3>Business impact</h3>
 * <p>
 * {@code min(severity * 20, 80)} scaled by the metric's business weight, by
 * 1.3 for drops, and by 1.4 (over 50%) or 1.2 (over 25%) for large relative
 * deviations from the window mean; capped at 100. Impact of 70 or more is
 * P2, anything else P3.
 * </p>
 *
 * @since 1.0.0
 */
public class SegmentAnomalyDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SegmentAnomalyDetector.class);

    static final int HIGH_IMPACT = 70;

    private final SegmentSettings settings;
    private final DimensionalSeriesComparator siteWide;
    private final DimensionalSeriesComparator segments;

    public SegmentAnomalyDetector(SegmentSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "SegmentSettings must not be null");
        int minPoints = StatisticalPrimitives.MIN_IQR_POINTS;
        int historyPoints = settings.getWindowDays() - 1;
        this.siteWide = new DimensionalSeriesComparator(DetectorType.SEGMENT,
                EnumSet.of(Dimension.OVERALL), minPoints, historyPoints, clock);
        this.segments = new DimensionalSeriesComparator(DetectorType.SEGMENT,
                EnumSet.complementOf(EnumSet.of(Dimension.OVERALL)), minPoints, historyPoints, clock);
    }

    @Override
    public List<Anomaly> detect(PropertyDataset dataset) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (Metric metric : Metric.values()) {
            anomalies.addAll(siteWide.compare(dataset, metric, this::evaluate));
        }
        anomalies.addAll(segments.compare(dataset, Metric.SESSIONS, this::evaluate));
        return anomalies;
    }

    private List<Anomaly> evaluate(SegmentWindow window) {
        List<MetricObservation> points = new ArrayList<>(window.history());
        points.add(window.latest());
        double[] values = MetricSeries.toValues(points);
        double mean = StatisticalPrimitives.mean(values);
        Metric metric = window.getSeries().getMetric();

        List<ConsensusScore> scores = StatisticalPrimitives.consensus(values,
                settings.getSigmaThreshold(), settings.getIqrMultiplier());
        int firstReported = Math.max(0, points.size() - settings.getReportDays());

        List<Anomaly> anomalies = new ArrayList<>();
        for (ConsensusScore score : scores) {
            if (score.getIndex() < firstReported || !score.isAnomaly()) {
                continue;
            }
            MetricObservation observation = points.get(score.getIndex());
            boolean drop = observation.getValue() < mean;
            int impact = businessImpact(metric, score.getSeverity(), observation.getValue(), mean);
            LOG.debug("Segment outlier for {} on {}: value={} mean={} severity={}",
                    window.getSeries().describe(), observation.getDate(), observation.getValue(), mean,
                    score.getSeverity());

            anomalies.add(window.anomalyAt(observation)
                    .priority(impact >= HIGH_IMPACT ? Priority.P2 : Priority.P3)
                    .baseline(mean)
                    .deviation(DeviationKind.Z_SCORE, score.getZScore())
                    .classification(drop ? "drop" : "spike")
                    .businessImpact(impact)
                    .message(String.format("%s %s %s: %.0f vs %d-day mean %.0f", window.label(), metric.getId(),
                            drop ? "drop" : "spike", observation.getValue(), points.size(), mean))
                    .actionRequired(drop
                            ? "Investigate the decline in " + metric.getId()
                            : "Verify the source of the " + metric.getId() + " spike")
                    .build());
        }
        return anomalies;
    }

    static int businessImpact(Metric metric, double severity, double value, double mean) {
        double impact = Math.min(severity * 20.0, 80.0) * metric.getBusinessWeight();
        if (value < mean) {
            impact *= 1.3;
        }
        if (mean > 0) {
            double relativeChange = Math.abs(value - mean) / mean;
            if (relativeChange > 0.5) {
                impact *= 1.4;
            } else if (relativeChange > 0.25) {
                impact *= 1.2;
            }
        }
        return (int) Math.min(100, Math.round(impact));
    }

    @Override
    public DetectorType getType() {
        return DetectorType.SEGMENT;
    }

    @Override
    public Set<Dimension> getDimensions() {
        return EnumSet.allOf(Dimension.class);
    }
}
