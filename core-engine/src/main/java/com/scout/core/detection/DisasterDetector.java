package com.scout.core.detection;

import com.scout.core.config.DisasterSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.DeviationKind;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.Priority;
import com.scout.core.model.PropertyDataset;
import com.scout.core.stats.StatisticalPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * P0 detector for site-down and tracking-broken conditions on the site-wide
 * series.
 *
 * <h3>Rules (evaluated independently)</h3>
 * <ol>
 * <li>latest sessions below {@code nearZeroSessions}: {@code near_zero_traffic}</li>
 * <li>latest conversions of zero while the baseline mean sessions exceed
 * {@code trackingFailureMinSessions}: {@code tracking_failure}</li>
 * <li>drop of at least {@code catastrophicDropPct} against a positive baseline
 * mean: {@code catastrophic_drop}</li>
 * </ol>
 * <p>
 * The baseline is every day before the latest unless {@code baselineDays}
 * bounds it. Every disaster carries a business impact of 100. Fewer than
 * two days of data produce no alerts.
 * </p>
 *
 * @since 1.0.0
 */
public class DisasterDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DisasterDetector.class);

    static final int MIN_POINTS = 2;
    static final int IMPACT = 100;

    private final DisasterSettings settings;
    private final DimensionalSeriesComparator comparator;

    public DisasterDetector(DisasterSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "DisasterSettings must not be null");
        this.comparator = new DimensionalSeriesComparator(DetectorType.DISASTER,
                EnumSet.of(Dimension.OVERALL), MIN_POINTS, settings.getBaselineDays(), clock);
    }

    @Override
    public List<Anomaly> detect(PropertyDataset dataset) {
        return comparator.compare(dataset, Metric.SESSIONS, this::evaluate);
    }

    private List<Anomaly> evaluate(SegmentWindow window) {
        List<Anomaly> alerts = new ArrayList<>(3);
        double sessions = window.latestValue();
        double baselineMean = StatisticalPrimitives.mean(window.historyValues());
        double dropPct = baselineMean > 0 ? (baselineMean - sessions) / baselineMean * 100.0 : 0.0;

        if (sessions < settings.getNearZeroSessions()) {
            LOG.debug("Disaster [near_zero_traffic] fired for {}: sessions={}", window.getSeries().describe(), sessions);
            alerts.add(window.anomaly()
                    .priority(Priority.P0)
                    .baseline(baselineMean)
                    .deviation(DeviationKind.DROP_PERCENTAGE, dropPct)
                    .classification("near_zero_traffic")
                    .businessImpact(IMPACT)
                    .message(String.format("Site down: Only %.0f sessions detected", sessions))
                    .actionRequired("ACT NOW - Check tracking code and site availability")
                    .build());
        }

        OptionalDouble conversions = window.latestValue(Metric.CONVERSIONS);
        if (conversions.isPresent() && conversions.getAsDouble() == 0.0
                && baselineMean > settings.getTrackingFailureMinSessions()) {
            LOG.debug("Disaster [tracking_failure] fired for {}: baselineSessions={}",
                    window.getSeries().describe(), baselineMean);
            alerts.add(window.anomaly()
                    .priority(Priority.P0)
                    .metric(Metric.CONVERSIONS)
                    .value(0.0)
                    .baseline(baselineMean)
                    .deviation(DeviationKind.DROP_PERCENTAGE, 100.0)
                    .classification("tracking_failure")
                    .businessImpact(IMPACT)
                    .message("Conversion tracking failure: 0 conversions detected")
                    .actionRequired("ACT NOW - Verify GA4 event configuration")
                    .build());
        }

        if (baselineMean > 0 && dropPct >= settings.getCatastrophicDropPct()) {
            LOG.debug("Disaster [catastrophic_drop] fired for {}: drop={}%", window.getSeries().describe(), dropPct);
            alerts.add(window.anomaly()
                    .priority(Priority.P0)
                    .baseline(baselineMean)
                    .deviation(DeviationKind.DROP_PERCENTAGE, dropPct)
                    .classification("catastrophic_drop")
                    .businessImpact(IMPACT)
                    .message(String.format("Catastrophic traffic drop: -%.1f%%", dropPct))
                    .actionRequired("ACT NOW - Investigate site outage or tracking issue")
                    .build());
        }
        return alerts;
    }

    @Override
    public DetectorType getType() {
        return DetectorType.DISASTER;
    }

    @Override
    public Set<Dimension> getDimensions() {
        return comparator.getDimensions();
    }
}
