package com.scout.core.detection;

import com.scout.core.config.SpamSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.DeviationKind;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricObservation;
import com.scout.core.model.Priority;
import com.scout.core.model.PropertyDataset;
import com.scout.core.stats.StatisticalPrimitives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * P1 detector for bot/referral spam: a session spike that is also low quality.
 *
 * <p>
 * The latest sessions value is scored against the mean and sample standard
 * deviation of up to {@code baselineDays} prior days. An alert requires both
 * {@code |z| > sigmaThreshold} and the quality gate (bounce rate above
 * {@code bounceRateThreshold} or average session duration below
 * {@code minSessionDurationSeconds}). Missing quality signals never open the
 * gate.
 * </p>
 *
 * @since 1.0.0
 */
public class SpamDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpamDetector.class);

    static final int MIN_POINTS = 2;

    private final SpamSettings settings;
    private final DimensionalSeriesComparator comparator;

    public SpamDetector(SpamSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "SpamSettings must not be null");
        this.comparator = new DimensionalSeriesComparator(DetectorType.SPAM,
                EnumSet.of(Dimension.OVERALL, Dimension.GEOGRAPHY, Dimension.TRAFFIC_SOURCE),
                MIN_POINTS, settings.getBaselineDays(), clock);
    }

    @Override
    public List<Anomaly> detect(PropertyDataset dataset) {
        return comparator.compare(dataset, Metric.SESSIONS, this::evaluate);
    }

    private List<Anomaly> evaluate(SegmentWindow window) {
        double[] baseline = window.historyValues();
        double sessions = window.latestValue();
        double z = StatisticalPrimitives.zScoreAgainstBaseline(baseline, sessions);
        if (Math.abs(z) <= settings.getSigmaThreshold()) {
            return List.of();
        }

        MetricObservation latest = window.latest();
        if (!failsQualityGate(latest)) {
            LOG.trace("Spam candidate {} z={} passed the quality gate", window.getSeries().describe(), z);
            return List.of();
        }

        int impact = (int) Math.min(100, Math.round(Math.abs(z) * settings.getImpactPerZ()));
        LOG.debug("Spam fired for {}: sessions={} z={} bounce={} duration={}", window.getSeries().describe(),
                sessions, z, latest.getBounceRate(), latest.getAvgSessionDuration());

        return List.of(window.anomaly()
                .priority(Priority.P1)
                .baseline(StatisticalPrimitives.mean(baseline))
                .deviation(DeviationKind.Z_SCORE, z)
                .classification("spam_traffic")
                .businessImpact(impact)
                .message(message(window, latest))
                .actionRequired(action(window))
                .build());
    }

    boolean failsQualityGate(MetricObservation observation) {
        Double bounce = observation.getBounceRate();
        Double duration = observation.getAvgSessionDuration();
        return (bounce != null && bounce > settings.getBounceRateThreshold())
                || (duration != null && duration < settings.getMinSessionDurationSeconds());
    }

    private static String message(SegmentWindow window, MetricObservation latest) {
        String quality = latest.getBounceRate() != null
                ? String.format("%.1f%% bounce rate", latest.getBounceRate())
                : String.format("%.1fs avg session", latest.getAvgSessionDuration());
        if (window.getSeries().getDimension() == Dimension.OVERALL) {
            return String.format("Spam traffic detected: %.0f sessions with %s", latest.getValue(), quality);
        }
        return String.format("Spam from %s: %.0f sessions, %s", window.label(), latest.getValue(), quality);
    }

    private static String action(SegmentWindow window) {
        return switch (window.getSeries().getDimension()) {
            case GEOGRAPHY -> "Review " + window.label() + " traffic sources";
            case TRAFFIC_SOURCE -> "Block or filter " + window.label() + " if spam confirmed";
            default -> "Review traffic sources for bot activity";
        };
    }

    @Override
    public DetectorType getType() {
        return DetectorType.SPAM;
    }

    @Override
    public Set<Dimension> getDimensions() {
        return comparator.getDimensions();
    }
}
