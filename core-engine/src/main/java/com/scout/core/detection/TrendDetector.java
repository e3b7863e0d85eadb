package com.scout.core.detection;

import com.scout.core.config.TrendSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.DeviationKind;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.MetricObservation;
import com.scout.core.model.MetricSeries;
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
 * Sustained-change detector comparing the recent average of sessions
 * ({@code recentDays} before the latest day) with the average of up to
 * {@code baselineDays} before that.
 *
 * <p>
 * Fires when {@code |change%| >= thresholdPct}; downward trends are P2,
 * upward trends P3.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(TrendDetector.class);

    private final TrendSettings settings;
    private final DimensionalSeriesComparator comparator;

    public TrendDetector(TrendSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "TrendSettings must not be null");
        this.comparator = new DimensionalSeriesComparator(DetectorType.TREND,
                EnumSet.allOf(Dimension.class),
                settings.getRecentDays() + 1,
                settings.getRecentDays() + settings.getBaselineDays(), clock);
    }

    @Override
    public List<Anomaly> detect(PropertyDataset dataset) {
        return comparator.compare(dataset, Metric.SESSIONS, this::evaluate);
    }

    private List<Anomaly> evaluate(SegmentWindow window) {
        List<MetricObservation> history = window.history();
        int recentDays = settings.getRecentDays();
        if (history.size() <= recentDays) {
            LOG.trace("Trend candidate {} has no baseline beyond the recent window", window.getSeries().describe());
            return List.of();
        }

        int split = history.size() - recentDays;
        double recentAvg = StatisticalPrimitives.mean(MetricSeries.toValues(history.subList(split, history.size())));
        double baselineAvg = StatisticalPrimitives.mean(MetricSeries.toValues(history.subList(0, split)));
        if (recentAvg < settings.getMinSessions() || baselineAvg <= 0) {
            return List.of();
        }

        double changePct = (recentAvg - baselineAvg) * 100.0 / baselineAvg;
        if (Math.abs(changePct) < settings.getThresholdPct()) {
            return List.of();
        }

        boolean up = changePct > 0;
        int impact = (int) Math.min(100, Math.round(Math.abs(changePct) * settings.getImpactPerPct()));
        LOG.debug("Trend {} for {}: recent={} baseline={} change={}%", up ? "up" : "down",
                window.getSeries().describe(), recentAvg, baselineAvg, changePct);

        return List.of(window.anomaly()
                .priority(up ? Priority.P3 : Priority.P2)
                .value(recentAvg)
                .baseline(baselineAvg)
                .deviation(DeviationKind.CHANGE_PERCENTAGE, changePct)
                .classification(up ? "trend_up" : "trend_down")
                .businessImpact(impact)
                .message(String.format("%s: %.1f%% trend %s (%d-day avg %.0f vs baseline %.0f)",
                        window.label(), Math.abs(changePct), up ? "up" : "down", recentDays, recentAvg, baselineAvg))
                .actionRequired(action(window, up))
                .build());
    }

    private static String action(SegmentWindow window, boolean up) {
        String label = window.label();
        return switch (window.getSeries().getDimension()) {
            case OVERALL -> up ? "Capitalize on growth" : "Address declining traffic";
            case GEOGRAPHY -> up ? "Expand " + label + " presence" : "Investigate " + label + " decline";
            case DEVICE -> up ? "Optimize " + label + " experience" : "Fix " + label + " issues";
            case TRAFFIC_SOURCE -> up ? "Scale " + label + " investment" : "Review " + label + " strategy";
            case LANDING_PAGE -> up ? "Promote " + label + " content" : "Review " + label + " performance";
        };
    }

    @Override
    public DetectorType getType() {
        return DetectorType.TREND;
    }

    @Override
    public Set<Dimension> getDimensions() {
        return comparator.getDimensions();
    }
}
