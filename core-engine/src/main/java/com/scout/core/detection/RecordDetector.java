package com.scout.core.detection;

import com.scout.core.config.RecordSettings;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.DeviationKind;
import com.scout.core.model.Dimension;
import com.scout.core.model.Metric;
import com.scout.core.model.Priority;
import com.scout.core.model.PropertyDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Detects new record highs (P3, good news) and record lows (P1) of sessions
 * against up to {@code historyDays} prior days.
 *
 * <p>
 * Only segments whose latest sessions reach {@code minSessions} qualify.
 * Comparisons are strict, so at most one of high/low fires per segment.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RecordDetector.class);

    static final int MIN_POINTS = 2;
    static final int HIGH_IMPACT = 75;
    static final int LOW_IMPACT = 100;

    /** Most urgent first, then highest impact. */
    static final Comparator<Anomaly> REPORT_ORDER = Comparator.comparing(Anomaly::getPriority)
            .thenComparing(Comparator.comparingInt(Anomaly::getBusinessImpact).reversed());

    private final RecordSettings settings;
    private final DimensionalSeriesComparator comparator;

    public RecordDetector(RecordSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "RecordSettings must not be null");
        this.comparator = new DimensionalSeriesComparator(DetectorType.RECORD,
                EnumSet.of(Dimension.OVERALL, Dimension.DEVICE, Dimension.TRAFFIC_SOURCE, Dimension.LANDING_PAGE),
                MIN_POINTS, settings.getHistoryDays(), clock);
    }

    @Override
    public List<Anomaly> detect(PropertyDataset dataset) {
        List<Anomaly> records = new ArrayList<>(comparator.compare(dataset, Metric.SESSIONS, this::evaluate));
        records.sort(REPORT_ORDER);
        return records;
    }

    private List<Anomaly> evaluate(SegmentWindow window) {
        double sessions = window.latestValue();
        if (sessions < settings.getMinSessions()) {
            LOG.trace("Record candidate {} below minSessions ({} < {})", window.getSeries().describe(),
                    sessions, settings.getMinSessions());
            return List.of();
        }

        double[] history = window.historyValues();
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        for (double v : history) {
            max = Math.max(max, v);
            min = Math.min(min, v);
        }
        String label = window.label();

        if (sessions > max) {
            double changePct = max > 0 ? (sessions - max) / max * 100.0 : 100.0;
            LOG.debug("Record high for {}: {} > {}", window.getSeries().describe(), sessions, max);
            return List.of(window.anomaly()
                    .priority(Priority.P3)
                    .baseline(max)
                    .deviation(DeviationKind.CHANGE_PERCENTAGE, changePct)
                    .classification("record_high")
                    .businessImpact(HIGH_IMPACT)
                    .message(String.format("New %d-day high for %s: %.0f sessions (previous: %.0f)",
                            history.length, label, sessions, max))
                    .actionRequired(highAction(window))
                    .build());
        }
        if (sessions < min) {
            double dropPct = (min - sessions) / min * 100.0;
            LOG.debug("Record low for {}: {} < {}", window.getSeries().describe(), sessions, min);
            return List.of(window.anomaly()
                    .priority(Priority.P1)
                    .baseline(min)
                    .deviation(DeviationKind.DROP_PERCENTAGE, dropPct)
                    .classification("record_low")
                    .businessImpact(LOW_IMPACT)
                    .message(String.format("New %d-day low for %s: %.0f sessions (previous low: %.0f)",
                            history.length, label, sessions, min))
                    .actionRequired(lowAction(window))
                    .build());
        }
        return List.of();
    }

    private static String highAction(SegmentWindow window) {
        return switch (window.getSeries().getDimension()) {
            case DEVICE -> "Document " + window.label() + " growth drivers";
            case TRAFFIC_SOURCE -> "Scale " + window.label() + " success";
            case LANDING_PAGE -> "Analyze " + window.label() + " success";
            default -> "Document what drove this success";
        };
    }

    private static String lowAction(SegmentWindow window) {
        return switch (window.getSeries().getDimension()) {
            case DEVICE -> "Investigate " + window.label() + " decline";
            case TRAFFIC_SOURCE -> "Fix " + window.label() + " traffic loss";
            case LANDING_PAGE -> "Investigate " + window.label() + " traffic loss";
            default -> "Investigate cause of all-time low";
        };
    }

    @Override
    public DetectorType getType() {
        return DetectorType.RECORD;
    }

    @Override
    public Set<Dimension> getDimensions() {
        return comparator.getDimensions();
    }
}
