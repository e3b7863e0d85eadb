package com.scout.core.alerting;

import com.scout.core.model.Anomaly;
import com.scout.core.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges every detector's enriched anomalies into a single ranked feed.
 *
 * <p>
 * Ordering is by priority (P0 first), then business impact descending. The
 * remaining keys only make ties deterministic so that identical input always
 * yields the identical feed.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertPrioritizer {

    private static final Logger LOG = LoggerFactory.getLogger(AlertPrioritizer.class);

    static final Comparator<Anomaly> ORDER = Comparator
            .comparing(Anomaly::getPriority)
            .thenComparing(Comparator.comparingInt(Anomaly::getBusinessImpact).reversed())
            .thenComparing(Anomaly::getDate, Comparator.reverseOrder())
            .thenComparing(Anomaly::getPropertyId)
            .thenComparing(Anomaly::getDetectorType)
            .thenComparing(Anomaly::getMetric)
            .thenComparing(Anomaly::getDimension)
            .thenComparing(Anomaly::getDimensionValue)
            .thenComparing(a -> a.getClassification() == null ? "" : a.getClassification());

    private AlertPrioritizer() {
        // utility class
    }

    /**
     * @param anomalies enriched anomalies from every detector
     * @return the ranked feed, rank starting at 1
     */
    public static List<RankedAlert> rank(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        List<Anomaly> sorted = new ArrayList<>(anomalies);
        sorted.sort(ORDER);

        List<RankedAlert> feed = new ArrayList<>(sorted.size());
        Map<Priority, Integer> perPriority = new EnumMap<>(Priority.class);
        for (Anomaly anomaly : sorted) {
            feed.add(new RankedAlert(feed.size() + 1, anomaly));
            perPriority.merge(anomaly.getPriority(), 1, Integer::sum);
        }
        LOG.info("Ranked {} alert(s): {}", feed.size(), perPriority);
        return List.copyOf(feed);
    }
}
