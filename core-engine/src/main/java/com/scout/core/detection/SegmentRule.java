package com.scout.core.detection;

import com.scout.core.model.Anomaly;

import java.util.List;

/**
 * Comparison applied by a {@link DimensionalSeriesComparator} to one
 * segment's window.
 */
@FunctionalInterface
public interface SegmentRule {

    /**
     * @param window the latest observation of a segment and its history
     * @return anomalies fired by the rule, possibly empty
     */
    List<Anomaly> evaluate(SegmentWindow window);
}
