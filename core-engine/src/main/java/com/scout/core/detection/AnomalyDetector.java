package com.scout.core.detection;

import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Dimension;
import com.scout.core.model.PropertyDataset;

import java.util.List;
import java.util.Set;

/**
 * Contract for all per-property anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong> between calls: a single
 * instance is shared by every worker thread of a run and must only read its
 * configuration.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate one property's dataset.
     *
     * @param dataset the property's clean extract
     * @return anomalies found, possibly empty; never {@code null}
     */
    List<Anomaly> detect(PropertyDataset dataset);

    /**
     * @return the detector type stamped on every anomaly this detector emits
     */
    DetectorType getType();

    /**
     * @return dimensions this detector inspects
     */
    Set<Dimension> getDimensions();
}
