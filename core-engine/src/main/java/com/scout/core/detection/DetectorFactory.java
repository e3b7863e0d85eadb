package com.scout.core.detection;

import com.scout.core.config.ScoutConfig;
import com.scout.core.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates the configured {@link AnomalyDetector} set.
 *
 * <p>
 * This is the single point of extension when adding new detector types:
 * add the type to {@link DetectorType} and create the detector here.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    private DetectorFactory() {
        // utility class
    }

    /**
     * Create the detector for one type.
     *
     * @param type   detector type; must not be {@code null}
     * @param config threshold configuration; must not be {@code null}
     * @param clock  source of {@code detectedAt} timestamps
     * @return the detector
     */
    public static AnomalyDetector create(DetectorType type, ScoutConfig config, Clock clock) {
        Objects.requireNonNull(type, "DetectorType must not be null");
        Objects.requireNonNull(config, "ScoutConfig must not be null");
        Objects.requireNonNull(clock, "Clock must not be null");
        return switch (type) {
            case DISASTER -> new DisasterDetector(config.getDisaster(), clock);
            case SPAM -> new SpamDetector(config.getSpam(), clock);
            case RECORD -> new RecordDetector(config.getRecord(), clock);
            case TREND -> new TrendDetector(config.getTrend(), clock);
            case SEGMENT -> new SegmentAnomalyDetector(config.getSegment(), clock);
        };
    }

    /**
     * Create every enabled detector, in {@link DetectorType} order.
     *
     * @param config threshold configuration; must not be {@code null}
     * @param clock  source of {@code detectedAt} timestamps
     * @return unmodifiable list of detectors
     */
    public static List<AnomalyDetector> createAll(ScoutConfig config, Clock clock) {
        Objects.requireNonNull(config, "ScoutConfig must not be null");
        List<AnomalyDetector> detectors = new ArrayList<>();
        for (DetectorType type : DetectorType.values()) {
            if (type == DetectorType.SEGMENT && !config.getSegment().isEnabled()) {
                LOG.info("Segment detector disabled by configuration");
                continue;
            }
            detectors.add(create(type, config, clock));
        }
        LOG.info("Created {} detector(s): {}", detectors.size(),
                detectors.stream().map(d -> d.getType().getId()).toList());
        return Collections.unmodifiableList(detectors);
    }
}
