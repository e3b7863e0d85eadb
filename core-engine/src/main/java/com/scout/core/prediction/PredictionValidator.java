package com.scout.core.prediction;

import com.scout.core.model.Metric;
import com.scout.core.model.MetricObservation;
import com.scout.core.model.Prediction;
import com.scout.core.model.PropertyDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores earlier predictions against the values that were actually observed.
 *
 * <p>
 * A prediction is correct when the observed value left its expected range
 * and the probability was above one half, or stayed inside the range and the
 * probability was at most one half. Predictions without an observed value
 * are not counted.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredictionValidator {

    private static final Logger LOG = LoggerFactory.getLogger(PredictionValidator.class);

    private PredictionValidator() {
        // utility class
    }

    /**
     * @param predictions earlier predictions
     * @param actuals     observed values keyed like {@link Prediction#getKey()}
     * @return validation outcome
     */
    public static ValidationResult validate(List<Prediction> predictions, Map<String, Double> actuals) {
        Objects.requireNonNull(predictions, "predictions must not be null");
        Objects.requireNonNull(actuals, "actuals must not be null");

        int correct = 0;
        int total = 0;
        for (Prediction p : predictions) {
            Double actual = actuals.get(p.getKey());
            if (actual == null) {
                continue;
            }
            total++;
            boolean wasAnomaly = p.isOutsideExpectedRange(actual);
            double probability = p.getAnomalyProbability();
            if ((wasAnomaly && probability > 0.5) || (!wasAnomaly && probability <= 0.5)) {
                correct++;
            }
        }
        ValidationResult result = new ValidationResult(correct, total);
        LOG.info("Validated {} of {} prediction(s): accuracy {}", total, predictions.size(), result.getAccuracy());
        return result;
    }

    /**
     * Index every site-wide observation of the given properties by
     * prediction key.
     *
     * @param datasets observed properties
     * @return actual values keyed {@code entity|metric|date}
     */
    public static Map<String, Double> actualsFrom(Collection<PropertyDataset> datasets) {
        Map<String, Double> actuals = new HashMap<>();
        for (PropertyDataset dataset : datasets) {
            for (Metric metric : Metric.values()) {
                for (MetricObservation o : dataset.overall(metric).getObservations()) {
                    actuals.put(dataset.getPropertyId() + '|' + metric.getId() + '|' + o.getDate(), o.getValue());
                }
            }
        }
        return actuals;
    }
}
