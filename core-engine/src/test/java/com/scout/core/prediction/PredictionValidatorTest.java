package com.scout.core.prediction;

import com.scout.core.model.Metric;
import com.scout.core.model.Prediction;
import com.scout.core.model.PropertyDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.scout.core.TestDatasets.END;
import static com.scout.core.TestDatasets.dataset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link PredictionValidator}.
 */
class PredictionValidatorTest {

    @Test
    @DisplayName("Should score predictions against observed values")
    void shouldScorePredictions() {
        Prediction hit = prediction("p1", 0.75);
        Prediction quietHit = prediction("p2", 0.4);
        Prediction falseAlarm = prediction("p3", 0.75);
        Prediction unobserved = prediction("p4", 0.9);
        Map<String, Double> actuals = Map.of(
                hit.getKey(), 150.0,
                quietHit.getKey(), 100.0,
                falseAlarm.getKey(), 100.0);

        ValidationResult result = PredictionValidator.validate(List.of(hit, quietHit, falseAlarm, unobserved),
                actuals);

        assertThat(result.getTotalValidated()).isEqualTo(3);
        assertThat(result.getCorrectPredictions()).isEqualTo(2);
        assertThat(result.getAccuracy()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("Should report zero accuracy when nothing could be validated")
    void shouldHandleNoActuals() {
        ValidationResult result = PredictionValidator.validate(List.of(prediction("p1", 0.9)), Map.of());

        assertThat(result.getTotalValidated()).isZero();
        assertThat(result.getAccuracy()).isZero();
    }

    @Test
    @DisplayName("Should key observed values like predictions")
    void shouldIndexActuals() {
        PropertyDataset p1 = dataset("p1", 100, 120);

        Map<String, Double> actuals = PredictionValidator.actualsFrom(List.of(p1));

        assertThat(actuals)
                .containsEntry("p1|sessions|" + END, 120.0)
                .containsEntry("p1|page_views|" + END, 240.0)
                .containsEntry("p1|conversions|" + END.minusDays(1), 10.0)
                .hasSize(8);
    }

    private static Prediction prediction(String entity, double probability) {
        return Prediction.builder()
                .entity(entity)
                .metric(Metric.SESSIONS)
                .predictionDate(END)
                .predictedValue(100)
                .expectedRange(80, 120)
                .anomalyProbability(probability)
                .potentialImpact(50)
                .build();
    }
}
