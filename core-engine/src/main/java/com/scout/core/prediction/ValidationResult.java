package com.scout.core.prediction;

/**
 * Outcome of checking past predictions against observed values.
 */
public final class ValidationResult {

    private final int correctPredictions;
    private final int totalValidated;

    ValidationResult(int correctPredictions, int totalValidated) {
        this.correctPredictions = correctPredictions;
        this.totalValidated = totalValidated;
    }

    /**
     * @return share of validated predictions that were right, or 0 when
     *         nothing could be validated
     */
    public double getAccuracy() {
        return totalValidated == 0 ? 0.0 : (double) correctPredictions / totalValidated;
    }

    public int getCorrectPredictions() {
        return correctPredictions;
    }

    public int getTotalValidated() {
        return totalValidated;
    }

    @Override
    public String toString() {
        return "ValidationResult{correct=" + correctPredictions + ", total=" + totalValidated + '}';
    }
}
