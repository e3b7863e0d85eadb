package com.scout.core.config;

import java.util.List;

/**
 * Settings for the forward-looking predictive engine.
 */
public class PredictionSettings {

    private int horizonDays = 7;
    private int minTrendPoints = 14;
    private int minSeasonalPoints = 28;

    /** Per-day decay of a projected trend. */
    private double trendDecay = 0.9;

    /** Propagation predictions are emitted only above this probability. */
    private double minPropagationProbability = 0.3;

    void validate(List<String> errors) {
        if (horizonDays < 1) {
            errors.add("prediction.horizonDays must be >= 1");
        }
        if (minTrendPoints < 4) {
            errors.add("prediction.minTrendPoints must be >= 4");
        }
        if (minSeasonalPoints < 7) {
            errors.add("prediction.minSeasonalPoints must be >= 7");
        }
        if (trendDecay <= 0 || trendDecay > 1) {
            errors.add("prediction.trendDecay must be in (0, 1]");
        }
        if (minPropagationProbability < 0 || minPropagationProbability >= 1) {
            errors.add("prediction.minPropagationProbability must be in [0, 1)");
        }
    }

    public int getHorizonDays() {
        return horizonDays;
    }

    public void setHorizonDays(int horizonDays) {
        this.horizonDays = horizonDays;
    }

    public int getMinTrendPoints() {
        return minTrendPoints;
    }

    public void setMinTrendPoints(int minTrendPoints) {
        this.minTrendPoints = minTrendPoints;
    }

    public int getMinSeasonalPoints() {
        return minSeasonalPoints;
    }

    public void setMinSeasonalPoints(int minSeasonalPoints) {
        this.minSeasonalPoints = minSeasonalPoints;
    }

    public double getTrendDecay() {
        return trendDecay;
    }

    public void setTrendDecay(double trendDecay) {
        this.trendDecay = trendDecay;
    }

    public double getMinPropagationProbability() {
        return minPropagationProbability;
    }

    public void setMinPropagationProbability(double minPropagationProbability) {
        this.minPropagationProbability = minPropagationProbability;
    }
}
