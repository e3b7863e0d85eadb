package com.scout.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the {@code scout.yml} threshold configuration.
 *
 * <p>
 * Every section is optional; an omitted section or key keeps its documented
 * default. Expected YAML structure:
 * </p>
 *
 * <pre>
 * disaster:
 *   nearZeroSessions: 10
 *   catastrophicDropPct: 90
 * spam:
 *   sigmaThreshold: 3.0
 *   bounceRateThreshold: 85
 * record:
 *   minSessions: 100
 * trend:
 *   thresholdPct: 15
 * portfolio:
 *   patternThreshold: 0.3
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link ConfigLoader} does so.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoutConfig {

    private DisasterSettings disaster = new DisasterSettings();
    private SpamSettings spam = new SpamSettings();
    private RecordSettings record = new RecordSettings();
    private TrendSettings trend = new TrendSettings();
    private SegmentSettings segment = new SegmentSettings();
    private PortfolioSettings portfolio = new PortfolioSettings();
    private RootCauseSettings rootCause = new RootCauseSettings();
    private PredictionSettings prediction = new PredictionSettings();

    /**
     * @return configuration with every threshold at its default
     */
    public static ScoutConfig defaults() {
        return new ScoutConfig();
    }

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if any value is out of
     * range.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        disaster.validate(errors);
        spam.validate(errors);
        record.validate(errors);
        trend.validate(errors);
        segment.validate(errors);
        portfolio.validate(errors);
        rootCause.validate(errors);
        prediction.validate(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "SCOUT configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (null sections fall back to defaults)
    // ---------------------------------------------------------------

    public DisasterSettings getDisaster() {
        return disaster;
    }

    public void setDisaster(DisasterSettings disaster) {
        this.disaster = disaster != null ? disaster : new DisasterSettings();
    }

    public SpamSettings getSpam() {
        return spam;
    }

    public void setSpam(SpamSettings spam) {
        this.spam = spam != null ? spam : new SpamSettings();
    }

    public RecordSettings getRecord() {
        return record;
    }

    public void setRecord(RecordSettings record) {
        this.record = record != null ? record : new RecordSettings();
    }

    public TrendSettings getTrend() {
        return trend;
    }

    public void setTrend(TrendSettings trend) {
        this.trend = trend != null ? trend : new TrendSettings();
    }

    public SegmentSettings getSegment() {
        return segment;
    }

    public void setSegment(SegmentSettings segment) {
        this.segment = segment != null ? segment : new SegmentSettings();
    }

    public PortfolioSettings getPortfolio() {
        return portfolio;
    }

    public void setPortfolio(PortfolioSettings portfolio) {
        this.portfolio = portfolio != null ? portfolio : new PortfolioSettings();
    }

    public RootCauseSettings getRootCause() {
        return rootCause;
    }

    public void setRootCause(RootCauseSettings rootCause) {
        this.rootCause = rootCause != null ? rootCause : new RootCauseSettings();
    }

    public PredictionSettings getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionSettings prediction) {
        this.prediction = prediction != null ? prediction : new PredictionSettings();
    }

    @Override
    public String toString() {
        return "ScoutConfig{patternThreshold=" + portfolio.getPatternThreshold()
                + ", spamSigma=" + spam.getSigmaThreshold()
                + ", recordMinSessions=" + record.getMinSessions()
                + ", trendThresholdPct=" + trend.getThresholdPct() + '}';
    }
}
