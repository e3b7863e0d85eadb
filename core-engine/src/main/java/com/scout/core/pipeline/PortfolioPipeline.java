package com.scout.core.pipeline;

import com.scout.core.alerting.AlertPrioritizer;
import com.scout.core.alerting.RankedAlert;
import com.scout.core.config.ScoutConfig;
import com.scout.core.detection.AnomalyDetector;
import com.scout.core.detection.DetectorFactory;
import com.scout.core.model.Anomaly;
import com.scout.core.model.Prediction;
import com.scout.core.model.PropertyDataset;
import com.scout.core.portfolio.PortfolioAnalysis;
import com.scout.core.portfolio.PortfolioPatternAnalyzer;
import com.scout.core.prediction.PredictionReport;
import com.scout.core.prediction.PredictiveEngine;
import com.scout.core.rootcause.EventCalendar;
import com.scout.core.rootcause.RootCauseAnalysis;
import com.scout.core.rootcause.RootCauseCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One daily pass over the portfolio.
 *
 * <h3>Stages</h3>
 *
 * <pre>
 *   PropertyDataset (per property, in a fixed worker pool)
 *     → every enabled AnomalyDetector
 *   (barrier: all properties joined)
 *     → PortfolioPatternAnalyzer
 *     → RootCauseCorrelator (enriches anomalies)
 *     → PredictiveEngine
 *     → AlertPrioritizer
 * </pre>
 *
 * <p>
 * A property whose detection throws is logged with its id and reported as
 * failed; it contributes no anomalies and the run continues. Results are
 * assembled in input order, so the same input always yields the same output
 * regardless of scheduling.
 * </p>
 *
 * @since 1.0.0
 */
public class PortfolioPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PortfolioPipeline.class);

    private final ScoutConfig config;
    private final int parallelism;
    private final List<AnomalyDetector> detectors;
    private final PortfolioPatternAnalyzer portfolioAnalyzer;
    private final RootCauseCorrelator correlator;
    private final PredictiveEngine predictiveEngine;

    public PortfolioPipeline(ScoutConfig config, EventCalendar calendar, Clock clock, int parallelism) {
        this(config, DetectorFactory.createAll(config, clock), calendar, parallelism);
    }

    PortfolioPipeline(ScoutConfig config, List<AnomalyDetector> detectors, EventCalendar calendar,
            int parallelism) {
        this.config = Objects.requireNonNull(config, "ScoutConfig must not be null");
        Objects.requireNonNull(calendar, "EventCalendar must not be null");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
        }
        this.parallelism = parallelism;
        this.detectors = List.copyOf(detectors);
        this.portfolioAnalyzer = new PortfolioPatternAnalyzer(config.getPortfolio());
        this.correlator = new RootCauseCorrelator(config.getRootCause(), calendar);
        this.predictiveEngine = new PredictiveEngine(config.getPrediction(), calendar);
    }

    /**
     * Run every stage over the given properties.
     *
     * @param datasets loaded properties
     * @return the run's result
     */
    public PipelineResult run(List<PropertyDataset> datasets) {
        Objects.requireNonNull(datasets, "datasets must not be null");
        LOG.info("Running {} detector(s) over {} property(ies) with parallelism {}",
                detectors.size(), datasets.size(), parallelism);

        List<PropertyOutcome> outcomes = detectAll(datasets);
        List<Anomaly> anomalies = new ArrayList<>();
        List<PropertyDataset> analyzed = new ArrayList<>();
        List<String> propertyIds = new ArrayList<>();
        for (int i = 0; i < outcomes.size(); i++) {
            PropertyOutcome outcome = outcomes.get(i);
            propertyIds.add(outcome.getPropertyId());
            if (outcome.isSucceeded()) {
                anomalies.addAll(outcome.getAnomalies());
                analyzed.add(datasets.get(i));
            }
        }

        PortfolioAnalysis portfolio = portfolioAnalyzer.analyze(propertyIds, anomalies);
        RootCauseAnalysis rootCauses = correlator.analyze(anomalies, portfolio);
        List<Prediction> predictions = predictiveEngine.predict(analyzed, portfolio);
        PredictionReport report = PredictionReport.of(predictions, config.getPrediction().getHorizonDays());
        List<RankedAlert> ranked = AlertPrioritizer.rank(rootCauses.getEnrichedAnomalies());

        PipelineResult result = new PipelineResult(outcomes, portfolio, rootCauses, predictions, report, ranked);
        LOG.info("Run finished: {} succeeded, {} failed, {} anomalies, health score {}",
                result.getSucceededCount(), result.getFailedCount(), anomalies.size(), portfolio.getHealthScore());
        return result;
    }

    /** The enabled detectors, in {@link com.scout.core.model.DetectorType} order. */
    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }

    // ---------------------------------------------------------------
    // Detection stage
    // ---------------------------------------------------------------

    private List<PropertyOutcome> detectAll(List<PropertyDataset> datasets) {
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, new DetectionThreadFactory());
        try {
            List<Future<List<Anomaly>>> futures = new ArrayList<>(datasets.size());
            for (PropertyDataset dataset : datasets) {
                futures.add(pool.submit(() -> detect(dataset)));
            }

            List<PropertyOutcome> outcomes = new ArrayList<>(datasets.size());
            for (int i = 0; i < futures.size(); i++) {
                String propertyId = datasets.get(i).getPropertyId();
                try {
                    outcomes.add(PropertyOutcome.success(propertyId, futures.get(i).get()));
                } catch (ExecutionException e) {
                    LOG.error("Detection failed for property {}, continuing with the rest of the portfolio",
                            propertyId, e.getCause());
                    outcomes.add(PropertyOutcome.failure(propertyId, e.getCause()));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for property detection", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private List<Anomaly> detect(PropertyDataset dataset) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            List<Anomaly> found = detector.detect(dataset);
            if (!found.isEmpty()) {
                LOG.debug("Detector [{}] found {} anomaly(ies) for {}", detector.getType().getId(),
                        found.size(), dataset.getPropertyId());
            }
            anomalies.addAll(found);
        }
        return anomalies;
    }

    private static final class DetectionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "scout-detect-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
