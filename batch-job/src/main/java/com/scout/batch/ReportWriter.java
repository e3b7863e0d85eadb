package com.scout.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.scout.core.detection.AnomalyDetector;
import com.scout.core.model.Anomaly;
import com.scout.core.model.DetectorType;
import com.scout.core.model.Dimension;
import com.scout.core.pipeline.PipelineResult;
import com.scout.core.portfolio.PortfolioAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes a run's JSON reports into the output directory.
 *
 * <ul>
 *   <li>{@code scout_<type>_alerts.json}, one per enabled detector</li>
 *   <li>{@code scout_ranked_alerts.json}</li>
 *   <li>{@code scout_portfolio_patterns.json}</li>
 *   <li>{@code scout_predictions.json}</li>
 *   <li>{@code scout_root_causes.json}</li>
 * </ul>
 *
 * <p>
 * Field names are snake_case and dates are ISO-8601 strings.
 * </p>
 *
 * @since 1.0.0
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    static final String RANKED_ALERTS = "scout_ranked_alerts.json";
    static final String PORTFOLIO_PATTERNS = "scout_portfolio_patterns.json";
    static final String PREDICTIONS = "scout_predictions.json";
    static final String ROOT_CAUSES = "scout_root_causes.json";

    private final Path outputDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ReportWriter(Path outputDir, Clock clock) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    static String alertsFileName(DetectorType type) {
        return "scout_" + type.getId() + "_alerts.json";
    }

    /**
     * Write every report.
     *
     * @param detectors       the detectors that ran
     * @param result          the run's result
     * @param propertiesCount properties the run analyzed
     * @return the files written
     * @throws IllegalStateException if the directory or a file cannot be written
     */
    public List<Path> writeAll(List<AnomalyDetector> detectors, PipelineResult result, int propertiesCount) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }
        Instant generatedAt = clock.instant();
        List<Path> written = new ArrayList<>();

        for (AnomalyDetector detector : detectors) {
            written.add(write(alertsFileName(detector.getType()),
                    detectorReport(detector, result.getAnomalies(detector.getType()), propertiesCount, generatedAt)));
        }
        written.add(write(RANKED_ALERTS, section(generatedAt, "alerts", result.getRankedAlerts())));
        written.add(write(PORTFOLIO_PATTERNS, portfolioReport(result.getPortfolio(), generatedAt)));

        Map<String, Object> predictions = section(generatedAt, "predictions", result.getPredictions());
        predictions.put("report", result.getPredictionReport());
        written.add(write(PREDICTIONS, predictions));

        Map<String, Object> rootCauses = section(generatedAt, "correlations", result.getRootCauses().getCorrelations());
        rootCauses.put("summary", result.getRootCauses().getSummary());
        written.add(write(ROOT_CAUSES, rootCauses));

        LOG.info("Wrote {} report(s) to {}", written.size(), outputDir);
        return written;
    }

    // ---------------------------------------------------------------
    // Documents
    // ---------------------------------------------------------------

    private static Map<String, Object> detectorReport(AnomalyDetector detector, List<Anomaly> alerts,
            int propertiesCount, Instant generatedAt) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("generated_at", generatedAt);
        doc.put("detector_type", detector.getType());
        doc.put("priority", detector.getType().getPriorityRange());
        doc.put("properties_analyzed", propertiesCount);
        doc.put("total_alerts", alerts.size());
        doc.put("dimensions", detector.getDimensions().stream().map(Dimension::getId).sorted().toList());
        doc.put("alerts", alerts);
        return doc;
    }

    private static Map<String, Object> portfolioReport(PortfolioAnalysis portfolio, Instant generatedAt) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("generated_at", generatedAt);
        doc.put("total_properties", portfolio.getTotalProperties());
        doc.put("total_anomalies", portfolio.getTotalAnomalies());
        doc.put("health_score", portfolio.getHealthScore());
        doc.put("simultaneous", portfolio.getSimultaneous());
        doc.put("cascading", portfolio.getCascading());
        doc.put("correlations", portfolio.getCorrelations());
        doc.put("pattern_causes", portfolio.getPatternCauses());
        doc.put("insights", portfolio.getInsights());
        doc.put("recommendations", portfolio.getRecommendations());
        return doc;
    }

    private static Map<String, Object> section(Instant generatedAt, String name, Object content) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("generated_at", generatedAt);
        doc.put(name, content);
        return doc;
    }

    private Path write(String fileName, Object document) {
        Path target = outputDir.resolve(fileName);
        try {
            mapper.writeValue(target.toFile(), document);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report " + target, e);
        }
        LOG.debug("Wrote {}", target);
        return target;
    }
}
