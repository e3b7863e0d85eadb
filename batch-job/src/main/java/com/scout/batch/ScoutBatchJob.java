package com.scout.batch;

import com.scout.core.config.ConfigLoader;
import com.scout.core.config.ScoutConfig;
import com.scout.core.io.PropertyDatasetReader;
import com.scout.core.model.PropertyDataset;
import com.scout.core.pipeline.PipelineResult;
import com.scout.core.pipeline.PortfolioPipeline;
import com.scout.core.rootcause.EventCalendar;
import com.scout.core.rootcause.EventCalendarLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point for the SCOUT daily batch run.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Input directory (scout_production_clean_*.json)
 *     → PropertyFileLoader → PropertyDataset per property
 *     → PortfolioPipeline (detection, portfolio, root cause, prediction, ranking)
 *     → ReportWriter → JSON reports in the output directory
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via {@link JobConfig};
 * thresholds come from {@link ConfigLoader} and the event calendar from
 * {@link EventCalendarLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoutBatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(ScoutBatchJob.class);

    private ScoutBatchJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) {
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting SCOUT batch run with config: {}", config);
        run(config, Clock.systemUTC(), new RunMetrics());
    }

    /**
     * Execute one run.
     *
     * @param config  job settings
     * @param clock   clock for detection timestamps and report headers
     * @param metrics run metrics
     * @return the run's result
     * @throws IllegalStateException if no property could be loaded
     */
    static PipelineResult run(JobConfig config, Clock clock, RunMetrics metrics) {
        // 1. Load thresholds and the event calendar
        ScoutConfig scoutConfig = ConfigLoader.load(config.getConfigPath());
        EventCalendar calendar = EventCalendarLoader.load(config.getEventCalendarPath());

        // 2. Load property files
        PropertyFileLoader.LoadResult loaded = new PropertyFileLoader(new PropertyDatasetReader())
                .loadAll(config.getInputDir(), config.getFileGlob());
        List<PropertyDataset> datasets = loaded.getDatasets();
        metrics.recordLoaded(datasets.size());
        metrics.recordFailed(loaded.getFailures().size());
        if (datasets.isEmpty()) {
            throw new IllegalStateException("No property could be loaded from " + config.getInputDir()
                    + " (pattern '" + config.getFileGlob() + "', " + loaded.getFailures().size() + " failure(s))");
        }

        // 3. Run the portfolio pass; unreadable files have no property id and stay out of the portfolio total
        PortfolioPipeline pipeline = new PortfolioPipeline(scoutConfig, calendar, clock, config.getParallelism());
        PipelineResult result = metrics.timePipeline(() -> pipeline.run(datasets));
        metrics.recordResult(result);

        // 4. Write reports
        List<Path> reports = new ReportWriter(config.getOutputDir(), clock)
                .writeAll(pipeline.getDetectors(), result, datasets.size());

        RunSummary.lines(loaded.getFailures(), result).forEach(line -> LOG.info("{}", line));
        metrics.logSummary();
        LOG.info("SCOUT batch run complete, {} report(s) in {}", reports.size(), config.getOutputDir());
        return result;
    }
}
