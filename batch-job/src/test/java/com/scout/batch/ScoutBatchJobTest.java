package com.scout.batch;

import com.scout.core.model.DetectorType;
import com.scout.core.pipeline.PipelineResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link ScoutBatchJob#run(JobConfig, java.time.Clock, RunMetrics)}.
 */
class ScoutBatchJobTest {

    @TempDir
    Path inputDir;

    @TempDir
    Path outputDir;

    @Test
    @DisplayName("Should analyze every loadable property and write the reports")
    void shouldRunEndToEnd() {
        PropertyFiles.write(inputDir, "111", PropertyFiles.steadyThen(1000, 35, 2));
        PropertyFiles.write(inputDir, "222", PropertyFiles.steadyThen(900, 35, 900));
        PropertyFiles.write(inputDir, "scout_production_clean_333.json", "not json");
        RunMetrics metrics = new RunMetrics();

        PipelineResult result = ScoutBatchJob.run(config(), PropertyFiles.CLOCK, metrics);

        assertThat(result.getSucceededCount()).isEqualTo(2);
        assertThat(result.getPortfolio().getTotalProperties()).isEqualTo(2);
        assertThat(result.getAnomalies(DetectorType.DISASTER)).isNotEmpty();
        assertThat(outputDir.resolve(ReportWriter.RANKED_ALERTS)).exists();
        assertThat(outputDir.resolve(ReportWriter.alertsFileName(DetectorType.SPAM))).exists();
        assertThat(metrics.getRegistry().get("scout.properties.loaded").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("scout.properties.failed").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("scout.pipeline.duration").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should produce identical alerts when re-run over the same input")
    void shouldBeRepeatable() {
        PropertyFiles.write(inputDir, "111", PropertyFiles.steadyThen(1000, 35, 2));
        PropertyFiles.write(inputDir, "222", PropertyFiles.steadyThen(900, 35, 1500));

        PipelineResult first = ScoutBatchJob.run(config(), PropertyFiles.CLOCK, new RunMetrics());
        PipelineResult second = ScoutBatchJob.run(config(), PropertyFiles.CLOCK, new RunMetrics());

        assertThat(second.getAnomalies()).isEqualTo(first.getAnomalies());
        assertThat(second.getPredictions()).isEqualTo(first.getPredictions());
    }

    @Test
    @DisplayName("Should fail the run when no property can be loaded")
    void shouldFailWithoutProperties() {
        PropertyFiles.write(inputDir, "scout_production_clean_bad.json", "{}");

        assertThatThrownBy(() -> ScoutBatchJob.run(config(), PropertyFiles.CLOCK, new RunMetrics()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No property could be loaded")
                .hasMessageContaining("1 failure(s)");
    }

    @Test
    @DisplayName("Should summarise load failures and property outcomes")
    void shouldSummariseRun() {
        PropertyFiles.write(inputDir, "111", PropertyFiles.steadyThen(1000, 35, 2));

        PipelineResult result = ScoutBatchJob.run(config(), PropertyFiles.CLOCK, new RunMetrics());

        assertThat(RunSummary.lines(Map.of("x.json", "x.json: empty document"), result))
                .startsWith("x.json: NOT LOADED (x.json: empty document)")
                .anySatisfy(line -> assertThat(line).startsWith("111: ok ("))
                .last().asString().startsWith("1 loaded, 1 not loaded, 1 succeeded, 0 failed");
    }

    private JobConfig config() {
        return new JobConfig.Builder()
                .inputDir(inputDir)
                .outputDir(outputDir)
                .parallelism(2)
                .build();
    }
}
