package com.scout.batch;

import com.scout.core.model.DetectorType;
import com.scout.core.pipeline.PipelineResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Run-level metrics for the batch job.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code scout.properties.loaded} / {@code scout.properties.failed}</li>
 *   <li>{@code scout.anomalies} tagged by {@code detector}</li>
 *   <li>{@code scout.patterns} tagged by {@code type}</li>
 *   <li>{@code scout.predictions}</li>
 *   <li>{@code scout.pipeline.duration} timer</li>
 * </ul>
 */
public class RunMetrics {

    private static final Logger LOG = LoggerFactory.getLogger(RunMetrics.class);

    private final MeterRegistry registry;
    private final Counter propertiesLoaded;
    private final Counter propertiesFailed;
    private final Counter predictions;
    private final Timer pipelineDuration;

    public RunMetrics() {
        this(new SimpleMeterRegistry());
    }

    public RunMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");
        this.propertiesLoaded = registry.counter("scout.properties.loaded");
        this.propertiesFailed = registry.counter("scout.properties.failed");
        this.predictions = registry.counter("scout.predictions");
        this.pipelineDuration = Timer.builder("scout.pipeline.duration")
                .description("Wall time of one portfolio pass")
                .register(registry);
    }

    public void recordLoaded(int count) {
        propertiesLoaded.increment(count);
    }

    public void recordFailed(long count) {
        propertiesFailed.increment(count);
    }

    public <T> T timePipeline(Supplier<T> run) {
        return pipelineDuration.record(run);
    }

    public void recordResult(PipelineResult result) {
        recordFailed(result.getFailedCount());
        for (DetectorType type : DetectorType.values()) {
            registry.counter("scout.anomalies", "detector", type.getId())
                    .increment(result.getAnomalies(type).size());
        }
        registry.counter("scout.patterns", "type", "simultaneous")
                .increment(result.getPortfolio().getSimultaneous().size());
        registry.counter("scout.patterns", "type", "cascading")
                .increment(result.getPortfolio().getCascading().size());
        registry.counter("scout.patterns", "type", "metric_correlation")
                .increment(result.getPortfolio().getCorrelations().size());
        predictions.increment(result.getPredictions().size());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /** Log every meter at info level. */
    public void logSummary() {
        for (Meter meter : registry.getMeters()) {
            LOG.info("metric {} {} = {}", meter.getId().getName(), meter.getId().getTags(),
                    meter.measure().iterator().next().getValue());
        }
    }
}
