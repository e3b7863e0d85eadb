package com.scout.batch;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RunMetrics}.
 */
class RunMetricsTest {

    @Test
    @DisplayName("Should accumulate loaded and failed property counts")
    void shouldCountProperties() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RunMetrics metrics = new RunMetrics(registry);

        metrics.recordLoaded(3);
        metrics.recordFailed(1);
        metrics.recordFailed(2);

        assertThat(registry.get("scout.properties.loaded").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("scout.properties.failed").counter().count()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should time the pipeline and return its result")
    void shouldTimePipeline() {
        RunMetrics metrics = new RunMetrics();

        String value = metrics.timePipeline(() -> "done");

        assertThat(value).isEqualTo("done");
        assertThat(metrics.getRegistry().get("scout.pipeline.duration").timer().count()).isEqualTo(1);
    }
}
