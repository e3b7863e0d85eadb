package com.scout.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should overlay classpath values on the documented defaults")
    void shouldLoadFromClasspath() {
        ScoutConfig config = ConfigLoader.fromClasspath("test-scout.yml");

        assertThat(config.getSpam().getSigmaThreshold()).isEqualTo(2.5);
        assertThat(config.getSpam().getBounceRateThreshold()).isEqualTo(80.0);
        assertThat(config.getSpam().getBaselineDays()).isEqualTo(7);
        assertThat(config.getSegment().isEnabled()).isFalse();
        assertThat(config.getRootCause().getWindowDays()).isEqualTo(3);
        assertThat(config.getDisaster().getNearZeroSessions()).isEqualTo(10.0);
        assertThat(config.getTrend().getThresholdPct()).isEqualTo(15.0);
    }

    @Test
    @DisplayName("Should ship defaults identical to the bundled scout.yml")
    void shouldMatchBundledDefaults() {
        ScoutConfig bundled = ConfigLoader.fromClasspath(ConfigLoader.DEFAULT_RESOURCE);
        ScoutConfig defaults = ScoutConfig.defaults();

        assertThat(bundled.getPortfolio().getPatternThreshold()).isEqualTo(defaults.getPortfolio().getPatternThreshold());
        assertThat(bundled.getRecord().getHistoryDays()).isEqualTo(defaults.getRecord().getHistoryDays());
        assertThat(bundled.getPrediction().getTrendDecay()).isEqualTo(defaults.getPrediction().getTrendDecay());
        assertThat(bundled.getRootCause().getPortfolioBoost()).isEqualTo(defaults.getRootCause().getPortfolioBoost());
    }

    @Test
    @DisplayName("Should report every invalid value in one exception")
    void shouldAggregateValidationErrors() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-scout.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SCOUT configuration validation failed")
                .hasMessageContaining("spam.sigmaThreshold")
                .hasMessageContaining("spam.baselineDays")
                .hasMessageContaining("portfolio.patternThreshold");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the config file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject malformed YAML")
    void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "spam:\n  sigmaThreshold: [unclosed\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Invalid SCOUT configuration");
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty file")
    void shouldUseDefaultsForEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yml");
        Files.writeString(file, "");

        ScoutConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.getSpam().getSigmaThreshold()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should load an explicit path when the file exists")
    void shouldPreferExistingExplicitPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("scout.yml");
        Files.writeString(file, "record:\n  minSessions: 250.0\n");

        assertThat(ConfigLoader.load(file.toString()).getRecord().getMinSessions()).isEqualTo(250.0);
    }
}
