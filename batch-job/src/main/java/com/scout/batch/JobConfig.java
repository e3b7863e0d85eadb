package com.scout.batch;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Typed, immutable settings for one batch run.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults so
 * the job can be driven by a scheduler, a container {@code -e} flag or a
 * shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic and test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String ENV_INPUT_DIR = "SCOUT_INPUT_DIR";
    public static final String ENV_OUTPUT_DIR = "SCOUT_OUTPUT_DIR";
    public static final String ENV_PARALLELISM = "SCOUT_PARALLELISM";
    public static final String ENV_CONFIG_PATH = "SCOUT_CONFIG_PATH";
    public static final String ENV_EVENT_CALENDAR_PATH = "SCOUT_EVENT_CALENDAR_PATH";
    public static final String ENV_FILE_GLOB = "SCOUT_FILE_GLOB";

    public static final String DEFAULT_FILE_GLOB = "scout_production_clean_*.json";

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final Path inputDir;
    private final Path outputDir;
    private final String fileGlob;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int parallelism;

    // ---------------------------------------------------------------
    // Engine resources (blank means classpath default)
    // ---------------------------------------------------------------
    private final String configPath;
    private final String eventCalendarPath;

    private JobConfig(Builder b) {
        this.inputDir = b.inputDir;
        this.outputDir = b.outputDir;
        this.fileGlob = b.fileGlob;
        this.parallelism = b.parallelism;
        this.configPath = b.configPath;
        this.eventCalendarPath = b.eventCalendarPath;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .inputDir(Paths.get(env(ENV_INPUT_DIR, ".")))
                    .outputDir(Paths.get(env(ENV_OUTPUT_DIR, "scout-output")))
                    .fileGlob(env(ENV_FILE_GLOB, DEFAULT_FILE_GLOB))
                    .parallelism(Integer.parseInt(env(ENV_PARALLELISM,
                            String.valueOf(Runtime.getRuntime().availableProcessors()))))
                    .configPath(env(ENV_CONFIG_PATH, ""))
                    .eventCalendarPath(env(ENV_EVENT_CALENDAR_PATH, ""))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable " + ENV_PARALLELISM + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getFileGlob() {
        return fileGlob;
    }

    public int getParallelism() {
        return parallelism;
    }

    public String getConfigPath() {
        return configPath;
    }

    public String getEventCalendarPath() {
        return eventCalendarPath;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} requires both directories, a non-blank glob and a
     * parallelism of at least one.
     * </p>
     */
    public static class Builder {
        private Path inputDir;
        private Path outputDir;
        private String fileGlob = DEFAULT_FILE_GLOB;
        private int parallelism = 1;
        private String configPath = "";
        private String eventCalendarPath = "";

        public Builder inputDir(Path v) {
            this.inputDir = v;
            return this;
        }

        public Builder outputDir(Path v) {
            this.outputDir = v;
            return this;
        }

        public Builder fileGlob(String v) {
            this.fileGlob = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder configPath(String v) {
            this.configPath = v == null ? "" : v;
            return this;
        }

        public Builder eventCalendarPath(String v) {
            this.eventCalendarPath = v == null ? "" : v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (inputDir == null) {
                throw new IllegalArgumentException("inputDir must not be null");
            }
            if (outputDir == null) {
                throw new IllegalArgumentException("outputDir must not be null");
            }
            if (fileGlob == null || fileGlob.isBlank()) {
                throw new IllegalArgumentException("fileGlob must not be null or blank");
            }
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputDir=" + inputDir +
                ", outputDir=" + outputDir +
                ", fileGlob='" + fileGlob + '\'' +
                ", parallelism=" + parallelism +
                ", configPath='" + configPath + '\'' +
                ", eventCalendarPath='" + eventCalendarPath + '\'' +
                '}';
    }
}
