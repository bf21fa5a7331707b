package com.querysentinel.job;

import java.io.Serializable;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable configuration for the Query Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job is configurable through a scheduler's environment, Docker
 * {@code -e} flags, or a shell.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code QUERY_LOG_PATH} – JSON-lines query history (default
 * {@code query_history.jsonl})</li>
 * <li>{@code FINDINGS_OUTPUT_PATH} – findings file; standard output when
 * unset</li>
 * <li>{@code DETECTION_CONFIG_PATH} – detection YAML; classpath
 * {@code detection.yml} or defaults when unset</li>
 * <li>{@code RUN_AS_OF} – ISO-8601 instant both windows end at; now when
 * unset</li>
 * <li>{@code WORKER_THREADS} – threads for the historical and recent
 * branches (default 2)</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String queryLogPath;
    private final String findingsOutputPath;
    private final String detectionConfigPath;
    private final Instant runAsOf;
    private final int workerThreads;

    private JobConfig(Builder b) {
        this.queryLogPath = b.queryLogPath;
        this.findingsOutputPath = b.findingsOutputPath;
        this.detectionConfigPath = b.detectionConfigPath;
        this.runAsOf = b.runAsOf;
        this.workerThreads = b.workerThreads;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static JobConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        String asOf = env(env, "RUN_AS_OF", "");
        try {
            return new Builder()
                    .queryLogPath(env(env, "QUERY_LOG_PATH", "query_history.jsonl"))
                    .findingsOutputPath(env(env, "FINDINGS_OUTPUT_PATH", ""))
                    .detectionConfigPath(env(env, "DETECTION_CONFIG_PATH", ""))
                    .runAsOf(asOf.isEmpty() ? null : Instant.parse(asOf))
                    .workerThreads(Integer.parseInt(env(env, "WORKER_THREADS", "2")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                    "RUN_AS_OF is not an ISO-8601 instant: '" + asOf + "'", e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Path getQueryLogPath() {
        return Path.of(queryLogPath);
    }

    /**
     * @return findings file, or empty to write to standard output
     */
    public Optional<Path> getFindingsOutputPath() {
        return findingsOutputPath.isBlank() ? Optional.empty() : Optional.of(Path.of(findingsOutputPath));
    }

    /**
     * @return detection config file, or empty for automatic resolution
     */
    public Optional<String> getDetectionConfigPath() {
        return detectionConfigPath.isBlank() ? Optional.empty() : Optional.of(detectionConfigPath);
    }

    /**
     * @return fixed end of the detection windows, or empty to use the current
     *         instant
     */
    public Optional<Instant> getRunAsOf() {
        return Optional.ofNullable(runAsOf);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * {@link #build()} checks that the query log path is not blank and that
     * at least one worker thread is configured.
     * </p>
     */
    public static class Builder {
        private String queryLogPath = "query_history.jsonl";
        private String findingsOutputPath = "";
        private String detectionConfigPath = "";
        private Instant runAsOf;
        private int workerThreads = 2;

        public Builder queryLogPath(String v) {
            this.queryLogPath = v;
            return this;
        }

        public Builder findingsOutputPath(String v) {
            this.findingsOutputPath = v;
            return this;
        }

        public Builder detectionConfigPath(String v) {
            this.detectionConfigPath = v;
            return this;
        }

        public Builder runAsOf(Instant v) {
            this.runAsOf = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            if (queryLogPath == null || queryLogPath.isBlank()) {
                throw new IllegalArgumentException("queryLogPath must not be null or blank");
            }
            Objects.requireNonNull(findingsOutputPath, "findingsOutputPath must not be null");
            Objects.requireNonNull(detectionConfigPath, "detectionConfigPath must not be null");
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "queryLogPath='" + queryLogPath + '\'' +
                ", findingsOutputPath='" + findingsOutputPath + '\'' +
                ", detectionConfigPath='" + detectionConfigPath + '\'' +
                ", runAsOf=" + runAsOf +
                ", workerThreads=" + workerThreads +
                '}';
    }
}
