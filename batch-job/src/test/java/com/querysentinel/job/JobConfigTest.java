package com.querysentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should fall back to defaults for unset variables")
    void shouldUseDefaults() {
        JobConfig config = JobConfig.fromEnvironment(Map.of());

        assertThat(config.getQueryLogPath()).isEqualTo(Path.of("query_history.jsonl"));
        assertThat(config.getFindingsOutputPath()).isEmpty();
        assertThat(config.getDetectionConfigPath()).isEmpty();
        assertThat(config.getRunAsOf()).isEmpty();
        assertThat(config.getWorkerThreads()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should read every variable")
    void shouldReadEnvironment() {
        JobConfig config = JobConfig.fromEnvironment(Map.of(
                "QUERY_LOG_PATH", "/data/history.jsonl",
                "FINDINGS_OUTPUT_PATH", "/data/findings.jsonl",
                "DETECTION_CONFIG_PATH", "/etc/sentinel/detection.yml",
                "RUN_AS_OF", "2024-03-10T20:00:00Z",
                "WORKER_THREADS", "4"));

        assertThat(config.getQueryLogPath()).isEqualTo(Path.of("/data/history.jsonl"));
        assertThat(config.getFindingsOutputPath()).contains(Path.of("/data/findings.jsonl"));
        assertThat(config.getDetectionConfigPath()).contains("/etc/sentinel/detection.yml");
        assertThat(config.getRunAsOf()).contains(Instant.parse("2024-03-10T20:00:00Z"));
        assertThat(config.getWorkerThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankValues() {
        JobConfig config = JobConfig.fromEnvironment(Map.of("QUERY_LOG_PATH", "  ", "RUN_AS_OF", ""));

        assertThat(config.getQueryLogPath()).isEqualTo(Path.of("query_history.jsonl"));
        assertThat(config.getRunAsOf()).isEmpty();
    }

    @Test
    @DisplayName("Should throw on unparsable values")
    void shouldThrowOnUnparsableValues() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("WORKER_THREADS", "many")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("numeric");
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("RUN_AS_OF", "yesterday")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RUN_AS_OF");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> JobConfig.fromEnvironment(Map.of("WORKER_THREADS", "0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("workerThreads");
    }
}
