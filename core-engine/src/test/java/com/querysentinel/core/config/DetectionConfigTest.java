package com.querysentinel.core.config;

import com.querysentinel.core.model.QueryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionConfig} and {@link QueryLogFilter}.
 */
class DetectionConfigTest {

    @Test
    @DisplayName("Should expose documented defaults")
    void shouldExposeDefaults() {
        DetectionConfig config = DetectionConfig.defaults();

        assertThat(config.getTimezone()).isEqualTo(ZoneId.of("America/Los_Angeles"));
        assertThat(config.getHistoricalWindow()).isEqualTo(Duration.ofDays(30));
        assertThat(config.getRecentWindow()).isEqualTo(Duration.ofHours(24));
        assertThat(config.getMinimumActivity()).isEqualTo(20);
        assertThat(config.getDeviationMultiplier()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should reject non-positive windows and multiplier")
    void shouldRejectNonPositiveValues() {
        assertThatThrownBy(() -> DetectionConfig.builder()
                .historicalWindow(Duration.ZERO)
                .recentWindow(Duration.ofHours(-1))
                .deviationMultiplier(0)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("'historicalWindow' must be a positive duration")
                .hasMessageContaining("'recentWindow' must be a positive duration")
                .hasMessageContaining("'deviationMultiplier' must be > 0");
    }

    @Test
    @DisplayName("Should keep only successful SELECTs from non-system users")
    void shouldFilterRecords() {
        QueryLogFilter filter = QueryLogFilter.defaults();

        assertThat(filter.matches(record("ALICE", "SELECT", "SUCCESS"))).isTrue();
        assertThat(filter.matches(record("SYSTEM", "SELECT", "SUCCESS"))).isFalse();
        assertThat(filter.matches(record("ALICE", "INSERT", "SUCCESS"))).isFalse();
        assertThat(filter.matches(record("ALICE", "SELECT", "FAILED_WITH_ERROR"))).isFalse();
        assertThat(filter.matches(record("ALICE", null, null))).isFalse();
    }

    private static QueryRecord record(String user, String type, String status) {
        return QueryRecord.builder()
                .userName(user)
                .queryId("q")
                .startTime(Instant.EPOCH)
                .queryText("SELECT 1")
                .queryType(type)
                .executionStatus(status)
                .build();
    }
}
