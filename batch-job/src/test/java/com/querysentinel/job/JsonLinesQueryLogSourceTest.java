package com.querysentinel.job;

import com.querysentinel.core.config.QueryLogFilter;
import com.querysentinel.core.model.QueryRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesQueryLogSource}.
 */
class JsonLinesQueryLogSourceTest {

    private static final Instant START = Instant.parse("2024-03-10T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-11T00:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should read every field of a record")
    void shouldReadRecord() throws IOException {
        Path file = write(
                "{\"userName\":\"ALICE\",\"queryId\":\"01a\",\"startTime\":\"2024-03-10T12:00:00Z\","
                        + "\"queryText\":\"SELECT * FROM orders\",\"executionStatus\":\"SUCCESS\","
                        + "\"queryType\":\"SELECT\",\"warehouseName\":\"WH_XS\",\"bytesScanned\":1024,"
                        + "\"executionTimeMs\":350,\"role\":\"ignored\"}");

        List<QueryRecord> records = new JsonLinesQueryLogSource(file).fetch(START, END, QueryLogFilter.defaults());

        assertThat(records).hasSize(1);
        QueryRecord record = records.get(0);
        assertThat(record.getUserName()).isEqualTo("ALICE");
        assertThat(record.getQueryId()).isEqualTo("01a");
        assertThat(record.getStartTime()).isEqualTo(Instant.parse("2024-03-10T12:00:00Z"));
        assertThat(record.getQueryText()).isEqualTo("SELECT * FROM orders");
        assertThat(record.getWarehouseName()).isEqualTo("WH_XS");
        assertThat(record.getBytesScanned()).isEqualTo(1024L);
        assertThat(record.getExecutionTimeMs()).isEqualTo(350L);
    }

    @Test
    @DisplayName("Should apply the window (start inclusive, end exclusive) and the filter")
    void shouldApplyWindowAndFilter() throws IOException {
        Path file = write(
                line("in-start", "ALICE", "2024-03-10T00:00:00Z", "SELECT", "SUCCESS"),
                line("before", "ALICE", "2024-03-09T23:59:59Z", "SELECT", "SUCCESS"),
                "",
                line("at-end", "ALICE", "2024-03-11T00:00:00Z", "SELECT", "SUCCESS"),
                line("system", "SYSTEM", "2024-03-10T10:00:00Z", "SELECT", "SUCCESS"),
                line("insert", "ALICE", "2024-03-10T10:00:00Z", "INSERT", "SUCCESS"),
                line("failed", "ALICE", "2024-03-10T10:00:00Z", "SELECT", "FAIL"),
                line("in-middle", "BOB", "2024-03-10T10:00:00Z", "SELECT", "SUCCESS"));

        List<QueryRecord> records = new JsonLinesQueryLogSource(file).fetch(START, END, QueryLogFilter.defaults());

        assertThat(records).extracting(QueryRecord::getQueryId).containsExactly("in-start", "in-middle");
    }

    @Test
    @DisplayName("Should fail with file and line on a malformed record")
    void shouldFailOnMalformedLine() throws IOException {
        Path file = write(
                line("ok", "ALICE", "2024-03-10T10:00:00Z", "SELECT", "SUCCESS"),
                "{not json");

        assertThatThrownBy(() -> new JsonLinesQueryLogSource(file).fetch(START, END, QueryLogFilter.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(file + ":2");
    }

    @Test
    @DisplayName("Should fail with file and line on a null record")
    void shouldFailOnNullLine() throws IOException {
        Path file = write(
                line("ok", "ALICE", "2024-03-10T10:00:00Z", "SELECT", "SUCCESS"),
                "null");

        assertThatThrownBy(() -> new JsonLinesQueryLogSource(file).fetch(START, END, QueryLogFilter.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed query record at " + file + ":2");
    }

    @Test
    @DisplayName("Should fail on a record missing required fields")
    void shouldFailOnIncompleteRecord() throws IOException {
        Path file = write("{\"userName\":\"ALICE\",\"queryId\":\"q1\"}");

        assertThatThrownBy(() -> new JsonLinesQueryLogSource(file).fetch(START, END, QueryLogFilter.defaults()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed query record");
    }

    @Test
    @DisplayName("Should propagate a missing file as an unchecked I/O error")
    void shouldFailOnMissingFile() {
        JsonLinesQueryLogSource source = new JsonLinesQueryLogSource(dir.resolve("missing.jsonl"));

        assertThatThrownBy(() -> source.fetch(START, END, QueryLogFilter.defaults()))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("missing.jsonl");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path write(String... lines) throws IOException {
        Path file = dir.resolve("history.jsonl");
        Files.write(file, List.of(lines));
        return file;
    }

    private static String line(String id, String user, String start, String type, String status) {
        return "{\"userName\":\"" + user + "\",\"queryId\":\"" + id + "\",\"startTime\":\"" + start
                + "\",\"queryText\":\"SELECT 1\",\"executionStatus\":\"" + status
                + "\",\"queryType\":\"" + type + "\"}";
    }
}
