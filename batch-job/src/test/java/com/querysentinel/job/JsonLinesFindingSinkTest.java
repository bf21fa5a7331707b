package com.querysentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querysentinel.core.model.AnomalyFinding;
import com.querysentinel.core.model.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link JsonLinesFindingSink}.
 */
class JsonLinesFindingSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Should write one JSON object per finding with ISO timestamps")
    void shouldWriteJsonLines() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        JsonLinesFindingSink.toStream(out).deliver(List.of(
                finding("q2", AnomalyType.TABLE_ACCESS, "Accessed table shadow_table which is not in commonly accessed tables"),
                finding("q1", AnomalyType.TIME_OF_DAY, "Query executed at hour 23 outside normal hours (2 to 22)")));

        String written = out.toString(StandardCharsets.UTF_8);
        assertThat(written).doesNotContain("\r").endsWith("}\n");
        List<String> lines = written.lines().toList();
        assertThat(lines).hasSize(2);

        JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.get("userName").asText()).isEqualTo("ALICE");
        assertThat(first.get("queryId").asText()).isEqualTo("q2");
        assertThat(first.get("startTime").asText()).isEqualTo("2024-05-01T23:15:00Z");
        assertThat(first.get("anomalyType").asText()).isEqualTo("TABLE_ACCESS");
        assertThat(first.get("anomalyLabel").asText()).isEqualTo("Unusual table access");
        assertThat(first.get("anomalyDetails").asText()).contains("shadow_table");
        assertThat(mapper.readTree(lines.get(1)).get("queryId").asText()).isEqualTo("q1");
    }

    @Test
    @DisplayName("Should create the output file and its directories")
    void shouldWriteFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("out/findings.jsonl");

        JsonLinesFindingSink.toFile(file).deliver(List.of(finding("q1", AnomalyType.COMPLEXITY, "details")));

        assertThat(Files.readAllLines(file)).hasSize(1);
    }

    @Test
    @DisplayName("Should write an empty file when there are no findings")
    void shouldWriteEmptyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("findings.jsonl");

        JsonLinesFindingSink.toFile(file).deliver(List.of());

        assertThat(file).exists().isEmptyFile();
    }

    private static AnomalyFinding finding(String queryId, AnomalyType type, String details) {
        return AnomalyFinding.builder()
                .userName("ALICE")
                .queryId(queryId)
                .startTime(Instant.parse("2024-05-01T23:15:00Z"))
                .queryText("SELECT * FROM shadow_table")
                .anomalyType(type)
                .anomalyDetails(details)
                .build();
    }
}
