package com.querysentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.querysentinel.core.config.QueryLogFilter;
import com.querysentinel.core.model.QueryRecord;
import com.querysentinel.core.source.QueryLogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link QueryLogSource} backed by a JSON-lines export of the query history.
 *
 * <p>
 * Each non-blank line holds one record, e.g.
 * </p>
 *
 * <pre>
 * {"userName":"ALICE","queryId":"01a2","startTime":"2024-05-01T17:03:00Z",
 *  "queryText":"SELECT * FROM orders","executionStatus":"SUCCESS","queryType":"SELECT"}
 * </pre>
 *
 * <p>
 * The file is re-read on every fetch so that two fetches see the same
 * snapshot only if the file is unchanged. A malformed line aborts the fetch
 * with an {@link IllegalStateException} naming the file and line; nothing is
 * skipped silently.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesQueryLogSource implements QueryLogSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesQueryLogSource.class);

    private final Path path;
    private final ObjectMapper mapper = JsonMapper.create();

    /**
     * @param path JSON-lines file; must not be {@code null}
     */
    public JsonLinesQueryLogSource(Path path) {
        this.path = Objects.requireNonNull(path, "Query log path must not be null");
    }

    @Override
    public List<QueryRecord> fetch(Instant windowStart, Instant windowEnd, QueryLogFilter filter) {
        Objects.requireNonNull(windowStart, "windowStart must not be null");
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        Objects.requireNonNull(filter, "filter must not be null");

        List<QueryRecord> records = new ArrayList<>();
        int lineNumber = 0;
        int total = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                total++;
                QueryRecord record = parse(line, lineNumber);
                Instant start = record.getStartTime();
                if (!start.isBefore(windowStart) && start.isBefore(windowEnd) && filter.matches(record)) {
                    records.add(record);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read query log " + path, e);
        }

        LOG.info("Fetched {} of {} record(s) from {} for window [{}, {})",
                records.size(), total, path, windowStart, windowEnd);
        return records;
    }

    public Path getPath() {
        return path;
    }

    private QueryRecord parse(String line, int lineNumber) {
        QueryRecord record;
        try {
            record = mapper.readValue(line, QueryRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Malformed query record at " + path + ":" + lineNumber + ": " + e.getOriginalMessage(), e);
        }
        // a bare JSON null binds to no record
        if (record == null) {
            throw new IllegalStateException(
                    "Malformed query record at " + path + ":" + lineNumber + ": expected a JSON object");
        }
        return record;
    }
}
