package com.querysentinel.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querysentinel.core.model.AnomalyFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link FindingSink} that writes one JSON object per finding, one per line.
 *
 * <p>
 * Writes either to a file (created or truncated) or to a caller-owned
 * stream such as {@code System.out}, which is flushed but not closed.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonLinesFindingSink implements FindingSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesFindingSink.class);

    private final Path path;
    private final OutputStream stream;
    private final ObjectMapper mapper = JsonMapper.create();

    private JsonLinesFindingSink(Path path, OutputStream stream) {
        this.path = path;
        this.stream = stream;
    }

    /**
     * @param path output file; must not be {@code null}
     * @return sink writing to {@code path}
     */
    public static JsonLinesFindingSink toFile(Path path) {
        return new JsonLinesFindingSink(Objects.requireNonNull(path, "Output path must not be null"), null);
    }

    /**
     * @param stream caller-owned stream; must not be {@code null}
     * @return sink writing to {@code stream}
     */
    public static JsonLinesFindingSink toStream(OutputStream stream) {
        return new JsonLinesFindingSink(null, Objects.requireNonNull(stream, "Output stream must not be null"));
    }

    @Override
    public void deliver(List<AnomalyFinding> findings) throws IOException {
        Objects.requireNonNull(findings, "findings must not be null");
        if (path != null) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                write(writer, findings);
            }
            LOG.info("Wrote {} finding(s) to {}", findings.size(), path);
        } else {
            Writer writer = new OutputStreamWriter(stream, StandardCharsets.UTF_8);
            write(writer, findings);
            writer.flush();
            LOG.info("Wrote {} finding(s) to output stream", findings.size());
        }
    }

    private void write(Writer writer, List<AnomalyFinding> findings) throws IOException {
        for (AnomalyFinding finding : findings) {
            writer.write(mapper.writeValueAsString(finding));
            writer.write('\n');
        }
    }
}
