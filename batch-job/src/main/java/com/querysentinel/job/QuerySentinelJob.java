package com.querysentinel.job;

import com.querysentinel.core.config.DetectionConfig;
import com.querysentinel.core.config.DetectionConfigLoader;
import com.querysentinel.core.model.AnomalyFinding;
import com.querysentinel.core.pipeline.DetectionPipeline;
import com.querysentinel.core.source.QueryLogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main entry point for the Query Sentinel batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON-lines query history
 *     → historical window → per-user baselines
 *     → recent window     → activity features
 *     → time-of-day / complexity / table-access detectors
 *     → ordered findings → JSON lines (file or stdout)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings come from environment variables via {@link JobConfig};
 * detection settings from YAML via {@link DetectionConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuerySentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(QuerySentinelJob.class);

    private QuerySentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load job configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting Query Sentinel with config: {}", config);

        // 2. Run detection and deliver findings
        List<AnomalyFinding> findings = run(config, Clock.systemUTC());
        LOG.info("Query Sentinel finished with {} finding(s)", findings.size());
    }

    /**
     * Execute one detection run.
     *
     * @param config job configuration
     * @param clock  clock used when no fixed run instant is configured
     * @return the delivered findings, in report order
     * @throws IOException if the findings cannot be written
     */
    static List<AnomalyFinding> run(JobConfig config, Clock clock) throws IOException {
        DetectionConfig detectionConfig = loadDetectionConfig(config);
        QueryLogSource source = new JsonLinesQueryLogSource(config.getQueryLogPath());
        FindingSink sink = config.getFindingsOutputPath()
                .<FindingSink>map(JsonLinesFindingSink::toFile)
                .orElseGet(() -> JsonLinesFindingSink.toStream(System.out));
        Instant asOf = config.getRunAsOf().orElseGet(clock::instant);

        ExecutorService executor = newWorkerPool(config.getWorkerThreads());
        try {
            List<AnomalyFinding> findings = new DetectionPipeline(detectionConfig, executor).run(source, asOf);
            sink.deliver(findings);
            return findings;
        } finally {
            executor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static DetectionConfig loadDetectionConfig(JobConfig config) {
        return config.getDetectionConfigPath()
                .map(DetectionConfigLoader::fromFile)
                .orElseGet(DetectionConfigLoader::load);
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "detection-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
