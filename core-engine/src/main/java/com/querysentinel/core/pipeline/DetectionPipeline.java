package com.querysentinel.core.pipeline;

import com.querysentinel.core.baseline.BaselineBuilder;
import com.querysentinel.core.config.DetectionConfig;
import com.querysentinel.core.detection.AnomalyDetector;
import com.querysentinel.core.detection.DetectorFactory;
import com.querysentinel.core.detection.FindingAggregator;
import com.querysentinel.core.extract.ActivityExtractor;
import com.querysentinel.core.model.ActivityRecord;
import com.querysentinel.core.model.AnomalyFinding;
import com.querysentinel.core.model.QueryRecord;
import com.querysentinel.core.model.UserBaseline;
import com.querysentinel.core.source.QueryLogSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * One detection run: baselines from the historical window, features from the
 * recent window, every detector over every recent query, ordered findings.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   QueryLogSource
 *     ├─ historical window → BaselineBuilder  ─┐
 *     └─ recent window     → ActivityExtractor ─┤
 *                                              → detectors (per query × per type)
 *                                              → FindingAggregator
 * </pre>
 *
 * <p>
 * The two branches share no data and are submitted to the supplied
 * {@link Executor}; with a direct executor they run one after the other.
 * Nothing is retained between runs.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionPipeline.class);

    private final DetectionConfig config;
    private final BaselineBuilder baselineBuilder;
    private final ActivityExtractor activityExtractor;
    private final List<AnomalyDetector> detectors;
    private final Executor executor;

    /**
     * Pipeline that runs both branches on the calling thread.
     *
     * @param config run configuration
     */
    public DetectionPipeline(DetectionConfig config) {
        this(config, Runnable::run);
    }

    /**
     * @param config   run configuration; must not be {@code null}
     * @param executor executor for the historical and recent branches; must
     *                 not be {@code null}
     */
    public DetectionPipeline(DetectionConfig config, Executor executor) {
        this.config = Objects.requireNonNull(config, "DetectionConfig must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
        this.baselineBuilder = new BaselineBuilder(config.getTimezone(), config.getMinimumActivity());
        this.activityExtractor = new ActivityExtractor(config.getTimezone());
        this.detectors = DetectorFactory.createAll(config);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Fetch both windows ending at {@code asOf} and evaluate them.
     *
     * @param source query history; must not be {@code null}
     * @param asOf   end of both windows (exclusive); must not be {@code null}
     * @return ordered, unmodifiable findings
     * @throws RuntimeException whatever the source throws, unchanged
     */
    public List<AnomalyFinding> run(QueryLogSource source, Instant asOf) {
        Objects.requireNonNull(source, "QueryLogSource must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");

        Instant historicalStart = asOf.minus(config.getHistoricalWindow());
        Instant recentStart = asOf.minus(config.getRecentWindow());
        LOG.info("Detection run as of {}: historical window [{}, {}), recent window [{}, {})",
                asOf, historicalStart, asOf, recentStart, asOf);

        CompletableFuture<Map<String, UserBaseline>> baselines = CompletableFuture.supplyAsync(
                () -> baselineBuilder.build(source.fetch(historicalStart, asOf, config.getFilter())),
                executor);
        CompletableFuture<List<ActivityRecord>> activity = CompletableFuture.supplyAsync(
                () -> activityExtractor.extract(source.fetch(recentStart, asOf, config.getFilter())),
                executor);

        return evaluate(join(baselines), join(activity));
    }

    /**
     * Evaluate two in-memory snapshots.
     *
     * @param historical queries of the historical window
     * @param recent     queries of the recent window
     * @return ordered, unmodifiable findings
     */
    public List<AnomalyFinding> detect(List<QueryRecord> historical, List<QueryRecord> recent) {
        Objects.requireNonNull(historical, "historical records must not be null");
        Objects.requireNonNull(recent, "recent records must not be null");
        return evaluate(baselineBuilder.build(historical), activityExtractor.extract(recent));
    }

    public DetectionConfig getConfig() {
        return config;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<AnomalyFinding> evaluate(Map<String, UserBaseline> baselines, List<ActivityRecord> activity) {
        List<List<AnomalyFinding>> perDetector = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            List<AnomalyFinding> found = new ArrayList<>();
            for (ActivityRecord record : activity) {
                // Users without a baseline are not evaluated
                UserBaseline baseline = baselines.get(record.getUserName());
                if (baseline != null) {
                    detector.evaluate(record, baseline).ifPresent(found::add);
                }
            }
            LOG.info("Detector [{}] produced {} finding(s)", detector.getType(), found.size());
            perDetector.add(found);
        }

        List<AnomalyFinding> findings = FindingAggregator.aggregate(perDetector);
        LOG.info("Detection run produced {} finding(s) for {} recent quer(ies)",
                findings.size(), activity.size());
        return findings;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
