package com.querysentinel.core.baseline;

import com.querysentinel.core.extract.ActivityExtractor;
import com.querysentinel.core.extract.LocalHours;
import com.querysentinel.core.extract.TableNameExtractor;
import com.querysentinel.core.model.QueryRecord;
import com.querysentinel.core.model.UserBaseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds one {@link UserBaseline} per sufficiently active user from the
 * queries of the historical window.
 *
 * <h3>Profile</h3>
 * <ul>
 * <li>5th and 95th percentile of the local query hour
 * ({@link Statistics#percentileCont})</li>
 * <li>mean and sample standard deviation of the query length</li>
 * <li>distinct tables found by {@link TableNameExtractor}</li>
 * </ul>
 *
 * <p>
 * Users with fewer than {@code minimumActivity} queries get no baseline and
 * are therefore never evaluated.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineBuilder.class);

    static final double LOWER_HOUR_PERCENTILE = 0.05;
    static final double UPPER_HOUR_PERCENTILE = 0.95;

    private final ZoneId timezone;
    private final int minimumActivity;

    /**
     * @param timezone        reference timezone for local hours
     * @param minimumActivity minimum queries per user, at least 2
     * @throws IllegalArgumentException if {@code minimumActivity} is below 2
     */
    public BaselineBuilder(ZoneId timezone, int minimumActivity) {
        this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
        if (minimumActivity < 2) {
            throw new IllegalArgumentException("minimumActivity must be >= 2, got: " + minimumActivity);
        }
        this.minimumActivity = minimumActivity;
    }

    /**
     * @param historical queries of the historical window; must not be
     *                   {@code null}
     * @return unmodifiable map of user name to baseline, sorted by user name
     */
    public Map<String, UserBaseline> build(List<QueryRecord> historical) {
        Objects.requireNonNull(historical, "historical records must not be null");

        Map<String, List<QueryRecord>> byUser = historical.stream()
                .collect(Collectors.groupingBy(QueryRecord::getUserName, TreeMap::new, Collectors.toList()));

        Map<String, UserBaseline> baselines = new TreeMap<>();
        for (Map.Entry<String, List<QueryRecord>> entry : byUser.entrySet()) {
            List<QueryRecord> queries = entry.getValue();
            if (queries.size() < minimumActivity) {
                LOG.trace("User [{}] has {} quer(ies) < {} – no baseline",
                        entry.getKey(), queries.size(), minimumActivity);
                continue;
            }
            baselines.put(entry.getKey(), buildFor(entry.getKey(), queries));
        }

        if (historical.isEmpty()) {
            LOG.warn("Historical window is empty – no baselines built");
        }
        LOG.info("Built {} baseline(s) from {} quer(ies) across {} user(s)",
                baselines.size(), historical.size(), byUser.size());
        return Collections.unmodifiableMap(baselines);
    }

    /**
     * Build the profile of a single user without applying the activity
     * threshold.
     *
     * @param userName the user
     * @param queries  the user's historical queries; at least two
     * @return the baseline
     */
    UserBaseline buildFor(String userName, List<QueryRecord> queries) {
        int n = queries.size();
        double[] hours = new double[n];
        double[] lengths = new double[n];
        Set<String> tables = new HashSet<>();

        for (int i = 0; i < n; i++) {
            QueryRecord q = queries.get(i);
            hours[i] = LocalHours.hourOf(q.getStartTime(), timezone);
            lengths[i] = ActivityExtractor.lengthOf(q.getQueryText());
            String table = TableNameExtractor.extract(q.getQueryText());
            if (table != null && !table.isEmpty()) {
                tables.add(table);
            }
        }

        double avgLength = Statistics.mean(lengths);
        UserBaseline baseline = UserBaseline.builder()
                .userName(userName)
                .queryCount(n)
                .hourP05(Statistics.percentileCont(hours, LOWER_HOUR_PERCENTILE))
                .hourP95(Statistics.percentileCont(hours, UPPER_HOUR_PERCENTILE))
                .avgLength(avgLength)
                .stddevLength(Statistics.sampleStdDev(lengths, avgLength))
                .commonTables(tables)
                .build();
        LOG.debug("Baseline for [{}]: {}", userName, baseline);
        return baseline;
    }
}
