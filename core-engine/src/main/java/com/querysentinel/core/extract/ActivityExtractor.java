package com.querysentinel.core.extract;

import com.querysentinel.core.model.ActivityRecord;
import com.querysentinel.core.model.QueryRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Derives detection features from the queries of the recent window.
 *
 * <p>
 * For each record: the local hour in the reference timezone, the length of
 * the query text and the table found by {@link TableNameExtractor}. The
 * output preserves input order, one {@link ActivityRecord} per input record.
 * </p>
 *
 * @since 1.0.0
 */
public class ActivityExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ActivityExtractor.class);

    private final ZoneId timezone;

    /**
     * @param timezone reference timezone for local hours; must not be
     *                 {@code null}
     */
    public ActivityExtractor(ZoneId timezone) {
        this.timezone = Objects.requireNonNull(timezone, "timezone must not be null");
    }

    /**
     * @param recent queries of the recent window; must not be {@code null}
     * @return unmodifiable list of activity records
     */
    public List<ActivityRecord> extract(List<QueryRecord> recent) {
        Objects.requireNonNull(recent, "recent records must not be null");
        List<ActivityRecord> activity = recent.stream()
                .map(this::extract)
                .toList();
        LOG.info("Extracted features for {} recent quer(ies)", activity.size());
        return activity;
    }

    /**
     * @param record a single query; must not be {@code null}
     * @return the enriched record
     */
    public ActivityRecord extract(QueryRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String text = record.getQueryText();
        return new ActivityRecord(
                record,
                LocalHours.hourOf(record.getStartTime(), timezone),
                lengthOf(text),
                TableNameExtractor.extract(text));
    }

    /**
     * @param queryText query text; must not be {@code null}
     * @return number of characters (Unicode code points) in the text
     */
    public static int lengthOf(String queryText) {
        return queryText.codePointCount(0, queryText.length());
    }
}
