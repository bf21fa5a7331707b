package com.querysentinel.core.source;

import com.querysentinel.core.config.QueryLogFilter;
import com.querysentinel.core.model.QueryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Supplier of query history.
 *
 * <p>
 * Implementations return every record whose start time lies in
 * {@code [windowStart, windowEnd)} and that satisfies the filter. Failures
 * (unreachable store, malformed record) surface as unchecked exceptions and
 * are propagated to the caller unchanged; the detection pipeline neither
 * retries nor recovers.
 * </p>
 *
 * @since 1.0.0
 */
public interface QueryLogSource {

    /**
     * @param windowStart inclusive lower bound
     * @param windowEnd   exclusive upper bound
     * @param filter      selection criteria
     * @return the matching records, in any order
     */
    List<QueryRecord> fetch(Instant windowStart, Instant windowEnd, QueryLogFilter filter);
}
