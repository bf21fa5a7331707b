package com.querysentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * A recent query enriched with the features the detectors evaluate.
 *
 * @since 1.0.0
 */
public final class ActivityRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final QueryRecord query;
    private final int queryHour;
    private final int queryLength;

    /** May be {@code null} when no table could be extracted. */
    private final String tableAccessed;

    /**
     * @param query         the source record; must not be {@code null}
     * @param queryHour     local hour of day, 0-23
     * @param queryLength   character length of the query text
     * @param tableAccessed extracted table name, or {@code null}
     */
    public ActivityRecord(QueryRecord query, int queryHour, int queryLength, String tableAccessed) {
        this.query = Objects.requireNonNull(query, "query must not be null");
        if (queryHour < 0 || queryHour > 23) {
            throw new IllegalArgumentException("queryHour must be in [0, 23], got: " + queryHour);
        }
        this.queryHour = queryHour;
        this.queryLength = queryLength;
        this.tableAccessed = tableAccessed;
    }

    public QueryRecord getQuery() {
        return query;
    }

    public String getUserName() {
        return query.getUserName();
    }

    public int getQueryHour() {
        return queryHour;
    }

    public int getQueryLength() {
        return queryLength;
    }

    public String getTableAccessed() {
        return tableAccessed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ActivityRecord that))
            return false;
        return queryHour == that.queryHour
                && queryLength == that.queryLength
                && query.equals(that.query)
                && Objects.equals(tableAccessed, that.tableAccessed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, queryHour, queryLength, tableAccessed);
    }

    @Override
    public String toString() {
        return "ActivityRecord{" +
                "queryId='" + query.getQueryId() + '\'' +
                ", userName='" + query.getUserName() + '\'' +
                ", queryHour=" + queryHour +
                ", queryLength=" + queryLength +
                ", tableAccessed='" + tableAccessed + '\'' +
                '}';
    }
}
