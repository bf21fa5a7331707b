package com.querysentinel.core.config;

import com.querysentinel.core.model.QueryRecord;

import java.io.Serializable;
import java.util.Objects;

/**
 * Selection criteria passed to the query log source: only successful
 * analytical reads that were not issued by the system account qualify.
 *
 * <p>
 * String comparisons are exact and case-sensitive.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueryLogFilter implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_QUERY_TYPE = "SELECT";
    public static final String DEFAULT_EXECUTION_STATUS = "SUCCESS";
    public static final String DEFAULT_EXCLUDED_USER = "SYSTEM";

    private final String queryType;
    private final String executionStatus;
    private final String excludedUser;

    /**
     * @param queryType       query type to keep
     * @param executionStatus execution status to keep
     * @param excludedUser    user whose queries are dropped
     */
    public QueryLogFilter(String queryType, String executionStatus, String excludedUser) {
        this.queryType = Objects.requireNonNull(queryType, "queryType must not be null");
        this.executionStatus = Objects.requireNonNull(executionStatus, "executionStatus must not be null");
        this.excludedUser = Objects.requireNonNull(excludedUser, "excludedUser must not be null");
    }

    /**
     * @return filter for {@code SELECT} queries with status {@code SUCCESS},
     *         excluding user {@code SYSTEM}
     */
    public static QueryLogFilter defaults() {
        return new QueryLogFilter(DEFAULT_QUERY_TYPE, DEFAULT_EXECUTION_STATUS, DEFAULT_EXCLUDED_USER);
    }

    /**
     * @param record the record to test; must not be {@code null}
     * @return {@code true} if the record satisfies every criterion
     */
    public boolean matches(QueryRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        return queryType.equals(record.getQueryType())
                && executionStatus.equals(record.getExecutionStatus())
                && !excludedUser.equals(record.getUserName());
    }

    public String getQueryType() {
        return queryType;
    }

    public String getExecutionStatus() {
        return executionStatus;
    }

    public String getExcludedUser() {
        return excludedUser;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueryLogFilter that))
            return false;
        return queryType.equals(that.queryType)
                && executionStatus.equals(that.executionStatus)
                && excludedUser.equals(that.excludedUser);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queryType, executionStatus, excludedUser);
    }

    @Override
    public String toString() {
        return "QueryLogFilter{" +
                "queryType='" + queryType + '\'' +
                ", executionStatus='" + executionStatus + '\'' +
                ", excludedUser='" + excludedUser + '\'' +
                '}';
    }
}
