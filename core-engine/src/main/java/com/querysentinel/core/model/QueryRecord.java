package com.querysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One completed query taken from the query history.
 *
 * <p>
 * Instances are immutable. Use the {@link Builder}; {@code userName},
 * {@code queryId}, {@code startTime} and {@code queryText} are required.
 * The execution metadata ({@code warehouseName}, {@code bytesScanned},
 * {@code executionTimeMs}) is informational and never used for detection.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = QueryRecord.Builder.class)
public final class QueryRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String userName;
    private final String queryId;

    /** Start of execution, always UTC. */
    private final Instant startTime;

    private final String queryText;
    private final String executionStatus;
    private final String queryType;

    // Optional execution metadata
    private final String warehouseName;
    private final Long bytesScanned;
    private final Long executionTimeMs;

    private QueryRecord(Builder builder) {
        this.userName = Objects.requireNonNull(builder.userName, "userName must not be null");
        this.queryId = Objects.requireNonNull(builder.queryId, "queryId must not be null");
        this.startTime = Objects.requireNonNull(builder.startTime, "startTime must not be null");
        this.queryText = Objects.requireNonNull(builder.queryText, "queryText must not be null");
        this.executionStatus = builder.executionStatus;
        this.queryType = builder.queryType;
        this.warehouseName = builder.warehouseName;
        this.bytesScanned = builder.bytesScanned;
        this.executionTimeMs = builder.executionTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link QueryRecord}. Also used by Jackson when
     * reading records from JSON.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String userName;
        private String queryId;
        private Instant startTime;
        private String queryText;
        private String executionStatus;
        private String queryType;
        private String warehouseName;
        private Long bytesScanned;
        private Long executionTimeMs;

        public Builder userName(String userName) {
            this.userName = userName;
            return this;
        }

        public Builder queryId(String queryId) {
            this.queryId = queryId;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder queryText(String queryText) {
            this.queryText = queryText;
            return this;
        }

        public Builder executionStatus(String executionStatus) {
            this.executionStatus = executionStatus;
            return this;
        }

        public Builder queryType(String queryType) {
            this.queryType = queryType;
            return this;
        }

        public Builder warehouseName(String warehouseName) {
            this.warehouseName = warehouseName;
            return this;
        }

        public Builder bytesScanned(Long bytesScanned) {
            this.bytesScanned = bytesScanned;
            return this;
        }

        public Builder executionTimeMs(Long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        /**
         * @return a new {@link QueryRecord}
         * @throws NullPointerException if a required field is missing
         */
        public QueryRecord build() {
            return new QueryRecord(this);
        }
    }

    public String getUserName() {
        return userName;
    }

    public String getQueryId() {
        return queryId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public String getQueryText() {
        return queryText;
    }

    public String getExecutionStatus() {
        return executionStatus;
    }

    public String getQueryType() {
        return queryType;
    }

    public String getWarehouseName() {
        return warehouseName;
    }

    public Long getBytesScanned() {
        return bytesScanned;
    }

    public Long getExecutionTimeMs() {
        return executionTimeMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QueryRecord that))
            return false;
        return Objects.equals(userName, that.userName)
                && Objects.equals(queryId, that.queryId)
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(queryText, that.queryText)
                && Objects.equals(executionStatus, that.executionStatus)
                && Objects.equals(queryType, that.queryType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userName, queryId, startTime, queryText, executionStatus, queryType);
    }

    @Override
    public String toString() {
        return "QueryRecord{" +
                "userName='" + userName + '\'' +
                ", queryId='" + queryId + '\'' +
                ", startTime=" + startTime +
                ", queryType='" + queryType + '\'' +
                ", executionStatus='" + executionStatus + '\'' +
                '}';
    }
}
