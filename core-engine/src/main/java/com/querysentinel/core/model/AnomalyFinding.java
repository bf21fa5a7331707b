package com.querysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One recent query flagged as deviating from its user's baseline.
 *
 * <p>
 * Findings are produced fresh by every run and carry no identity beyond the
 * values they report. Serialized to JSON by the batch job's finding sink.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code userName}, {@code queryId},
 * {@code startTime} and {@code anomalyType} are required; omitting any of
 * them throws a {@link NullPointerException} at build time.
 * </p>
 *
 * <p>
 * The report label of the anomaly type is derived and written out as
 * {@code anomalyLabel}; it is ignored when reading a finding back.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(value = {"anomalyLabel"}, allowGetters = true)
public class AnomalyFinding implements Serializable {

    private static final long serialVersionUID = 1L;

    private String userName;
    private String queryId;
    private Instant startTime;
    private String queryText;
    private AnomalyType anomalyType;

    /** Human-readable explanation of the deviation. */
    private String anomalyDetails;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public AnomalyFinding() {
    }

    private AnomalyFinding(Builder builder) {
        this.userName = Objects.requireNonNull(builder.userName, "userName must not be null");
        this.queryId = Objects.requireNonNull(builder.queryId, "queryId must not be null");
        this.startTime = Objects.requireNonNull(builder.startTime, "startTime must not be null");
        this.queryText = builder.queryText;
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.anomalyDetails = builder.anomalyDetails;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-populated with the identity of the given query.
     *
     * @param query the flagged query; must not be {@code null}
     * @return builder instance
     */
    public static Builder forQuery(QueryRecord query) {
        Objects.requireNonNull(query, "query must not be null");
        return new Builder()
                .userName(query.getUserName())
                .queryId(query.getQueryId())
                .startTime(query.getStartTime())
                .queryText(query.getQueryText());
    }

    public static class Builder {
        private String userName;
        private String queryId;
        private Instant startTime;
        private String queryText;
        private AnomalyType anomalyType;
        private String anomalyDetails;

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

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder anomalyDetails(String anomalyDetails) {
            this.anomalyDetails = anomalyDetails;
            return this;
        }

        /**
         * @return a new {@link AnomalyFinding}
         * @throws NullPointerException if a required field is missing
         */
        public AnomalyFinding build() {
            return new AnomalyFinding(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getUserName() {
        return userName;
    }

    public void setUserName(String userName) {
        this.userName = userName;
    }

    public String getQueryId() {
        return queryId;
    }

    public void setQueryId(String queryId) {
        this.queryId = queryId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public void setAnomalyType(AnomalyType anomalyType) {
        this.anomalyType = anomalyType;
    }

    /**
     * @return report label of the anomaly type, e.g. "Unusual query hour",
     *         or {@code null} if no type is set
     */
    public String getAnomalyLabel() {
        return anomalyType == null ? null : anomalyType.getLabel();
    }

    public String getAnomalyDetails() {
        return anomalyDetails;
    }

    public void setAnomalyDetails(String anomalyDetails) {
        this.anomalyDetails = anomalyDetails;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyFinding that))
            return false;
        return Objects.equals(userName, that.userName)
                && Objects.equals(queryId, that.queryId)
                && Objects.equals(startTime, that.startTime)
                && Objects.equals(queryText, that.queryText)
                && anomalyType == that.anomalyType
                && Objects.equals(anomalyDetails, that.anomalyDetails);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userName, queryId, startTime, queryText, anomalyType, anomalyDetails);
    }

    @Override
    public String toString() {
        return "AnomalyFinding{" +
                "userName='" + userName + '\'' +
                ", queryId='" + queryId + '\'' +
                ", startTime=" + startTime +
                ", anomalyType=" + anomalyType +
                ", anomalyDetails='" + anomalyDetails + '\'' +
                '}';
    }
}
