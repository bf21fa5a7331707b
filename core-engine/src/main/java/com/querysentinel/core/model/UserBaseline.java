package com.querysentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Statistical profile of one user's historical query activity.
 *
 * <p>
 * A baseline is only valid for the run that produced it and is never cached
 * across runs.
 * </p>
 *
 * @since 1.0.0
 */
public final class UserBaseline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String userName;

    /** Number of historical queries the profile was built from. */
    private final int queryCount;

    private final double hourP05;
    private final double hourP95;
    private final double avgLength;
    private final double stddevLength;

    /** Distinct table names seen in the historical window. */
    private final Set<String> commonTables;

    private UserBaseline(Builder builder) {
        this.userName = Objects.requireNonNull(builder.userName, "userName must not be null");
        this.queryCount = builder.queryCount;
        this.hourP05 = builder.hourP05;
        this.hourP95 = builder.hourP95;
        this.avgLength = builder.avgLength;
        this.stddevLength = builder.stddevLength;
        this.commonTables = Collections.unmodifiableSet(new TreeSet<>(builder.commonTables));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String userName;
        private int queryCount;
        private double hourP05;
        private double hourP95;
        private double avgLength;
        private double stddevLength;
        private Set<String> commonTables = Collections.emptySet();

        public Builder userName(String userName) {
            this.userName = userName;
            return this;
        }

        public Builder queryCount(int queryCount) {
            this.queryCount = queryCount;
            return this;
        }

        public Builder hourP05(double hourP05) {
            this.hourP05 = hourP05;
            return this;
        }

        public Builder hourP95(double hourP95) {
            this.hourP95 = hourP95;
            return this;
        }

        public Builder avgLength(double avgLength) {
            this.avgLength = avgLength;
            return this;
        }

        public Builder stddevLength(double stddevLength) {
            this.stddevLength = stddevLength;
            return this;
        }

        public Builder commonTables(Set<String> commonTables) {
            this.commonTables = Objects.requireNonNull(commonTables, "commonTables must not be null");
            return this;
        }

        public UserBaseline build() {
            return new UserBaseline(this);
        }
    }

    public String getUserName() {
        return userName;
    }

    public int getQueryCount() {
        return queryCount;
    }

    public double getHourP05() {
        return hourP05;
    }

    public double getHourP95() {
        return hourP95;
    }

    public double getAvgLength() {
        return avgLength;
    }

    public double getStddevLength() {
        return stddevLength;
    }

    /**
     * @return unmodifiable set of table names
     */
    public Set<String> getCommonTables() {
        return commonTables;
    }

    /**
     * @param table table name to test
     * @return {@code true} if the table was accessed in the historical window
     */
    public boolean isCommonTable(String table) {
        return commonTables.contains(table);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof UserBaseline that))
            return false;
        return queryCount == that.queryCount
                && Double.compare(hourP05, that.hourP05) == 0
                && Double.compare(hourP95, that.hourP95) == 0
                && Double.compare(avgLength, that.avgLength) == 0
                && Double.compare(stddevLength, that.stddevLength) == 0
                && userName.equals(that.userName)
                && commonTables.equals(that.commonTables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userName, queryCount, hourP05, hourP95, avgLength, stddevLength, commonTables);
    }

    @Override
    public String toString() {
        return "UserBaseline{" +
                "userName='" + userName + '\'' +
                ", queryCount=" + queryCount +
                ", hourP05=" + hourP05 +
                ", hourP95=" + hourP95 +
                ", avgLength=" + avgLength +
                ", stddevLength=" + stddevLength +
                ", commonTables=" + commonTables +
                '}';
    }
}
