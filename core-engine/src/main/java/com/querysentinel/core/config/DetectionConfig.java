package com.querysentinel.core.config;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of one detection run.
 *
 * <p>
 * Use {@link #defaults()} or the {@link Builder}. The builder validates every
 * value at {@link Builder#build()} time and reports all problems at once.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_TIMEZONE = "America/Los_Angeles";
    public static final Duration DEFAULT_HISTORICAL_WINDOW = Duration.ofDays(30);
    public static final Duration DEFAULT_RECENT_WINDOW = Duration.ofHours(24);
    public static final int DEFAULT_MINIMUM_ACTIVITY = 20;
    public static final double DEFAULT_DEVIATION_MULTIPLIER = 3.0;

    private final ZoneId timezone;
    private final Duration historicalWindow;
    private final Duration recentWindow;
    private final int minimumActivity;
    private final double deviationMultiplier;
    private final QueryLogFilter filter;

    private DetectionConfig(Builder b) {
        this.timezone = ZoneId.of(b.timezone);
        this.historicalWindow = b.historicalWindow;
        this.recentWindow = b.recentWindow;
        this.minimumActivity = b.minimumActivity;
        this.deviationMultiplier = b.deviationMultiplier;
        this.filter = b.filter;
    }

    /**
     * @return configuration with every default applied
     */
    public static DetectionConfig defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return reference timezone used to derive local hours
     */
    public ZoneId getTimezone() {
        return timezone;
    }

    public Duration getHistoricalWindow() {
        return historicalWindow;
    }

    public Duration getRecentWindow() {
        return recentWindow;
    }

    /**
     * @return minimum number of historical queries a user needs for a baseline
     */
    public int getMinimumActivity() {
        return minimumActivity;
    }

    /**
     * @return number of standard deviations a query length may stray from the
     *         mean before it is flagged
     */
    public double getDeviationMultiplier() {
        return deviationMultiplier;
    }

    public QueryLogFilter getFilter() {
        return filter;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link DetectionConfig}.
     */
    public static class Builder {
        private String timezone = DEFAULT_TIMEZONE;
        private Duration historicalWindow = DEFAULT_HISTORICAL_WINDOW;
        private Duration recentWindow = DEFAULT_RECENT_WINDOW;
        private int minimumActivity = DEFAULT_MINIMUM_ACTIVITY;
        private double deviationMultiplier = DEFAULT_DEVIATION_MULTIPLIER;
        private QueryLogFilter filter = QueryLogFilter.defaults();

        public Builder timezone(String v) {
            this.timezone = v;
            return this;
        }

        public Builder historicalWindow(Duration v) {
            this.historicalWindow = v;
            return this;
        }

        public Builder recentWindow(Duration v) {
            this.recentWindow = v;
            return this;
        }

        public Builder minimumActivity(int v) {
            this.minimumActivity = v;
            return this;
        }

        public Builder deviationMultiplier(double v) {
            this.deviationMultiplier = v;
            return this;
        }

        public Builder filter(QueryLogFilter v) {
            this.filter = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link DetectionConfig}
         * @throws IllegalStateException if one or more values are invalid
         */
        public DetectionConfig build() {
            List<String> errors = new ArrayList<>();

            if (timezone == null || timezone.isBlank()) {
                errors.add("'timezone' is required");
            } else {
                try {
                    ZoneId.of(timezone);
                } catch (DateTimeException e) {
                    errors.add("Unknown timezone: '" + timezone + "'");
                }
            }
            if (historicalWindow == null || historicalWindow.isNegative() || historicalWindow.isZero()) {
                errors.add("'historicalWindow' must be a positive duration, got: " + historicalWindow);
            }
            if (recentWindow == null || recentWindow.isNegative() || recentWindow.isZero()) {
                errors.add("'recentWindow' must be a positive duration, got: " + recentWindow);
            }
            if (historicalWindow != null && recentWindow != null
                    && recentWindow.compareTo(historicalWindow) > 0) {
                errors.add("'recentWindow' (" + recentWindow
                        + ") must not be longer than 'historicalWindow' (" + historicalWindow + ")");
            }
            // Sample standard deviation is undefined below two observations
            if (minimumActivity < 2) {
                errors.add("'minimumActivity' must be >= 2, got: " + minimumActivity);
            }
            if (!(deviationMultiplier > 0)) {
                errors.add("'deviationMultiplier' must be > 0, got: " + deviationMultiplier);
            }
            if (filter == null) {
                errors.add("'filter' is required");
            }

            if (!errors.isEmpty()) {
                throw new IllegalStateException(
                        "Invalid detection configuration: " + String.join("; ", errors));
            }
            return new DetectionConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionConfig that))
            return false;
        return minimumActivity == that.minimumActivity
                && Double.compare(deviationMultiplier, that.deviationMultiplier) == 0
                && timezone.equals(that.timezone)
                && historicalWindow.equals(that.historicalWindow)
                && recentWindow.equals(that.recentWindow)
                && filter.equals(that.filter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timezone, historicalWindow, recentWindow, minimumActivity,
                deviationMultiplier, filter);
    }

    @Override
    public String toString() {
        return "DetectionConfig{" +
                "timezone=" + timezone +
                ", historicalWindow=" + historicalWindow +
                ", recentWindow=" + recentWindow +
                ", minimumActivity=" + minimumActivity +
                ", deviationMultiplier=" + deviationMultiplier +
                ", filter=" + filter +
                '}';
    }
}
