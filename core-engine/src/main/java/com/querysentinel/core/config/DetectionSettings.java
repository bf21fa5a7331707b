package com.querysentinel.core.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the detection YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * timezone: America/Los_Angeles
 * historicalWindow: P30D
 * recentWindow: PT24H
 * minimumActivity: 20
 * deviationMultiplier: 3
 * filter:
 *   queryType: SELECT
 *   executionStatus: SUCCESS
 *   excludedUser: SYSTEM
 * </pre>
 *
 * <p>
 * Durations use ISO-8601 notation. Call {@link #toConfig()} to obtain the
 * validated {@link DetectionConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings {

    private String timezone = DetectionConfig.DEFAULT_TIMEZONE;
    private String historicalWindow = DetectionConfig.DEFAULT_HISTORICAL_WINDOW.toString();
    private String recentWindow = DetectionConfig.DEFAULT_RECENT_WINDOW.toString();
    private int minimumActivity = DetectionConfig.DEFAULT_MINIMUM_ACTIVITY;
    private double deviationMultiplier = DetectionConfig.DEFAULT_DEVIATION_MULTIPLIER;
    private FilterSettings filter = new FilterSettings();

    /**
     * Convert to a typed configuration.
     *
     * @return validated configuration
     * @throws IllegalStateException if any value is unparsable or invalid
     */
    public DetectionConfig toConfig() {
        List<String> errors = new ArrayList<>();
        Duration historical = parseDuration("historicalWindow", historicalWindow, errors);
        Duration recent = parseDuration("recentWindow", recentWindow, errors);
        FilterSettings f = filter != null ? filter : new FilterSettings();
        List<String> filterErrors = f.validate();
        errors.addAll(filterErrors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid detection configuration: " + String.join("; ", errors));
        }

        return DetectionConfig.builder()
                .timezone(timezone)
                .historicalWindow(historical)
                .recentWindow(recent)
                .minimumActivity(minimumActivity)
                .deviationMultiplier(deviationMultiplier)
                .filter(f.toFilter())
                .build();
    }

    private static Duration parseDuration(String name, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add("'" + name + "' is required");
            return null;
        }
        try {
            return Duration.parse(value.trim());
        } catch (DateTimeParseException e) {
            errors.add("'" + name + "' is not an ISO-8601 duration: '" + value + "'");
            return null;
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getHistoricalWindow() {
        return historicalWindow;
    }

    public void setHistoricalWindow(String historicalWindow) {
        this.historicalWindow = historicalWindow;
    }

    public String getRecentWindow() {
        return recentWindow;
    }

    public void setRecentWindow(String recentWindow) {
        this.recentWindow = recentWindow;
    }

    public int getMinimumActivity() {
        return minimumActivity;
    }

    public void setMinimumActivity(int minimumActivity) {
        this.minimumActivity = minimumActivity;
    }

    public double getDeviationMultiplier() {
        return deviationMultiplier;
    }

    public void setDeviationMultiplier(double deviationMultiplier) {
        this.deviationMultiplier = deviationMultiplier;
    }

    public FilterSettings getFilter() {
        return filter;
    }

    public void setFilter(FilterSettings filter) {
        this.filter = filter;
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "timezone='" + timezone + '\'' +
                ", historicalWindow='" + historicalWindow + '\'' +
                ", recentWindow='" + recentWindow + '\'' +
                ", minimumActivity=" + minimumActivity +
                ", deviationMultiplier=" + deviationMultiplier +
                ", filter=" + filter +
                '}';
    }
}
