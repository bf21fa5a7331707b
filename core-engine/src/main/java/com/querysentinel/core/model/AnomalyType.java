package com.querysentinel.core.model;

/**
 * The three dimensions along which recent activity is compared to a user's
 * baseline.
 *
 * <p>
 * Declaration order is significant: it is the tie-break order used when two
 * findings share user, start time and query id.
 * </p>
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    TIME_OF_DAY("Unusual query hour"),
    COMPLEXITY("Unusual query complexity"),
    TABLE_ACCESS("Unusual table access");

    private final String label;

    AnomalyType(String label) {
        this.label = label;
    }

    /**
     * @return human-readable label used in reports
     */
    public String getLabel() {
        return label;
    }
}
