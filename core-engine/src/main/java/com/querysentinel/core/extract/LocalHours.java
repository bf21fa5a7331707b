package com.querysentinel.core.extract;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Converts UTC instants to the hour of day in a reference timezone.
 *
 * @since 1.0.0
 */
public final class LocalHours {

    private LocalHours() {
        // utility class, not instantiable
    }

    /**
     * @param instant  UTC instant; must not be {@code null}
     * @param timezone reference timezone; must not be {@code null}
     * @return the hour of day (0-23) of {@code instant} in {@code timezone}
     */
    public static int hourOf(Instant instant, ZoneId timezone) {
        Objects.requireNonNull(instant, "instant must not be null");
        Objects.requireNonNull(timezone, "timezone must not be null");
        return instant.atZone(timezone).getHour();
    }
}
