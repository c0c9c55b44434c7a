package com.worldsentinel.core.model;

import java.time.Instant;
import java.util.Set;

/**
 * Several distinct kinds of geo event inside one grid cell and time window.
 *
 * @param latitude  centre of the cell
 * @param longitude centre of the cell
 */
public record ConvergenceAlert(
        String cellKey,
        double latitude,
        double longitude,
        Set<GeoEventKind> kinds,
        int totalEvents,
        int score,
        ConvergenceLevel level,
        Set<String> countryCodes,
        Instant windowStart,
        Instant windowEnd
) {
    public ConvergenceAlert {
        kinds = Set.copyOf(kinds);
        countryCodes = Set.copyOf(countryCodes);
    }
}
