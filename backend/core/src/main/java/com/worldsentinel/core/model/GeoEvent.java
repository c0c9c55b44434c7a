package com.worldsentinel.core.model;

import java.time.Instant;

/**
 * @param countryCode  ISO-3166 alpha-2, or {@code null} when the collaborator could not attribute it
 * @param fatalities   reported fatalities, {@code null} when not applicable
 */
public record GeoEvent(
        String id,
        GeoEventKind kind,
        double lat,
        double lon,
        Instant occurredAt,
        String countryCode,
        Integer fatalities,
        boolean highSeverity,
        String label
) {
    public boolean hasValidPosition() {
        return !Double.isNaN(lat) && !Double.isNaN(lon)
                && lat >= -90 && lat <= 90
                && lon >= -180 && lon <= 180;
    }

    public int fatalitiesOrZero() {
        return fatalities == null ? 0 : Math.max(0, fatalities);
    }
}
