package com.worldsentinel.analysis.geo;

import com.worldsentinel.core.model.GeoEventKind;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Event counts for one grid cell inside the trailing window.
 */
public record GeoCell(
        String cellKey,
        int latIndex,
        int lonIndex,
        Map<GeoEventKind, Integer> eventsByKind,
        Set<String> countryCodes,
        Instant windowStart,
        Instant windowEnd
) {
    public GeoCell {
        eventsByKind = Map.copyOf(eventsByKind);
        countryCodes = Set.copyOf(countryCodes);
    }

    public int distinctKinds() {
        return eventsByKind.size();
    }

    public int totalEvents() {
        return eventsByKind.values().stream().mapToInt(Integer::intValue).sum();
    }
}
