package com.worldsentinel.core.model;

import java.time.Instant;

/**
 * @param previousComposite composite of the prior cycle, {@code null} on the first computation
 */
public record CountryScore(
        String countryCode,
        int unrest,
        int security,
        int information,
        int composite,
        InstabilityLevel level,
        ScoreTrend trend,
        Integer previousComposite,
        Instant computedAt
) {
    public int change() {
        return previousComposite == null ? 0 : composite - previousComposite;
    }
}
