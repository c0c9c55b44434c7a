package com.worldsentinel.core.model;

import java.time.Instant;

/**
 * Pre-classified surge detection delivered by the military-activity collaborator.
 */
public record MilitarySurge(
        String theaterId,
        String title,
        int aircraftCount,
        int baselineCount,
        Double confidence,
        Instant observedAt
) {
}
