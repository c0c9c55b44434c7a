package com.worldsentinel.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * Operational alert about the pipeline itself (feed failure, abandoned cycle), as opposed to a {@code Signal}.
 */
public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    @Override
    public String type() {
        return "AlertRaised";
    }
}
