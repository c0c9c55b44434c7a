package com.worldsentinel.core.model;

import java.time.Instant;
import java.util.Map;

public record Signal(
        String id,
        SignalKind kind,
        String subjectKey,
        String title,
        double confidence,
        Severity severity,
        Instant firstFiredAt,
        Map<String, Object> details
) {
    public Signal {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
