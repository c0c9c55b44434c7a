package com.worldsentinel.analysis.signal;

import com.worldsentinel.core.model.Severity;
import com.worldsentinel.core.model.SignalKind;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Candidate signal produced by a detector, before confidence filtering and deduplication.
 */
public record Detection(
        SignalKind kind,
        String subjectKey,
        String title,
        double confidence,
        Severity severity,
        Map<String, Object> details,
        Instant observedAt
) {
    public Detection {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(subjectKey, "subjectKey is required");
        Objects.requireNonNull(severity, "severity is required");
        confidence = Double.isNaN(confidence) ? 0 : Math.max(0, Math.min(1, confidence));
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public String dedupKey() {
        return DedupTable.key(kind, subjectKey);
    }
}
