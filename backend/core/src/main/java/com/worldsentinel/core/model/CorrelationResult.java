package com.worldsentinel.core.model;

public record CorrelationResult(
        String symbol,
        double movePercent,
        CorrelationOutcome outcome,
        String entityId,
        String clusterId,
        String headline,
        String matchedTerm,
        MatchKind matchKind,
        double confidence
) {
    public static CorrelationResult belowThreshold(String symbol, double movePercent, String entityId) {
        return new CorrelationResult(symbol, movePercent, CorrelationOutcome.BELOW_THRESHOLD, entityId,
                null, null, null, null, 0);
    }

    public static CorrelationResult silentDivergence(String symbol, double movePercent, String entityId) {
        return new CorrelationResult(symbol, movePercent, CorrelationOutcome.SILENT_DIVERGENCE, entityId,
                null, null, null, null, 0);
    }
}
