package com.worldsentinel.core.model;

public enum MatchKind {
    ALIAS(0.95),
    KEYWORD(0.70),
    RELATED(0.60);

    private final double confidence;

    MatchKind(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }
}
