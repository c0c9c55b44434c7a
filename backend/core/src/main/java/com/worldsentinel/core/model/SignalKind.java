package com.worldsentinel.core.model;

import java.time.Duration;

public enum SignalKind {
    SILENT_DIVERGENCE,
    EXPLAINED_MARKET_MOVE,
    FLOW_PRICE_DIVERGENCE,
    PREDICTION_LEADS_NEWS,
    VELOCITY_SPIKE,
    SOURCE_CONVERGENCE,
    TRIANGULATION,
    FLOW_DROP,
    KEYWORD_SPIKE,
    GEO_CONVERGENCE,
    CII_SPIKE,
    MILITARY_SURGE;

    private static final Duration MARKET_TTL = Duration.ofHours(6);
    private static final Duration PREDICTION_TTL = Duration.ofHours(2);
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    /**
     * How long an emitted signal of this kind suppresses repeats for the same subject.
     */
    public Duration dedupTtl() {
        return switch (this) {
            case SILENT_DIVERGENCE, EXPLAINED_MARKET_MOVE, FLOW_PRICE_DIVERGENCE -> MARKET_TTL;
            case PREDICTION_LEADS_NEWS -> PREDICTION_TTL;
            case VELOCITY_SPIKE, SOURCE_CONVERGENCE, TRIANGULATION, FLOW_DROP, KEYWORD_SPIKE,
                    GEO_CONVERGENCE, CII_SPIKE, MILITARY_SURGE -> DEFAULT_TTL;
        };
    }

    public boolean referencesCountryIndex() {
        return this == CII_SPIKE;
    }
}
