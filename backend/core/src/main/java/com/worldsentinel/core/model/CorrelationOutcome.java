package com.worldsentinel.core.model;

public enum CorrelationOutcome {
    EXPLAINED,
    SILENT_DIVERGENCE,
    BELOW_THRESHOLD
}
