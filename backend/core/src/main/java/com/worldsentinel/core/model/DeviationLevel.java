package com.worldsentinel.core.model;

public enum DeviationLevel {
    SPIKE,
    ELEVATED,
    NORMAL,
    QUIET,
    INSUFFICIENT_DATA
}
