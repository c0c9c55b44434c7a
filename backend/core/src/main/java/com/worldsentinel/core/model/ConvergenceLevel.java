package com.worldsentinel.core.model;

public enum ConvergenceLevel {
    CRITICAL,
    HIGH,
    MEDIUM
}
