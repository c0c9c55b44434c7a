package com.worldsentinel.core.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
