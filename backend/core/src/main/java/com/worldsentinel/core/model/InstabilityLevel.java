package com.worldsentinel.core.model;

public enum InstabilityLevel {
    LOW,
    NORMAL,
    ELEVATED,
    HIGH,
    CRITICAL;

    public static InstabilityLevel forScore(int score) {
        if (score >= 81) {
            return CRITICAL;
        }
        if (score >= 66) {
            return HIGH;
        }
        if (score >= 51) {
            return ELEVATED;
        }
        if (score >= 31) {
            return NORMAL;
        }
        return LOW;
    }
}
