package com.worldsentinel.core.model;

public enum ScoreTrend {
    RISING,
    STABLE,
    FALLING
}
