package com.worldsentinel.core.model;

public enum ClusterTrend {
    RISING,
    STABLE,
    FALLING
}
