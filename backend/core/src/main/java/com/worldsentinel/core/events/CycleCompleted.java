package com.worldsentinel.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        long cycleNumber,
        boolean committed,
        long durationMillis,
        int clusterCount,
        int signalCount
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
