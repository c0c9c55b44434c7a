package com.worldsentinel.core.events;

import java.time.Instant;

public record CycleStarted(Instant timestamp, long cycleNumber) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
