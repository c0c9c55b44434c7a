package com.worldsentinel.core.events;

import java.time.Instant;

public record CycleSkipped(Instant timestamp, String reason) implements Event {
    @Override
    public String type() {
        return "CycleSkipped";
    }
}
