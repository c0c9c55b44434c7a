package com.worldsentinel.core.events;

import com.worldsentinel.core.model.Signal;

import java.time.Instant;

public record SignalRaised(Instant timestamp, Signal signal) implements Event {
    @Override
    public String type() {
        return "SignalRaised";
    }
}
