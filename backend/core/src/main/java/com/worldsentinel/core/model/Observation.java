package com.worldsentinel.core.model;

import java.time.Instant;

public record Observation(Instant at, double value) {
}
