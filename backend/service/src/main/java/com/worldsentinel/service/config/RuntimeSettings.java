package com.worldsentinel.service.config;

import java.time.Duration;

/**
 * Scheduling knobs of the refresh loop.
 *
 * @param requestTimeout upper bound for each feed fetch inside a cycle
 */
public record RuntimeSettings(
        Duration cycleInterval,
        Duration cycleTimeout,
        Duration requestTimeout,
        int workerThreads
) {
    public static RuntimeSettings defaults() {
        return new RuntimeSettings(Duration.ofMinutes(5), Duration.ofSeconds(60), Duration.ofSeconds(10), 2);
    }

    public RuntimeSettings {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }
}
