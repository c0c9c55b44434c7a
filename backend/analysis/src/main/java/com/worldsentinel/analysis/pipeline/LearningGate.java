package com.worldsentinel.analysis.pipeline;

import java.time.Duration;
import java.time.Instant;

/**
 * Warm-up period after start during which country-index signals are withheld while scores and
 * trends are still computed.
 */
public record LearningGate(Instant startedAt, Duration warmup) {
    public boolean isLearning(Instant now) {
        return now.isBefore(startedAt.plus(warmup));
    }

    public static LearningGate disabled() {
        return new LearningGate(Instant.EPOCH, Duration.ZERO);
    }
}
