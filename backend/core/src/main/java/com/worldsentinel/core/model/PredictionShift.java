package com.worldsentinel.core.model;

import java.time.Instant;

/**
 * Prediction-market movement between two collaborator polls. Prices are in percentage points (0..100).
 */
public record PredictionShift(
        String marketId,
        String title,
        double previousYesPrice,
        double currentYesPrice,
        Instant observedAt
) {
    public double shift() {
        return Math.abs(currentYesPrice - previousYesPrice);
    }
}
