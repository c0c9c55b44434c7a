package com.worldsentinel.analysis.api;

import com.worldsentinel.core.model.Baseline;

import java.util.Map;

/**
 * Persistence boundary for rolling baselines. Implementations must answer unknown keys with
 * {@link Baseline#empty(String)} rather than failing, so a first run starts from nothing.
 */
public interface BaselineStore {
    Baseline get(String metricKey);

    void put(String metricKey, Baseline baseline);

    /**
     * Writes all baselines of one cycle together.
     */
    default void putAll(Map<String, Baseline> baselines) {
        baselines.forEach(this::put);
    }
}
