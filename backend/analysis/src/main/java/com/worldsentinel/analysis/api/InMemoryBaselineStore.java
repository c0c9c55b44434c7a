package com.worldsentinel.analysis.api;

import com.worldsentinel.core.model.Baseline;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryBaselineStore implements BaselineStore {
    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();

    @Override
    public Baseline get(String metricKey) {
        return baselines.getOrDefault(metricKey, Baseline.empty(metricKey));
    }

    @Override
    public void put(String metricKey, Baseline baseline) {
        baselines.put(metricKey, baseline);
    }

    public Map<String, Baseline> snapshot() {
        return Map.copyOf(baselines);
    }
}
