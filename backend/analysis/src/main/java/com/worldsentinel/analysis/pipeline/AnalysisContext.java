package com.worldsentinel.analysis.pipeline;

import com.worldsentinel.analysis.api.BaselineStore;
import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.analysis.country.CountryTrendState;
import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.analysis.signal.DedupTable;
import com.worldsentinel.core.model.MonitoredCountry;

import java.util.List;
import java.util.Objects;

/**
 * State owned by the pipeline across cycles. Configuration is fixed for the process; the trend state
 * and dedup table are replaced wholesale when a cycle commits.
 */
public final class AnalysisContext {
    private final AnalysisSettings settings;
    private final EntityRegistry registry;
    private final List<MonitoredCountry> countries;
    private final BaselineStore baselineStore;
    private final LearningGate learningGate;
    private volatile CountryTrendState trendState = CountryTrendState.EMPTY;
    private volatile DedupTable dedup = new DedupTable();

    public AnalysisContext(
            AnalysisSettings settings,
            EntityRegistry registry,
            List<MonitoredCountry> countries,
            BaselineStore baselineStore,
            LearningGate learningGate
    ) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.countries = List.copyOf(countries);
        this.baselineStore = Objects.requireNonNull(baselineStore, "baselineStore is required");
        this.learningGate = Objects.requireNonNull(learningGate, "learningGate is required");
    }

    public AnalysisSettings settings() {
        return settings;
    }

    public EntityRegistry registry() {
        return registry;
    }

    public List<MonitoredCountry> countries() {
        return countries;
    }

    public BaselineStore baselineStore() {
        return baselineStore;
    }

    public LearningGate learningGate() {
        return learningGate;
    }

    public CountryTrendState trendState() {
        return trendState;
    }

    public DedupTable dedup() {
        return dedup;
    }

    synchronized void install(CountryTrendState nextTrendState, DedupTable nextDedup) {
        this.trendState = nextTrendState;
        this.dedup = nextDedup;
    }
}
