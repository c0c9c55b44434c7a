package com.worldsentinel.service.config;

import com.worldsentinel.analysis.config.AnalysisSettings;

import java.util.Objects;

/**
 * Contents of {@code settings.json}.
 */
public record ServiceSettings(AnalysisSettings analysis, RuntimeSettings runtime) {
    public ServiceSettings {
        Objects.requireNonNull(analysis, "analysis is required");
        Objects.requireNonNull(runtime, "runtime is required");
    }

    public static ServiceSettings defaults() {
        return new ServiceSettings(AnalysisSettings.defaults(), RuntimeSettings.defaults());
    }
}
