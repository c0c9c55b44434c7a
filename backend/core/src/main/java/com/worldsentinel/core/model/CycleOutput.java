package com.worldsentinel.core.model;

import java.time.Instant;
import java.util.List;

public record CycleOutput(
        List<NewsCluster> clusters,
        List<CorrelationResult> correlations,
        List<Deviation> deviations,
        List<ConvergenceAlert> convergenceAlerts,
        List<CountryScore> countryScores,
        List<Signal> signals,
        boolean learning,
        Instant completedAt
) {
    public CycleOutput {
        clusters = List.copyOf(clusters);
        correlations = List.copyOf(correlations);
        deviations = List.copyOf(deviations);
        convergenceAlerts = List.copyOf(convergenceAlerts);
        countryScores = List.copyOf(countryScores);
        signals = List.copyOf(signals);
    }
}
