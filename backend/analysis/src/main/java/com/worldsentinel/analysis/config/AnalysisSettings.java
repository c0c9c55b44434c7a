package com.worldsentinel.analysis.config;

import java.time.Duration;
import java.util.List;

/**
 * Tunable thresholds for every analysis stage. The defaults are empirically chosen starting points,
 * meant to be validated against live data rather than treated as derived constants.
 */
public record AnalysisSettings(
        double similarityThreshold,
        int minTokenLength,
        double spikeZScore,
        double elevatedZScore,
        double quietZScore,
        int minBaselineSamples,
        Duration baselineShortWindow,
        Duration baselineLongWindow,
        double cellSizeDegrees,
        Duration convergenceWindow,
        int minConvergenceKinds,
        double newsVolumeDampingThreshold,
        double marketMoveThreshold,
        double flowPriceThreshold,
        double predictionShiftThreshold,
        double velocitySpikeThreshold,
        int minClusterSizeForSpike,
        Duration sourceConvergenceWindow,
        int ciiSpikeDelta,
        double minSignalConfidence,
        Duration learningWarmup,
        List<String> pipelineKeywords,
        List<String> flowDropKeywords
) {
    public AnalysisSettings {
        pipelineKeywords = pipelineKeywords == null ? List.of() : List.copyOf(pipelineKeywords);
        flowDropKeywords = flowDropKeywords == null ? List.of() : List.copyOf(flowDropKeywords);
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(
                0.5,
                3,
                2.5,
                1.5,
                -2.0,
                6,
                Duration.ofDays(7),
                Duration.ofDays(30),
                1.0,
                Duration.ofHours(24),
                3,
                25,
                2.0,
                1.5,
                5.0,
                6.0,
                3,
                Duration.ofMinutes(60),
                10,
                0.6,
                Duration.ofMinutes(15),
                List.of("pipeline", "gas flow", "nord stream", "druzhba", "lng terminal", "gas transit"),
                List.of("halt", "halted", "shut", "shutdown", "suspend", "suspended", "cut", "cuts", "drop",
                        "drops", "disruption", "disrupted", "outage", "explosion", "sabotage", "leak")
        );
    }
}
