package com.worldsentinel.core.model;

/**
 * @param zScore {@code null} when the baseline holds too few samples to standardize against
 */
public record Deviation(
        String metricKey,
        double current,
        double mean,
        double stddev,
        Double zScore,
        DeviationLevel level,
        int sampleCount
) {
    public static Deviation insufficientData(String metricKey, double current, int sampleCount) {
        return new Deviation(metricKey, current, 0, 0, null, DeviationLevel.INSUFFICIENT_DATA, sampleCount);
    }

    public boolean hasScore() {
        return zScore != null;
    }
}
