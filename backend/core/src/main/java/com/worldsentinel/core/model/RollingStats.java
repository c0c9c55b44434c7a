package com.worldsentinel.core.model;

import java.util.Collection;

public record RollingStats(double mean, double stddev, int sampleCount) {
    public static final RollingStats EMPTY = new RollingStats(0, 0, 0);

    /**
     * Population mean and standard deviation of the given observations.
     */
    public static RollingStats of(Collection<Observation> observations) {
        if (observations.isEmpty()) {
            return EMPTY;
        }
        double sum = 0;
        for (Observation observation : observations) {
            sum += observation.value();
        }
        double mean = sum / observations.size();
        double squares = 0;
        for (Observation observation : observations) {
            double diff = observation.value() - mean;
            squares += diff * diff;
        }
        return new RollingStats(mean, Math.sqrt(squares / observations.size()), observations.size());
    }
}
