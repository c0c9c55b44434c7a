package com.worldsentinel.core.model;

import java.util.List;

/**
 * Rolling history for one metric. {@code observations} covers the long window and is kept so both
 * windows can be recomputed after a restart.
 */
public record Baseline(
        String metricKey,
        RollingStats windowShort,
        RollingStats windowLong,
        List<Observation> observations
) {
    public Baseline {
        windowShort = windowShort == null ? RollingStats.EMPTY : windowShort;
        windowLong = windowLong == null ? RollingStats.EMPTY : windowLong;
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static Baseline empty(String metricKey) {
        return new Baseline(metricKey, RollingStats.EMPTY, RollingStats.EMPTY, List.of());
    }
}
