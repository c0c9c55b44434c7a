package com.worldsentinel.analysis.baseline;

import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.core.model.Baseline;
import com.worldsentinel.core.model.Deviation;
import com.worldsentinel.core.model.DeviationLevel;
import com.worldsentinel.core.model.Observation;
import com.worldsentinel.core.model.RollingStats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rolling per-metric history and standardized deviation against it. Both operations are pure:
 * the caller decides when an updated {@link Baseline} is persisted.
 */
public class BaselineDetector {
    private static final double FLAT_TOLERANCE = 1e-9;

    private final Duration shortWindow;
    private final Duration longWindow;
    private final int minSamples;
    private final double spikeZ;
    private final double elevatedZ;
    private final double quietZ;

    public BaselineDetector(AnalysisSettings settings) {
        this(
                settings.baselineShortWindow(),
                settings.baselineLongWindow(),
                settings.minBaselineSamples(),
                settings.spikeZScore(),
                settings.elevatedZScore(),
                settings.quietZScore()
        );
    }

    public BaselineDetector(
            Duration shortWindow,
            Duration longWindow,
            int minSamples,
            double spikeZ,
            double elevatedZ,
            double quietZ
    ) {
        if (shortWindow.compareTo(longWindow) > 0) {
            throw new IllegalArgumentException("Short baseline window must not exceed the long window");
        }
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;
        this.minSamples = minSamples;
        this.spikeZ = spikeZ;
        this.elevatedZ = elevatedZ;
        this.quietZ = quietZ;
    }

    /**
     * Appends {@code currentCount} observed at {@code now}, drops observations older than the long
     * window, and recomputes both windows.
     */
    public Baseline update(Baseline prior, double currentCount, Instant now) {
        Instant longCutoff = now.minus(longWindow);
        Instant shortCutoff = now.minus(shortWindow);

        List<Observation> kept = new ArrayList<>();
        for (Observation observation : prior.observations()) {
            if (observation.at() != null && !observation.at().isBefore(longCutoff) && !Double.isNaN(observation.value())) {
                kept.add(observation);
            }
        }
        if (!Double.isNaN(currentCount) && !Double.isInfinite(currentCount)) {
            kept.add(new Observation(now, currentCount));
        }
        kept.sort(Comparator.comparing(Observation::at));

        List<Observation> recent = kept.stream().filter(observation -> !observation.at().isBefore(shortCutoff)).toList();
        return new Baseline(prior.metricKey(), RollingStats.of(recent), RollingStats.of(kept), kept);
    }

    /**
     * Standardizes {@code current} against the short window. A flat history (stddev at rounding noise) is always
     * NORMAL; fewer than the minimum samples yields INSUFFICIENT_DATA with no z-score.
     */
    public Deviation deviation(double current, Baseline baseline) {
        RollingStats stats = baseline.windowShort();
        if (stats.sampleCount() < minSamples) {
            return Deviation.insufficientData(baseline.metricKey(), current, stats.sampleCount());
        }
        if (isFlat(stats)) {
            return new Deviation(baseline.metricKey(), current, stats.mean(), 0, 0.0, DeviationLevel.NORMAL,
                    stats.sampleCount());
        }
        double z = (current - stats.mean()) / stats.stddev();
        return new Deviation(baseline.metricKey(), current, stats.mean(), stats.stddev(), z, levelFor(z),
                stats.sampleCount());
    }

    // Relative to the mean so rounding noise from fractional samples still reads as flat.
    static boolean isFlat(RollingStats stats) {
        return stats.stddev() <= FLAT_TOLERANCE * Math.max(1.0, Math.abs(stats.mean()));
    }

    DeviationLevel levelFor(double z) {
        if (z > spikeZ) {
            return DeviationLevel.SPIKE;
        }
        if (z > elevatedZ) {
            return DeviationLevel.ELEVATED;
        }
        if (z < quietZ) {
            return DeviationLevel.QUIET;
        }
        return DeviationLevel.NORMAL;
    }
}
