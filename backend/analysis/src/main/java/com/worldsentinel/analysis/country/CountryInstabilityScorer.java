package com.worldsentinel.analysis.country;

import com.worldsentinel.core.model.CountryScore;
import com.worldsentinel.core.model.InstabilityLevel;
import com.worldsentinel.core.model.MonitoredCountry;
import com.worldsentinel.core.model.ScoreTrend;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Country instability index: unrest, security, and information sub-scores blended 40/30/30, with
 * media-volume damping and per-country floors. Never fails; a country with no input scores 0 or
 * its floor.
 */
public class CountryInstabilityScorer {
    static final int TREND_DELTA = 5;

    private final double dampingThreshold;

    public CountryInstabilityScorer(double dampingThreshold) {
        if (!(dampingThreshold > 0)) {
            throw new IllegalArgumentException("Damping threshold must be positive: " + dampingThreshold);
        }
        this.dampingThreshold = dampingThreshold;
    }

    public List<CountryScore> score(
            List<MonitoredCountry> countries,
            Map<String, CountrySignals> signalsByCode,
            CountryTrendState trendState,
            Instant now
    ) {
        List<CountryScore> scores = new ArrayList<>(countries.size());
        for (MonitoredCountry country : countries) {
            String code = country.code().trim().toUpperCase(Locale.ROOT);
            CountrySignals signals = signalsByCode.getOrDefault(code, CountrySignals.NONE);
            Integer previous = trendState.lastComposite(code).orElse(null);
            scores.add(score(code, signals, country.floor(), previous, now));
        }
        scores.sort(Comparator.comparingInt(CountryScore::composite).reversed()
                .thenComparing(CountryScore::countryCode));
        return scores;
    }

    public CountryScore score(String code, CountrySignals signals, Integer floor, Integer previous, Instant now) {
        double damping = dampingFactor(signals.newsVolume());

        double rawUnrest = Math.min(50, signals.protestCount() * 8)
                + Math.min(30, signals.fatalities() * 5)
                + Math.min(20, signals.highSeverityCount() * 10);
        double rawSecurity = Math.min(50, signals.militaryFlights() * 3)
                + Math.min(30, signals.navalVessels() * 5);
        double rawInformation = Math.min(40, signals.newsCount() * 5)
                + Math.min(40, signals.avgVelocity() * 10)
                + (signals.anyAlert() ? 20 : 0);

        int unrest = clamp(rawUnrest * damping);
        int security = clamp(rawSecurity);
        int information = clamp(rawInformation * damping);

        int computed = (int) Math.round(unrest * 0.4 + security * 0.3 + information * 0.3);
        int composite = applyFloor(computed, floor);

        return new CountryScore(
                code,
                unrest,
                security,
                information,
                composite,
                InstabilityLevel.forScore(composite),
                trend(previous, composite),
                previous,
                now
        );
    }

    /**
     * {@code 1 / (1 + log10(volume / threshold))} above the threshold, 1 otherwise.
     */
    double dampingFactor(int newsVolume) {
        if (newsVolume <= dampingThreshold) {
            return 1.0;
        }
        return 1.0 / (1.0 + Math.log10(newsVolume / dampingThreshold));
    }

    public static int applyFloor(int computed, Integer floor) {
        return floor == null ? computed : Math.max(computed, floor);
    }

    static ScoreTrend trend(Integer previous, int current) {
        if (previous == null) {
            return ScoreTrend.STABLE;
        }
        int delta = current - previous;
        if (delta >= TREND_DELTA) {
            return ScoreTrend.RISING;
        }
        if (delta <= -TREND_DELTA) {
            return ScoreTrend.FALLING;
        }
        return ScoreTrend.STABLE;
    }

    private static int clamp(double value) {
        return (int) Math.round(Math.max(0, Math.min(100, value)));
    }
}
