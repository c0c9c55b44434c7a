package com.worldsentinel.analysis.country;

/**
 * Raw per-country counts feeding the instability sub-scores for one cycle.
 *
 * @param newsCount  clusters attributed to the country
 * @param newsVolume member items across those clusters, used for media-volume damping
 */
public record CountrySignals(
        int protestCount,
        int fatalities,
        int highSeverityCount,
        int militaryFlights,
        int navalVessels,
        int newsCount,
        int newsVolume,
        double avgVelocity,
        boolean anyAlert
) {
    public static final CountrySignals NONE = new CountrySignals(0, 0, 0, 0, 0, 0, 0, 0, false);

    public CountrySignals {
        protestCount = Math.max(0, protestCount);
        fatalities = Math.max(0, fatalities);
        highSeverityCount = Math.max(0, highSeverityCount);
        militaryFlights = Math.max(0, militaryFlights);
        navalVessels = Math.max(0, navalVessels);
        newsCount = Math.max(0, newsCount);
        newsVolume = Math.max(0, newsVolume);
        avgVelocity = Double.isNaN(avgVelocity) ? 0 : Math.max(0, avgVelocity);
    }
}
