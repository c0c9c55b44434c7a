package com.worldsentinel.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of everything the collaborators delivered for one refresh cycle.
 */
public record CycleInput(
        List<NewsItem> news,
        List<MarketQuote> quotes,
        List<GeoEvent> geoEvents,
        List<PredictionShift> predictionShifts,
        List<MilitarySurge> militarySurges,
        Instant capturedAt
) {
    public CycleInput {
        news = news == null ? List.of() : List.copyOf(news);
        quotes = quotes == null ? List.of() : List.copyOf(quotes);
        geoEvents = geoEvents == null ? List.of() : List.copyOf(geoEvents);
        predictionShifts = predictionShifts == null ? List.of() : List.copyOf(predictionShifts);
        militarySurges = militarySurges == null ? List.of() : List.copyOf(militarySurges);
    }

    public static CycleInput empty(Instant capturedAt) {
        return new CycleInput(List.of(), List.of(), List.of(), List.of(), List.of(), capturedAt);
    }
}
