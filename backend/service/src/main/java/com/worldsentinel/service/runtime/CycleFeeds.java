package com.worldsentinel.service.runtime;

import com.worldsentinel.analysis.api.FeedSource;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.MarketQuote;
import com.worldsentinel.core.model.MilitarySurge;
import com.worldsentinel.core.model.NewsItem;
import com.worldsentinel.core.model.PredictionShift;

import java.util.Objects;

public record CycleFeeds(
        FeedSource<NewsItem> news,
        FeedSource<MarketQuote> quotes,
        FeedSource<GeoEvent> geoEvents,
        FeedSource<PredictionShift> predictionShifts,
        FeedSource<MilitarySurge> militarySurges
) {
    public CycleFeeds {
        Objects.requireNonNull(news, "news feed is required");
        Objects.requireNonNull(quotes, "quotes feed is required");
        Objects.requireNonNull(geoEvents, "geoEvents feed is required");
        Objects.requireNonNull(predictionShifts, "predictionShifts feed is required");
        Objects.requireNonNull(militarySurges, "militarySurges feed is required");
    }
}
