package com.worldsentinel.analysis.baseline;

import com.worldsentinel.core.model.CycleInput;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.GeoEventKind;
import com.worldsentinel.core.model.NewsItem;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-cycle counts tracked against baselines, keyed {@code "<family>:<scope>"}.
 */
public final class VolumeMetrics {
    public static final String ALL_NEWS = "news:all";

    private VolumeMetrics() {
    }

    public static Map<String, Double> countsFor(CycleInput input) {
        Map<String, Double> counts = new TreeMap<>();
        counts.put(ALL_NEWS, (double) input.news().size());
        for (NewsItem item : input.news()) {
            counts.merge("news:" + item.category().toLowerCase(Locale.ROOT), 1.0, Double::sum);
        }
        for (GeoEventKind kind : GeoEventKind.values()) {
            counts.put(geoKey(kind), 0.0);
        }
        for (GeoEvent event : input.geoEvents()) {
            if (event.kind() != null) {
                counts.merge(geoKey(event.kind()), 1.0, Double::sum);
            }
        }
        return counts;
    }

    static String geoKey(GeoEventKind kind) {
        String family = switch (kind) {
            case PROTEST -> "protests";
            case MILITARY_FLIGHT -> "military_flights";
            case MILITARY_VESSEL -> "military_vessels";
            case EARTHQUAKE -> "earthquakes";
            case OUTAGE -> "outages";
        };
        return family + ":global";
    }
}
