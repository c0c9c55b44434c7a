package com.worldsentinel.analysis.geo;

import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.core.model.ConvergenceAlert;
import com.worldsentinel.core.model.ConvergenceLevel;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.GeoEventKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Bins geolocated events into fixed-size cells and flags cells where several kinds of activity
 * co-occur. Events near a cell edge are not merged with the neighbouring cell.
 */
public class ConvergenceGrid {
    private static final Logger LOGGER = Logger.getLogger(ConvergenceGrid.class.getName());

    private final double cellSizeDegrees;
    private final Duration window;
    private final int minDistinctKinds;

    public ConvergenceGrid(AnalysisSettings settings) {
        this(settings.cellSizeDegrees(), settings.convergenceWindow(), settings.minConvergenceKinds());
    }

    public ConvergenceGrid(double cellSizeDegrees, Duration window, int minDistinctKinds) {
        if (!(cellSizeDegrees > 0)) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
        this.window = window;
        this.minDistinctKinds = minDistinctKinds;
    }

    public List<ConvergenceAlert> detect(List<GeoEvent> events, Instant now) {
        List<ConvergenceAlert> alerts = new ArrayList<>();
        for (GeoCell cell : bin(events, now)) {
            if (cell.distinctKinds() < minDistinctKinds) {
                continue;
            }
            int score = score(cell.distinctKinds(), cell.totalEvents());
            alerts.add(new ConvergenceAlert(
                    cell.cellKey(),
                    (cell.latIndex() + 0.5) * cellSizeDegrees,
                    (cell.lonIndex() + 0.5) * cellSizeDegrees,
                    cell.eventsByKind().keySet(),
                    cell.totalEvents(),
                    score,
                    levelFor(score),
                    cell.countryCodes(),
                    cell.windowStart(),
                    cell.windowEnd()
            ));
        }
        alerts.sort(Comparator.comparingInt(ConvergenceAlert::score).reversed()
                .thenComparing(ConvergenceAlert::cellKey));
        if (!alerts.isEmpty()) {
            LOGGER.fine(() -> "Convergence alerts: " + alerts.size());
        }
        return alerts;
    }

    /**
     * Groups in-window events with a usable position by cell, ordered by cell key.
     */
    public List<GeoCell> bin(List<GeoEvent> events, Instant now) {
        Instant windowStart = now.minus(window);
        Map<String, CellAccumulator> cells = new TreeMap<>();
        for (GeoEvent event : events) {
            if (event == null || event.kind() == null || !event.hasValidPosition() || event.occurredAt() == null) {
                continue;
            }
            if (event.occurredAt().isBefore(windowStart) || event.occurredAt().isAfter(now)) {
                continue;
            }
            int latIndex = (int) Math.floor(event.lat() / cellSizeDegrees);
            int lonIndex = (int) Math.floor(event.lon() / cellSizeDegrees);
            cells.computeIfAbsent(cellKey(latIndex, lonIndex), key -> new CellAccumulator(latIndex, lonIndex))
                    .add(event);
        }
        List<GeoCell> result = new ArrayList<>(cells.size());
        cells.forEach((key, cell) -> result.add(new GeoCell(
                key, cell.latIndex, cell.lonIndex, cell.counts, cell.countryCodes, windowStart, now)));
        return result;
    }

    public static String cellKey(int latIndex, int lonIndex) {
        return latIndex + "," + lonIndex;
    }

    static int score(int distinctKinds, int totalEvents) {
        return Math.min(100, distinctKinds * 25 + Math.min(25, totalEvents * 2));
    }

    static ConvergenceLevel levelFor(int score) {
        if (score >= 80) {
            return ConvergenceLevel.CRITICAL;
        }
        if (score >= 60) {
            return ConvergenceLevel.HIGH;
        }
        return ConvergenceLevel.MEDIUM;
    }

    private static final class CellAccumulator {
        private final int latIndex;
        private final int lonIndex;
        private final Map<GeoEventKind, Integer> counts = new EnumMap<>(GeoEventKind.class);
        private final Set<String> countryCodes = new HashSet<>();

        private CellAccumulator(int latIndex, int lonIndex) {
            this.latIndex = latIndex;
            this.lonIndex = lonIndex;
        }

        private void add(GeoEvent event) {
            counts.merge(event.kind(), 1, Integer::sum);
            if (event.countryCode() != null && !event.countryCode().isBlank()) {
                countryCodes.add(event.countryCode().toUpperCase(Locale.ROOT));
            }
        }
    }
}
