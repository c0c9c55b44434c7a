package com.worldsentinel.analysis.geo;

import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.core.model.ConvergenceAlert;
import com.worldsentinel.core.model.ConvergenceLevel;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.GeoEventKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static com.worldsentinel.analysis.support.TestData.NOW;
import static com.worldsentinel.analysis.support.TestData.geo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConvergenceGridTest {
    private final ConvergenceGrid grid = new ConvergenceGrid(AnalysisSettings.defaults());

    @Test
    void threeKindsInOneCellRaiseCriticalAlert() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.MILITARY_FLIGHT, 25.1, 121.2, "tw"),
                geo(GeoEventKind.MILITARY_FLIGHT, 25.4, 121.5, "TW"),
                geo(GeoEventKind.MILITARY_FLIGHT, 25.9, 121.9, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, 25.3, 121.1, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, 25.6, 121.7, null),
                geo(GeoEventKind.PROTEST, 25.0, 121.5, "TW"));

        List<ConvergenceAlert> alerts = grid.detect(events, NOW);

        assertEquals(1, alerts.size());
        ConvergenceAlert alert = alerts.get(0);
        assertEquals("25,121", alert.cellKey());
        assertEquals(87, alert.score());
        assertEquals(ConvergenceLevel.CRITICAL, alert.level());
        assertEquals(6, alert.totalEvents());
        assertEquals(Set.of(GeoEventKind.MILITARY_FLIGHT, GeoEventKind.MILITARY_VESSEL, GeoEventKind.PROTEST),
                alert.kinds());
        assertEquals(Set.of("TW"), alert.countryCodes());
        assertEquals(25.5, alert.latitude(), 1e-9);
        assertEquals(121.5, alert.longitude(), 1e-9);
        assertEquals(NOW.minus(Duration.ofHours(24)), alert.windowStart());
    }

    @Test
    void twoKindsDoNotConverge() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.MILITARY_FLIGHT, 25.1, 121.2, "TW"),
                geo(GeoEventKind.MILITARY_FLIGHT, 25.2, 121.2, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, 25.3, 121.1, "TW"));

        assertTrue(grid.detect(events, NOW).isEmpty());
    }

    @Test
    void neighbouringCellsAreNotMerged() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.MILITARY_FLIGHT, 25.99, 121.5, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, 26.01, 121.5, "TW"),
                geo(GeoEventKind.PROTEST, 25.5, 121.5, "TW"));

        assertTrue(grid.detect(events, NOW).isEmpty());
        assertEquals(2, grid.bin(events, NOW).size());
    }

    @Test
    void negativeCoordinatesFloorTowardsSouthWest() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.PROTEST, -33.9, -70.6, "CL"),
                geo(GeoEventKind.OUTAGE, -33.1, -70.1, "CL"),
                geo(GeoEventKind.EARTHQUAKE, -33.5, -70.9, "CL"));

        ConvergenceAlert alert = grid.detect(events, NOW).get(0);

        assertEquals("-34,-71", alert.cellKey());
        assertEquals(81, alert.score());
    }

    @Test
    void invalidAndStaleEventsAreIgnored() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.MILITARY_FLIGHT, 25.1, 121.2, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, Double.NaN, 121.2, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, 95.0, 121.2, "TW"),
                geo(GeoEventKind.PROTEST, 25.1, 121.2, "TW", NOW.minus(Duration.ofHours(25))),
                geo(GeoEventKind.OUTAGE, 25.1, 121.2, "TW", NOW.minus(Duration.ofHours(24))));

        List<GeoCell> cells = grid.bin(events, NOW);

        assertEquals(1, cells.size());
        assertEquals(2, cells.get(0).totalEvents());
        assertTrue(grid.detect(events, NOW).isEmpty());
    }

    @Test
    void futureDatedEventsAreOutsideTheWindow() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.MILITARY_FLIGHT, 25.1, 121.2, "TW"),
                geo(GeoEventKind.MILITARY_VESSEL, 25.2, 121.3, "TW"),
                geo(GeoEventKind.PROTEST, 25.3, 121.4, "TW", NOW.plus(Duration.ofMinutes(30))),
                geo(GeoEventKind.OUTAGE, 25.4, 121.5, "TW", NOW));

        List<GeoCell> cells = grid.bin(events, NOW);

        assertEquals(1, cells.size());
        assertEquals(3, cells.get(0).totalEvents());
        assertEquals(NOW, cells.get(0).windowEnd());
    }

    @Test
    void scoreIsCappedAndLevelsFollowScore() {
        assertEquals(100, ConvergenceGrid.score(5, 40));
        assertEquals(77, ConvergenceGrid.score(3, 1));
        assertEquals(ConvergenceLevel.HIGH, ConvergenceGrid.levelFor(77));
        assertEquals(ConvergenceLevel.MEDIUM, ConvergenceGrid.levelFor(59));
        assertEquals(ConvergenceLevel.CRITICAL, ConvergenceGrid.levelFor(80));
    }

    @Test
    void alertsOrderedByScoreThenCell() {
        List<GeoEvent> events = List.of(
                geo(GeoEventKind.PROTEST, 10.5, 10.5, null),
                geo(GeoEventKind.OUTAGE, 10.5, 10.5, null),
                geo(GeoEventKind.EARTHQUAKE, 10.5, 10.5, null),
                geo(GeoEventKind.PROTEST, 40.5, 40.5, null),
                geo(GeoEventKind.OUTAGE, 40.5, 40.5, null),
                geo(GeoEventKind.EARTHQUAKE, 40.5, 40.5, null),
                geo(GeoEventKind.MILITARY_FLIGHT, 40.5, 40.5, null));

        List<ConvergenceAlert> alerts = grid.detect(events, NOW);

        assertEquals(List.of("40,40", "10,10"), alerts.stream().map(ConvergenceAlert::cellKey).toList());
        assertTrue(alerts.get(1).countryCodes().isEmpty());
    }

    @Test
    void rejectsNonPositiveCellSize() {
        assertThrows(IllegalArgumentException.class, () -> new ConvergenceGrid(0, Duration.ofHours(1), 3));
    }
}
