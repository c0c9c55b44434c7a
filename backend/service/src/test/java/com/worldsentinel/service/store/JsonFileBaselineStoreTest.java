package com.worldsentinel.service.store;

import com.worldsentinel.core.model.Baseline;
import com.worldsentinel.core.model.Observation;
import com.worldsentinel.core.model.RollingStats;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileBaselineStoreTest {
    private static final Instant AT = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void unknownMetricIsEmptyBaseline() throws Exception {
        Path dir = Files.createTempDirectory("baseline-store-empty-");
        JsonFileBaselineStore store = new JsonFileBaselineStore(dir.resolve("state/baselines.json"));

        Baseline baseline = store.get("news:all");

        assertEquals("news:all", baseline.metricKey());
        assertEquals(0, baseline.windowShort().sampleCount());
        assertTrue(baseline.observations().isEmpty());
    }

    @Test
    void committedBaselinesSurviveRestart() throws Exception {
        Path file = Files.createTempDirectory("baseline-store-reload-").resolve("state/baselines.json");
        JsonFileBaselineStore store = new JsonFileBaselineStore(file);
        List<Observation> observations = List.of(new Observation(AT.minusSeconds(300), 4), new Observation(AT, 6));
        Baseline baseline = new Baseline("news:all", RollingStats.of(observations), RollingStats.of(observations),
                observations);

        store.putAll(Map.of("news:all", baseline, "protests:global", Baseline.empty("protests:global")));

        JsonFileBaselineStore reloaded = new JsonFileBaselineStore(file);
        assertEquals(2, reloaded.size());
        assertEquals(baseline, reloaded.get("news:all"));
        assertEquals(5.0, reloaded.get("news:all").windowLong().mean(), 1e-9);
        assertFalse(Files.exists(file.resolveSibling("baselines.json.tmp")));
        assertTrue(Files.readString(file).contains("\"2026-03-01T12:00:00Z\""));
    }

    @Test
    void corruptFileFailsFastWithPath() throws Exception {
        Path file = Files.createTempDirectory("baseline-store-corrupt-").resolve("baselines.json");
        Files.writeString(file, "{broken");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new JsonFileBaselineStore(file));
        assertTrue(error.getMessage().contains("baselines.json"));
    }

    @Test
    void unwritablePathFailsWithClearMessage() throws Exception {
        Path dir = Files.createTempDirectory("baseline-store-unwritable-");
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "blocker");
        JsonFileBaselineStore store = new JsonFileBaselineStore(blocker.resolve("baselines.json"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> store.put("news:all", Baseline.empty("news:all")));
        assertTrue(error.getMessage().contains("Failed writing baselines"));
    }

    @Test
    void failedWriteLeavesInMemoryBaselinesUntouched() throws Exception {
        Path dir = Files.createTempDirectory("baseline-store-failed-write-");
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "blocker");
        JsonFileBaselineStore store = new JsonFileBaselineStore(blocker.resolve("baselines.json"));
        List<Observation> observations = List.of(new Observation(AT, 3));
        Baseline baseline = new Baseline("news:all", RollingStats.of(observations), RollingStats.of(observations),
                observations);

        assertThrows(IllegalStateException.class, () -> store.putAll(Map.of("news:all", baseline)));

        assertEquals(0, store.size());
        assertTrue(store.get("news:all").observations().isEmpty());
    }
}
