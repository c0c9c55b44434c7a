package com.worldsentinel.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.model.MonitoredCountry;
import com.worldsentinel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void settingsFileOverridesOnlyTheKeysItNames() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("settings.json"), """
                {
                  "analysis": {"similarityThreshold": 0.6, "convergenceWindow": "PT12H"},
                  "runtime": {"workerThreads": 4}
                }
                """);

        ServiceSettings settings = ConfigLoader.loadSettings(dir);

        assertEquals(0.6, settings.analysis().similarityThreshold(), 1e-9);
        assertEquals(Duration.ofHours(12), settings.analysis().convergenceWindow());
        assertEquals(3, settings.analysis().minConvergenceKinds());
        assertEquals(6, settings.analysis().minBaselineSamples());
        assertTrue(settings.analysis().pipelineKeywords().contains("druzhba"));
        assertEquals(4, settings.runtime().workerThreads());
        assertEquals(Duration.ofMinutes(5), settings.runtime().cycleInterval());
    }

    @Test
    void missingFilesFallBackToBundledConfig() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-empty-");

        ServiceSettings settings = ConfigLoader.loadSettings(dir);
        List<EntityRecord> entities = ConfigLoader.loadEntities(dir);
        List<MonitoredCountry> countries = ConfigLoader.loadCountries(dir);

        assertEquals(Duration.ofMinutes(15), settings.analysis().learningWarmup());
        assertTrue(entities.stream().anyMatch(entity -> entity.id().equals("AVGO")));
        MonitoredCountry ukraine = countries.stream().filter(c -> c.code().equals("UA")).findFirst().orElseThrow();
        assertEquals(Integer.valueOf(55), ukraine.floor());
        assertNull(countries.stream().filter(c -> c.code().equals("TW")).findFirst().orElseThrow().floor());
    }

    @Test
    void invalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");
        Files.writeString(dir.resolve("entities.json"), "{not-json");
        Files.writeString(dir.resolve("settings.json"), """
                {"runtime": {"workerThreads": 0}}
                """);

        IllegalStateException entities = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadEntities(dir));
        assertTrue(entities.getMessage().contains("entities.json"));

        IllegalStateException settings = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSettings(dir));
        assertTrue(settings.getMessage().contains("settings.json"));
    }

    @Test
    void mergeRecursesIntoNestedObjects() throws Exception {
        ObjectNode target = (ObjectNode) JsonUtils.objectMapper().readTree("""
                {"a": {"x": 1, "y": 2}, "b": [1, 2]}
                """);
        JsonNode overrides = JsonUtils.objectMapper().readTree("""
                {"a": {"y": 3}, "b": [9], "c": true}
                """);

        ConfigLoader.merge(target, overrides);

        assertEquals(1, target.path("a").path("x").asInt());
        assertEquals(3, target.path("a").path("y").asInt());
        assertEquals(1, target.path("b").size());
        assertTrue(target.path("c").asBoolean());
    }
}
