package com.worldsentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.model.MonitoredCountry;
import com.worldsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads the JSON configuration files from a directory, falling back to the copies bundled under
 * {@code /config} on the classpath when a file is absent.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    static final String SETTINGS_FILE = "settings.json";
    static final String ENTITIES_FILE = "entities.json";
    static final String COUNTRIES_FILE = "countries.json";

    private ConfigLoader() {
    }

    /**
     * Keys missing from the file keep their default value.
     */
    public static ServiceSettings loadSettings(Path configDir) {
        JsonNode merged = MAPPER.valueToTree(ServiceSettings.defaults());
        JsonNode overrides = readTree(configDir, SETTINGS_FILE);
        if (overrides != null) {
            merge((ObjectNode) merged, overrides);
        }
        try {
            return MAPPER.treeToValue(merged, ServiceSettings.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + configDir.resolve(SETTINGS_FILE), e);
        }
    }

    public static List<EntityRecord> loadEntities(Path configDir) {
        return read(configDir, ENTITIES_FILE, new TypeReference<>() {
        });
    }

    public static List<MonitoredCountry> loadCountries(Path configDir) {
        return read(configDir, COUNTRIES_FILE, new TypeReference<>() {
        });
    }

    static void merge(ObjectNode target, JsonNode overrides) {
        if (!overrides.isObject()) {
            throw new IllegalStateException("Settings must be a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    private static <T> T read(Path configDir, String fileName, TypeReference<T> ref) {
        Path path = configDir.resolve(fileName);
        try (InputStream in = open(configDir, fileName)) {
            if (in == null) {
                throw new IllegalStateException("Missing config file " + path);
            }
            return MAPPER.readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static JsonNode readTree(Path configDir, String fileName) {
        Path path = configDir.resolve(fileName);
        try (InputStream in = open(configDir, fileName)) {
            return in == null ? null : MAPPER.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    private static InputStream open(Path configDir, String fileName) throws IOException {
        Path path = configDir.resolve(fileName);
        if (Files.exists(path)) {
            return Files.newInputStream(path);
        }
        LOGGER.fine(() -> path + " not found, using bundled " + fileName);
        return ConfigLoader.class.getResourceAsStream("/config/" + fileName);
    }
}
