package com.worldsentinel.analysis.support;

import com.fasterxml.jackson.core.type.TypeReference;
import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

public final class FixtureUtils {
    private FixtureUtils() {
    }

    public static List<EntityRecord> entities() {
        try (InputStream in = FixtureUtils.class.getClassLoader().getResourceAsStream("fixtures/entities.json")) {
            if (in == null) {
                throw new IllegalArgumentException("Fixture not found: fixtures/entities.json");
            }
            return JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
        } catch (IOException e) {
            throw new IllegalStateException("Invalid fixture: fixtures/entities.json", e);
        }
    }

    public static EntityRegistry registry() {
        return EntityRegistry.build(entities());
    }
}
