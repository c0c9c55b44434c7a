package com.worldsentinel.core.model;

import java.util.Set;

public record EntityRecord(
        String id,
        String displayName,
        EntityType type,
        Set<String> aliases,
        Set<String> keywords,
        String sector,
        Set<String> relatedIds
) {
    public EntityRecord {
        aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
        relatedIds = relatedIds == null ? Set.of() : Set.copyOf(relatedIds);
    }
}
