package com.worldsentinel.analysis.entity;

import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.model.EntityType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Load-once knowledge base of named entities with its derived lookup indexes. Immutable after
 * {@link #build(Collection)}.
 */
public final class EntityRegistry {
    private static final Logger LOGGER = Logger.getLogger(EntityRegistry.class.getName());

    private final Map<String, EntityRecord> byId;
    private final Map<String, String> aliasToId;
    private final Map<String, Set<String>> keywordToIds;
    private final Map<String, Set<String>> sectorToIds;
    private final Map<EntityType, Set<String>> typeToIds;

    private EntityRegistry(
            Map<String, EntityRecord> byId,
            Map<String, String> aliasToId,
            Map<String, Set<String>> keywordToIds,
            Map<String, Set<String>> sectorToIds,
            Map<EntityType, Set<String>> typeToIds
    ) {
        this.byId = byId;
        this.aliasToId = aliasToId;
        this.keywordToIds = keywordToIds;
        this.sectorToIds = sectorToIds;
        this.typeToIds = typeToIds;
    }

    public static EntityRegistry build(Collection<EntityRecord> records) {
        Map<String, EntityRecord> byId = new LinkedHashMap<>();
        Map<String, String> aliasToId = new HashMap<>();
        Map<String, Set<String>> keywordToIds = new HashMap<>();
        Map<String, Set<String>> sectorToIds = new HashMap<>();
        Map<EntityType, Set<String>> typeToIds = new EnumMap<>(EntityType.class);

        for (EntityRecord record : records) {
            if (record == null || record.id() == null || record.id().isBlank()) {
                throw new MalformedConfigurationException("Entity record without an id");
            }
            if (record.type() == null) {
                throw new MalformedConfigurationException("Entity " + record.id() + " has no type");
            }
            if (byId.putIfAbsent(record.id(), record) != null) {
                throw new MalformedConfigurationException("Duplicate entity id: " + record.id());
            }
            if (record.aliases().isEmpty()) {
                throw new MalformedConfigurationException("Entity " + record.id() + " has no aliases");
            }
            for (String alias : record.aliases()) {
                String key = normalize(alias);
                if (key.isEmpty()) {
                    throw new MalformedConfigurationException("Entity " + record.id() + " has a blank alias");
                }
                String previous = aliasToId.putIfAbsent(key, record.id());
                if (previous != null && !previous.equals(record.id())) {
                    throw new MalformedConfigurationException(
                            "Alias '" + alias + "' is claimed by both " + previous + " and " + record.id());
                }
            }
            for (String keyword : record.keywords()) {
                String key = normalize(keyword);
                if (!key.isEmpty()) {
                    keywordToIds.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(record.id());
                }
            }
            if (record.sector() != null && !record.sector().isBlank()) {
                sectorToIds.computeIfAbsent(normalize(record.sector()), ignored -> new LinkedHashSet<>()).add(record.id());
            }
            typeToIds.computeIfAbsent(record.type(), ignored -> new LinkedHashSet<>()).add(record.id());
        }

        for (EntityRecord record : byId.values()) {
            for (String relatedId : record.relatedIds()) {
                if (!byId.containsKey(relatedId)) {
                    throw new MalformedConfigurationException(
                            "Entity " + record.id() + " references unknown related entity " + relatedId);
                }
            }
        }

        LOGGER.info(() -> "Entity registry built: " + byId.size() + " entities, " + aliasToId.size() + " aliases");
        return new EntityRegistry(
                Collections.unmodifiableMap(byId),
                Collections.unmodifiableMap(aliasToId),
                freeze(keywordToIds),
                freeze(sectorToIds),
                freeze(typeToIds)
        );
    }

    public Optional<EntityRecord> byId(String id) {
        return Optional.ofNullable(id == null ? null : byId.get(id));
    }

    /**
     * Case-insensitive exact alias lookup.
     */
    public Optional<EntityRecord> byAlias(String alias) {
        if (alias == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliasToId.get(normalize(alias))).map(byId::get);
    }

    public List<EntityRecord> byKeyword(String keyword) {
        return keyword == null ? List.of() : records(keywordToIds.get(normalize(keyword)));
    }

    /**
     * Entities owning a keyword that occurs as a substring of {@code text}.
     */
    public List<EntityRecord> keywordsFoundIn(String text) {
        Set<String> ids = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : keywordToIds.entrySet()) {
            if (TextMatcher.containsKeyword(text, entry.getKey())) {
                ids.addAll(entry.getValue());
            }
        }
        return records(ids);
    }

    public List<EntityRecord> bySector(String sector) {
        return sector == null ? List.of() : records(sectorToIds.get(normalize(sector)));
    }

    public List<EntityRecord> byType(EntityType type) {
        return records(typeToIds.get(type));
    }

    /**
     * Resolves a ticker or name: id first, then alias.
     */
    public Optional<EntityRecord> resolve(String symbolOrAlias) {
        return byId(symbolOrAlias).or(() -> byAlias(symbolOrAlias));
    }

    public Collection<EntityRecord> all() {
        return byId.values();
    }

    public int size() {
        return byId.size();
    }

    private List<EntityRecord> records(Set<String> ids) {
        if (ids == null) {
            return List.of();
        }
        return ids.stream().map(byId::get).toList();
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static <K> Map<K, Set<String>> freeze(Map<K, Set<String>> source) {
        Map<K, Set<String>> copy = new HashMap<>();
        for (Map.Entry<K, Set<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
