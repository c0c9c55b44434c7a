package com.worldsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single headline as delivered by the news collaborator.
 *
 * @param id          unique within a cycle; cluster membership refers to it
 * @param sourceId    outlet or feed that published the item
 * @param sourceTier  1 (most authoritative) to 4
 * @param category    feed category, used as the volume metric key ({@code news:<category>})
 * @param alert       upstream flagged the item as breaking
 */
public record NewsItem(
        String id,
        String sourceId,
        String title,
        String link,
        Instant publishedAt,
        int sourceTier,
        SourceType sourceType,
        String category,
        boolean alert
) {
    public static final int MIN_TIER = 1;
    public static final int MAX_TIER = 4;

    public NewsItem {
        Objects.requireNonNull(id, "id is required");
        sourceId = sourceId == null ? "unknown" : sourceId;
        title = title == null ? "" : title;
        publishedAt = publishedAt == null ? Instant.EPOCH : publishedAt;
        sourceTier = Math.max(MIN_TIER, Math.min(MAX_TIER, sourceTier == 0 ? MAX_TIER : sourceTier));
        sourceType = sourceType == null ? SourceType.MAINSTREAM : sourceType;
        category = category == null || category.isBlank() ? "general" : category;
    }
}
