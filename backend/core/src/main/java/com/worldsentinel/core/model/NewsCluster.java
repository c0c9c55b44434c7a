package com.worldsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Headlines grouped by title similarity. {@code members} lists the primary item first.
 */
public record NewsCluster(
        String id,
        Set<String> memberIds,
        String primaryItemId,
        String primaryTitle,
        String primarySourceId,
        Set<String> tokens,
        List<NewsItem> members,
        Instant firstSeenAt,
        Instant lastUpdatedAt,
        double velocityPerHour,
        ClusterTrend trend,
        boolean alert
) {
    public NewsCluster {
        memberIds = Set.copyOf(memberIds);
        tokens = Set.copyOf(tokens);
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
