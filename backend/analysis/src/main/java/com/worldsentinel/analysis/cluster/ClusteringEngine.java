package com.worldsentinel.analysis.cluster;

import com.worldsentinel.analysis.text.InvertedIndex;
import com.worldsentinel.analysis.text.Similarity;
import com.worldsentinel.analysis.text.Tokenizer;
import com.worldsentinel.core.model.ClusterTrend;
import com.worldsentinel.core.model.NewsCluster;
import com.worldsentinel.core.model.NewsItem;
import com.worldsentinel.core.util.HashingUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Groups headlines whose token sets are at least {@code threshold} similar, transitively.
 *
 * <p>Only pairs that share a token are compared. Items are put into a canonical order before
 * grouping, so the resulting partition and every derived field depend only on the input set.
 */
public class ClusteringEngine {
    private static final Logger LOGGER = Logger.getLogger(ClusteringEngine.class.getName());
    private static final Duration MIN_SPAN = Duration.ofMinutes(1);
    private static final double TREND_MARGIN = 0.2;

    static final Comparator<NewsItem> CANONICAL_ORDER = Comparator
            .comparing(NewsItem::id)
            .thenComparing(NewsItem::publishedAt)
            .thenComparing(NewsItem::sourceId)
            .thenComparing(NewsItem::title);

    static final Comparator<NewsItem> PRIMARY_ORDER = Comparator
            .comparingInt(NewsItem::sourceTier)
            .thenComparing(NewsItem::publishedAt, Comparator.reverseOrder())
            .thenComparing(NewsItem::id);

    private static final Comparator<NewsItem> EARLIEST_FIRST = Comparator
            .comparing(NewsItem::publishedAt)
            .thenComparing(NewsItem::sourceId)
            .thenComparing(NewsItem::title)
            .thenComparing(NewsItem::id);

    private static final Comparator<NewsCluster> OUTPUT_ORDER = Comparator
            .comparing(NewsCluster::lastUpdatedAt, Comparator.reverseOrder())
            .thenComparing(NewsCluster::id);

    private final Tokenizer tokenizer;
    private final double threshold;

    public ClusteringEngine(Tokenizer tokenizer, double threshold) {
        this.tokenizer = tokenizer;
        this.threshold = threshold;
    }

    public List<NewsCluster> cluster(List<NewsItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<NewsItem> canonical = canonicalize(items);

        Map<String, Set<String>> tokenCache = new HashMap<>();
        List<Set<String>> tokenSets = new ArrayList<>(canonical.size());
        for (NewsItem item : canonical) {
            tokenSets.add(tokenCache.computeIfAbsent(item.title(), tokenizer::tokenize));
        }

        InvertedIndex index = InvertedIndex.build(tokenSets);
        UnionFind groups = new UnionFind(canonical.size());
        int comparisons = 0;
        for (int i = 0; i < canonical.size(); i++) {
            for (int j : index.candidatesAfter(i)) {
                comparisons++;
                if (Similarity.jaccard(tokenSets.get(i), tokenSets.get(j)) >= threshold) {
                    groups.union(i, j);
                }
            }
        }

        Map<Integer, List<Integer>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < canonical.size(); i++) {
            byRoot.computeIfAbsent(groups.find(i), ignored -> new ArrayList<>()).add(i);
        }

        List<NewsCluster> clusters = new ArrayList<>(byRoot.size());
        for (List<Integer> positions : byRoot.values()) {
            clusters.add(buildCluster(positions, canonical, tokenSets));
        }
        clusters.sort(OUTPUT_ORDER);
        LOGGER.fine(() -> "Clustered " + canonical.size() + " items into " + byRoot.size()
                + " clusters using " + index.tokenCount() + " tokens");
        LOGGER.finer("Candidate comparisons: " + comparisons);
        return clusters;
    }

    private static List<NewsItem> canonicalize(List<NewsItem> items) {
        List<NewsItem> sorted = new ArrayList<>(items);
        sorted.sort(CANONICAL_ORDER);
        Map<String, NewsItem> byId = new LinkedHashMap<>();
        for (NewsItem item : sorted) {
            byId.putIfAbsent(item.id(), item);
        }
        return new ArrayList<>(byId.values());
    }

    private NewsCluster buildCluster(List<Integer> positions, List<NewsItem> canonical, List<Set<String>> tokenSets) {
        List<NewsItem> members = new ArrayList<>(positions.size());
        Set<String> tokens = new LinkedHashSet<>();
        for (int position : positions) {
            members.add(canonical.get(position));
            tokens.addAll(tokenSets.get(position));
        }
        members.sort(PRIMARY_ORDER);
        NewsItem primary = members.get(0);

        Instant firstSeen = members.stream().map(NewsItem::publishedAt).min(Comparator.naturalOrder()).orElseThrow();
        Instant lastUpdated = members.stream().map(NewsItem::publishedAt).max(Comparator.naturalOrder()).orElseThrow();
        Duration span = Duration.between(firstSeen, lastUpdated);

        Set<String> memberIds = new LinkedHashSet<>();
        for (NewsItem member : members) {
            memberIds.add(member.id());
        }

        return new NewsCluster(
                clusterId(members),
                memberIds,
                primary.id(),
                primary.title(),
                primary.sourceId(),
                tokens,
                members,
                firstSeen,
                lastUpdated,
                velocityPerHour(members.size(), span),
                trend(members, firstSeen, span),
                members.stream().anyMatch(NewsItem::alert)
        );
    }

    /**
     * Identified by its earliest member so the id survives new members joining in later cycles.
     */
    static String clusterId(List<NewsItem> members) {
        NewsItem earliest = members.stream().min(EARLIEST_FIRST).orElseThrow();
        return HashingUtils.shortId(
                "cluster",
                earliest.sourceId(),
                earliest.title().toLowerCase(Locale.ROOT).trim(),
                earliest.publishedAt().toString()
        );
    }

    static double velocityPerHour(int memberCount, Duration span) {
        Duration effective = span.compareTo(MIN_SPAN) < 0 ? MIN_SPAN : span;
        double hours = effective.toMillis() / 3_600_000.0;
        return memberCount / hours;
    }

    static ClusterTrend trend(List<NewsItem> members, Instant firstSeen, Duration span) {
        if (members.size() < 2 || span.compareTo(MIN_SPAN) < 0) {
            return ClusterTrend.STABLE;
        }
        Instant midpoint = firstSeen.plus(span.dividedBy(2));
        int firstHalf = 0;
        int secondHalf = 0;
        for (NewsItem member : members) {
            if (member.publishedAt().isBefore(midpoint)) {
                firstHalf++;
            } else {
                secondHalf++;
            }
        }
        if (secondHalf > firstHalf * (1 + TREND_MARGIN)) {
            return ClusterTrend.RISING;
        }
        if (secondHalf < firstHalf * (1 - TREND_MARGIN)) {
            return ClusterTrend.FALLING;
        }
        return ClusterTrend.STABLE;
    }
}
