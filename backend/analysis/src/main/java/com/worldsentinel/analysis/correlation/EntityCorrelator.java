package com.worldsentinel.analysis.correlation;

import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.core.model.CorrelationResult;
import com.worldsentinel.core.model.CorrelationOutcome;
import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.model.MarketQuote;
import com.worldsentinel.core.model.MatchKind;
import com.worldsentinel.core.model.NewsCluster;
import com.worldsentinel.core.model.NewsItem;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Explains market moves with news: a mover is "explained" when a cluster headline mentions the
 * entity, a keyword of it, or a sector peer / related entity; otherwise it is a silent divergence.
 */
public class EntityCorrelator {
    private static final Comparator<Match> BEST_MATCH = Comparator
            .comparingDouble((Match match) -> match.kind().confidence()).reversed()
            .thenComparing(match -> match.cluster().size(), Comparator.reverseOrder())
            .thenComparing(match -> match.cluster().lastUpdatedAt(), Comparator.reverseOrder())
            .thenComparing(match -> match.cluster().id());

    private final EntityRegistry registry;
    private final double moveThresholdPercent;

    public EntityCorrelator(EntityRegistry registry, double moveThresholdPercent) {
        this.registry = registry;
        this.moveThresholdPercent = moveThresholdPercent;
    }

    public List<CorrelationResult> correlateAll(List<MarketQuote> quotes, List<NewsCluster> clusters) {
        List<CorrelationResult> results = new ArrayList<>();
        for (MarketQuote quote : quotes) {
            if (quote.symbol() == null || quote.symbol().isBlank() || Double.isNaN(quote.changePercent())) {
                continue;
            }
            CorrelationResult result = correlate(quote.symbol(), quote.changePercent(), clusters);
            if (result.outcome() != CorrelationOutcome.BELOW_THRESHOLD) {
                results.add(result);
            }
        }
        results.sort(Comparator.comparing(CorrelationResult::symbol));
        return results;
    }

    public CorrelationResult correlate(String symbol, double movePercent, List<NewsCluster> clusters) {
        Optional<EntityRecord> entity = registry.resolve(symbol);
        String entityId = entity.map(EntityRecord::id).orElse(null);
        if (Math.abs(movePercent) < moveThresholdPercent) {
            return CorrelationResult.belowThreshold(symbol, movePercent, entityId);
        }

        List<SearchTerm> terms = searchTerms(symbol, entity.orElse(null));
        Optional<Match> match = bestMatch(terms, clusters, cluster -> List.of(cluster.primaryTitle()));
        if (match.isEmpty()) {
            match = bestMatch(terms, clusters, cluster -> cluster.members().stream().map(NewsItem::title).toList());
        }
        if (match.isEmpty()) {
            return CorrelationResult.silentDivergence(symbol, movePercent, entityId);
        }
        Match best = match.get();
        return new CorrelationResult(
                symbol,
                movePercent,
                CorrelationOutcome.EXPLAINED,
                entityId,
                best.cluster().id(),
                best.cluster().primaryTitle(),
                best.term(),
                best.kind(),
                best.kind().confidence()
        );
    }

    /**
     * Own aliases and keywords, plus the aliases of sector peers and directly related entities.
     * Expansion stops after that single hop.
     */
    List<SearchTerm> searchTerms(String symbol, EntityRecord entity) {
        Map<String, SearchTerm> terms = new LinkedHashMap<>();
        if (entity == null) {
            add(terms, symbol, MatchKind.ALIAS);
            return List.copyOf(terms.values());
        }
        add(terms, entity.displayName(), MatchKind.ALIAS);
        entity.aliases().stream().sorted().forEach(alias -> add(terms, alias, MatchKind.ALIAS));
        entity.keywords().stream().sorted().forEach(keyword -> add(terms, keyword, MatchKind.KEYWORD));

        List<EntityRecord> neighbours = new ArrayList<>(registry.bySector(entity.sector()));
        entity.relatedIds().stream().sorted().map(registry::byId).flatMap(Optional::stream).forEach(neighbours::add);
        for (EntityRecord neighbour : neighbours) {
            if (neighbour.id().equals(entity.id())) {
                continue;
            }
            add(terms, neighbour.displayName(), MatchKind.RELATED);
            neighbour.aliases().stream().sorted().forEach(alias -> add(terms, alias, MatchKind.RELATED));
        }
        return List.copyOf(terms.values());
    }

    private static void add(Map<String, SearchTerm> terms, String term, MatchKind kind) {
        if (term == null || term.isBlank()) {
            return;
        }
        String key = term.trim().toLowerCase(Locale.ROOT);
        SearchTerm existing = terms.get(key);
        if (existing == null || kind.confidence() > existing.kind().confidence()) {
            terms.put(key, new SearchTerm(term.trim(), kind));
        }
    }

    private static Optional<Match> bestMatch(
            List<SearchTerm> terms,
            List<NewsCluster> clusters,
            Function<NewsCluster, List<String>> titles
    ) {
        List<Match> matches = new ArrayList<>();
        for (NewsCluster cluster : clusters) {
            Map<MatchKind, SearchTerm> byKind = new EnumMap<>(MatchKind.class);
            for (String title : titles.apply(cluster)) {
                for (SearchTerm term : terms) {
                    if (!byKind.containsKey(term.kind()) && term.matches(title)) {
                        byKind.put(term.kind(), term);
                    }
                }
            }
            // Several matching terms on one cluster count once, at the strongest kind.
            byKind.values().stream()
                    .max(Comparator.comparingDouble(term -> term.kind().confidence()))
                    .ifPresent(term -> matches.add(new Match(cluster, term.term(), term.kind())));
        }
        return matches.stream().min(BEST_MATCH);
    }

    private record Match(NewsCluster cluster, String term, MatchKind kind) {
    }
}
