package com.worldsentinel.analysis.detect;

import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.analysis.signal.Detection;
import com.worldsentinel.analysis.signal.SubjectKeys;
import com.worldsentinel.analysis.text.Tokenizer;
import com.worldsentinel.core.model.CorrelationOutcome;
import com.worldsentinel.core.model.CorrelationResult;
import com.worldsentinel.core.model.EntityRecord;
import com.worldsentinel.core.model.EntityType;
import com.worldsentinel.core.model.MarketQuote;
import com.worldsentinel.core.model.NewsCluster;
import com.worldsentinel.core.model.PredictionShift;
import com.worldsentinel.core.model.Severity;
import com.worldsentinel.core.model.SignalKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Market-side detections: explained and unexplained moves from correlation results, energy prices
 * rising without flow news, and prediction markets moving ahead of coverage.
 */
public class MarketDetectors {
    static final String ENERGY_SECTOR = "energy";
    static final double LARGE_MOVE_PERCENT = 5.0;
    static final int MIN_COVERAGE_MEMBERS = 2;
    static final int MIN_SHARED_TOKENS = 2;

    private final EntityRegistry registry;
    private final Tokenizer tokenizer;
    private final double flowPriceThreshold;
    private final double predictionShiftThreshold;

    public MarketDetectors(EntityRegistry registry, Tokenizer tokenizer, AnalysisSettings settings) {
        this.registry = registry;
        this.tokenizer = tokenizer;
        this.flowPriceThreshold = settings.flowPriceThreshold();
        this.predictionShiftThreshold = settings.predictionShiftThreshold();
    }

    public List<Detection> fromCorrelations(List<CorrelationResult> correlations, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (CorrelationResult result : correlations) {
            if (result.outcome() == CorrelationOutcome.SILENT_DIVERGENCE) {
                detections.add(silentDivergence(result, now));
            } else if (result.outcome() == CorrelationOutcome.EXPLAINED) {
                detections.add(explainedMove(result, now));
            }
        }
        return detections;
    }

    Detection silentDivergence(CorrelationResult result, Instant now) {
        double move = Math.abs(result.movePercent());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", result.symbol());
        details.put("movePercent", result.movePercent());
        if (result.entityId() != null) {
            details.put("entityId", result.entityId());
        }
        return new Detection(
                SignalKind.SILENT_DIVERGENCE,
                SubjectKeys.ticker(result.symbol()),
                String.format(Locale.ROOT, "Unexplained market move: %s %+.2f%%", result.symbol(), result.movePercent()),
                Math.min(0.8, 0.4 + move / 10),
                move >= LARGE_MOVE_PERCENT ? Severity.HIGH : Severity.MEDIUM,
                details,
                now
        );
    }

    Detection explainedMove(CorrelationResult result, Instant now) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("symbol", result.symbol());
        details.put("movePercent", result.movePercent());
        details.put("clusterId", result.clusterId());
        details.put("headline", result.headline());
        details.put("matchedTerm", result.matchedTerm());
        details.put("matchKind", result.matchKind().name());
        return new Detection(
                SignalKind.EXPLAINED_MARKET_MOVE,
                SubjectKeys.ticker(result.symbol()),
                String.format(Locale.ROOT, "%s %+.2f%%: %s", result.symbol(), result.movePercent(), result.headline()),
                result.confidence(),
                Severity.LOW,
                details,
                now
        );
    }

    /**
     * Energy commodities up at least the flow-price threshold while no flow disruption was reported
     * this cycle and no headline explains the move.
     */
    public List<Detection> flowPriceDivergence(
            List<MarketQuote> quotes,
            List<CorrelationResult> correlations,
            boolean flowDropReported,
            Instant now
    ) {
        List<Detection> detections = new ArrayList<>();
        if (flowDropReported) {
            return detections;
        }
        Set<String> explained = new HashSet<>();
        for (CorrelationResult result : correlations) {
            if (result.outcome() == CorrelationOutcome.EXPLAINED) {
                explained.add(SubjectKeys.ticker(result.symbol()));
            }
        }
        for (MarketQuote quote : quotes) {
            if (quote.symbol() == null || quote.symbol().isBlank() || Double.isNaN(quote.changePercent())) {
                continue;
            }
            double change = quote.changePercent();
            if (change < flowPriceThreshold || explained.contains(SubjectKeys.ticker(quote.symbol()))) {
                continue;
            }
            Optional<EntityRecord> entity = registry.resolve(quote.symbol()).filter(MarketDetectors::isEnergyCommodity);
            if (entity.isEmpty()) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("symbol", quote.symbol());
            details.put("entityId", entity.get().id());
            details.put("changePercent", change);
            detections.add(new Detection(
                    SignalKind.FLOW_PRICE_DIVERGENCE,
                    SubjectKeys.ticker(quote.symbol()),
                    String.format(Locale.ROOT, "%s up %.2f%% without pipeline flow news", entity.get().displayName(), change),
                    Math.min(0.85, 0.4 + change / 8),
                    Severity.HIGH,
                    details,
                    quote.timestamp() == null ? now : quote.timestamp()
            ));
        }
        return detections;
    }

    public List<Detection> predictionLeadsNews(List<PredictionShift> shifts, List<NewsCluster> clusters, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (PredictionShift shift : shifts) {
            if (shift.title() == null || shift.title().isBlank() || Double.isNaN(shift.shift())) {
                continue;
            }
            if (shift.shift() < predictionShiftThreshold || isCovered(shift.title(), clusters)) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            if (shift.marketId() != null) {
                details.put("marketId", shift.marketId());
            }
            details.put("previousYesPrice", shift.previousYesPrice());
            details.put("currentYesPrice", shift.currentYesPrice());
            details.put("shift", shift.shift());
            detections.add(new Detection(
                    SignalKind.PREDICTION_LEADS_NEWS,
                    SubjectKeys.title(shift.title()),
                    String.format(Locale.ROOT, "Prediction market moved %.1f pts with little coverage: %s",
                            shift.shift(), shift.title()),
                    Math.min(0.9, 0.5 + shift.shift() / 20),
                    Severity.MEDIUM,
                    details,
                    shift.observedAt() == null ? now : shift.observedAt()
            ));
        }
        return detections;
    }

    /**
     * A market counts as covered when a multi-source cluster shares at least two title tokens with it,
     * or all of them when the market title has fewer.
     */
    boolean isCovered(String marketTitle, List<NewsCluster> clusters) {
        Set<String> marketTokens = tokenizer.tokenize(marketTitle);
        if (marketTokens.isEmpty()) {
            return false;
        }
        int required = Math.min(MIN_SHARED_TOKENS, marketTokens.size());
        for (NewsCluster cluster : clusters) {
            if (cluster.size() < MIN_COVERAGE_MEMBERS) {
                continue;
            }
            int shared = 0;
            for (String token : marketTokens) {
                if (cluster.tokens().contains(token)) {
                    shared++;
                }
            }
            if (shared >= required) {
                return true;
            }
        }
        return false;
    }

    static boolean isEnergyCommodity(EntityRecord entity) {
        return entity.type() == EntityType.COMMODITY
                && entity.sector() != null
                && ENERGY_SECTOR.equalsIgnoreCase(entity.sector());
    }
}
