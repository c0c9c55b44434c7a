package com.worldsentinel.analysis.detect;

import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.analysis.entity.TextMatcher;
import com.worldsentinel.analysis.signal.Detection;
import com.worldsentinel.analysis.signal.SubjectKeys;
import com.worldsentinel.core.model.ClusterTrend;
import com.worldsentinel.core.model.NewsCluster;
import com.worldsentinel.core.model.NewsItem;
import com.worldsentinel.core.model.Severity;
import com.worldsentinel.core.model.SignalKind;
import com.worldsentinel.core.model.SourceType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cluster-level detections: velocity spikes, multi-source convergence, triangulation across wire,
 * government and intelligence sources, and pipeline flow disruptions.
 */
public class NewsDetectors {
    static final Set<SourceType> TRIANGULATION_TYPES = EnumSet.of(SourceType.WIRE, SourceType.GOV, SourceType.INTEL);
    static final double TRIANGULATION_CONFIDENCE = 0.9;

    private final double velocitySpikeThreshold;
    private final int minClusterSize;
    private final Duration convergenceWindow;
    private final List<String> pipelineKeywords;
    private final List<String> flowDropKeywords;

    public NewsDetectors(AnalysisSettings settings) {
        this.velocitySpikeThreshold = settings.velocitySpikeThreshold();
        this.minClusterSize = settings.minClusterSizeForSpike();
        this.convergenceWindow = settings.sourceConvergenceWindow();
        this.pipelineKeywords = settings.pipelineKeywords();
        this.flowDropKeywords = settings.flowDropKeywords();
    }

    public List<Detection> detect(List<NewsCluster> clusters, Instant now) {
        List<Detection> detections = new ArrayList<>();
        for (NewsCluster cluster : clusters) {
            velocitySpike(cluster, now).ifPresent(detections::add);
            sourceConvergence(cluster, now).ifPresent(detections::add);
            triangulation(cluster, now).ifPresent(detections::add);
            flowDrop(cluster, now).ifPresent(detections::add);
        }
        return detections;
    }

    Optional<Detection> velocitySpike(NewsCluster cluster, Instant now) {
        double velocity = cluster.velocityPerHour();
        if (cluster.size() < minClusterSize || cluster.trend() != ClusterTrend.RISING || velocity < velocitySpikeThreshold) {
            return Optional.empty();
        }
        Map<String, Object> details = clusterDetails(cluster);
        details.put("velocityPerHour", velocity);
        return Optional.of(new Detection(
                SignalKind.VELOCITY_SPIKE,
                SubjectKeys.cluster(cluster.id()),
                String.format(Locale.ROOT, "Coverage accelerating: %s (%.1f/h)", cluster.primaryTitle(), velocity),
                Math.min(0.85, 0.4 + velocity / 20),
                velocity >= velocitySpikeThreshold * 2 ? Severity.HIGH : Severity.MEDIUM,
                details,
                cluster.lastUpdatedAt()
        ));
    }

    Optional<Detection> sourceConvergence(NewsCluster cluster, Instant now) {
        Instant cutoff = now.minus(convergenceWindow);
        List<NewsItem> recent = cluster.members().stream()
                .filter(item -> item.publishedAt() != null && !item.publishedAt().isBefore(cutoff))
                .toList();
        if (recent.size() < minClusterSize) {
            return Optional.empty();
        }
        Set<SourceType> types = EnumSet.noneOf(SourceType.class);
        recent.forEach(item -> types.add(item.sourceType()));
        if (types.size() < 3) {
            return Optional.empty();
        }
        Map<String, Object> details = clusterDetails(cluster);
        details.put("sourceTypes", types.stream().map(Enum::name).toList());
        details.put("recentItems", recent.size());
        return Optional.of(new Detection(
                SignalKind.SOURCE_CONVERGENCE,
                SubjectKeys.cluster(cluster.id()),
                "Multiple source types converging: " + cluster.primaryTitle(),
                Math.min(0.95, 0.6 + types.size() * 0.1),
                Severity.HIGH,
                details,
                cluster.lastUpdatedAt()
        ));
    }

    Optional<Detection> triangulation(NewsCluster cluster, Instant now) {
        Set<SourceType> types = EnumSet.noneOf(SourceType.class);
        cluster.members().forEach(item -> types.add(item.sourceType()));
        if (!types.containsAll(TRIANGULATION_TYPES)) {
            return Optional.empty();
        }
        return Optional.of(new Detection(
                SignalKind.TRIANGULATION,
                SubjectKeys.cluster(cluster.id()),
                "Wire, government and intelligence sources aligned: " + cluster.primaryTitle(),
                TRIANGULATION_CONFIDENCE,
                Severity.HIGH,
                clusterDetails(cluster),
                cluster.lastUpdatedAt()
        ));
    }

    Optional<Detection> flowDrop(NewsCluster cluster, Instant now) {
        boolean mentioned = cluster.members().stream()
                .map(NewsItem::title)
                .anyMatch(title -> anyWord(title, pipelineKeywords) && anyWord(title, flowDropKeywords));
        if (!mentioned) {
            return Optional.empty();
        }
        return Optional.of(new Detection(
                SignalKind.FLOW_DROP,
                SubjectKeys.cluster(cluster.id()),
                "Pipeline flow disruption reported: " + cluster.primaryTitle(),
                Math.min(0.9, 0.4 + cluster.size() / 10.0),
                Severity.MEDIUM,
                clusterDetails(cluster),
                cluster.lastUpdatedAt()
        ));
    }

    private static boolean anyWord(String title, List<String> words) {
        for (String word : words) {
            if (TextMatcher.containsWord(title, word)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> clusterDetails(NewsCluster cluster) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("clusterId", cluster.id());
        details.put("headline", cluster.primaryTitle());
        details.put("memberCount", cluster.size());
        return details;
    }
}
