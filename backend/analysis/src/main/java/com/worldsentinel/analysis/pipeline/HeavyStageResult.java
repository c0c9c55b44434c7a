package com.worldsentinel.analysis.pipeline;

import com.worldsentinel.core.model.CorrelationResult;
import com.worldsentinel.core.model.NewsCluster;

import java.util.List;

/**
 * Output of the clustering and correlation stage, the part that runs on a worker thread.
 */
public record HeavyStageResult(List<NewsCluster> clusters, List<CorrelationResult> correlations) {
    public HeavyStageResult {
        clusters = List.copyOf(clusters);
        correlations = List.copyOf(correlations);
    }
}
