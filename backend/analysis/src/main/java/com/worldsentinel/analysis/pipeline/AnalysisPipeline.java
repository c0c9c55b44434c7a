package com.worldsentinel.analysis.pipeline;

import com.worldsentinel.analysis.baseline.BaselineDetector;
import com.worldsentinel.analysis.baseline.VolumeMetrics;
import com.worldsentinel.analysis.cluster.ClusteringEngine;
import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.analysis.correlation.EntityCorrelator;
import com.worldsentinel.analysis.country.CountryAttribution;
import com.worldsentinel.analysis.country.CountryInstabilityScorer;
import com.worldsentinel.analysis.country.CountrySignals;
import com.worldsentinel.analysis.country.CountryTrendState;
import com.worldsentinel.analysis.detect.MarketDetectors;
import com.worldsentinel.analysis.detect.NewsDetectors;
import com.worldsentinel.analysis.detect.SituationDetectors;
import com.worldsentinel.analysis.geo.ConvergenceGrid;
import com.worldsentinel.analysis.signal.Detection;
import com.worldsentinel.analysis.signal.DedupTable;
import com.worldsentinel.analysis.signal.SignalGenerator;
import com.worldsentinel.analysis.text.Tokenizer;
import com.worldsentinel.core.model.Baseline;
import com.worldsentinel.core.model.ConvergenceAlert;
import com.worldsentinel.core.model.CorrelationResult;
import com.worldsentinel.core.model.CountryScore;
import com.worldsentinel.core.model.CycleInput;
import com.worldsentinel.core.model.CycleOutput;
import com.worldsentinel.core.model.Deviation;
import com.worldsentinel.core.model.NewsCluster;
import com.worldsentinel.core.model.Signal;
import com.worldsentinel.core.model.SignalKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Runs the fixed stage order of one refresh cycle. {@link #computeHeavy} and {@link #finish} only read
 * the context; nothing changes until {@link #commit} installs a finished {@link CycleResult}.
 */
public class AnalysisPipeline {
    private static final Logger LOGGER = Logger.getLogger(AnalysisPipeline.class.getName());

    private final AnalysisContext context;
    private final ClusteringEngine clusteringEngine;
    private final EntityCorrelator correlator;
    private final BaselineDetector baselineDetector;
    private final ConvergenceGrid convergenceGrid;
    private final CountryAttribution attribution;
    private final CountryInstabilityScorer scorer;
    private final NewsDetectors newsDetectors;
    private final MarketDetectors marketDetectors;
    private final SituationDetectors situationDetectors;
    private final SignalGenerator signalGenerator;

    public AnalysisPipeline(AnalysisContext context) {
        this.context = context;
        AnalysisSettings settings = context.settings();
        Tokenizer tokenizer = new Tokenizer(settings.minTokenLength());
        this.clusteringEngine = new ClusteringEngine(tokenizer, settings.similarityThreshold());
        this.correlator = new EntityCorrelator(context.registry(), settings.marketMoveThreshold());
        this.baselineDetector = new BaselineDetector(settings);
        this.convergenceGrid = new ConvergenceGrid(settings);
        this.attribution = new CountryAttribution(context.registry(), context.countries());
        this.scorer = new CountryInstabilityScorer(settings.newsVolumeDampingThreshold());
        this.newsDetectors = new NewsDetectors(settings);
        this.marketDetectors = new MarketDetectors(context.registry(), tokenizer, settings);
        this.situationDetectors = new SituationDetectors(settings.ciiSpikeDelta());
        this.signalGenerator = new SignalGenerator(settings.minSignalConfidence());
    }

    public AnalysisContext context() {
        return context;
    }

    /**
     * Tokenize, cluster, and correlate. Pure over the input snapshot, safe to run on a worker thread.
     */
    public HeavyStageResult computeHeavy(CycleInput input) {
        List<NewsCluster> clusters = clusteringEngine.cluster(input.news());
        List<CorrelationResult> correlations = correlator.correlateAll(input.quotes(), clusters);
        return new HeavyStageResult(clusters, correlations);
    }

    public CycleResult finish(CycleInput input, HeavyStageResult heavy) {
        Instant now = input.capturedAt();

        Map<String, Baseline> staged = new LinkedHashMap<>();
        List<Deviation> deviations = new ArrayList<>();
        VolumeMetrics.countsFor(input).forEach((metricKey, count) -> {
            Baseline prior = context.baselineStore().get(metricKey);
            deviations.add(baselineDetector.deviation(count, prior));
            staged.put(metricKey, baselineDetector.update(prior, count, now));
        });

        List<ConvergenceAlert> convergence = convergenceGrid.detect(input.geoEvents(), now);

        Map<String, CountrySignals> countrySignals =
                attribution.attribute(heavy.clusters(), input.geoEvents(), convergence);
        List<CountryScore> scores = scorer.score(context.countries(), countrySignals, context.trendState(), now);
        CountryTrendState nextTrendState = context.trendState().advance(scores);

        List<Detection> detections = new ArrayList<>();
        List<Detection> newsDetections = newsDetectors.detect(heavy.clusters(), now);
        boolean flowDropReported = newsDetections.stream().anyMatch(d -> d.kind() == SignalKind.FLOW_DROP);
        detections.addAll(newsDetections);
        detections.addAll(marketDetectors.fromCorrelations(heavy.correlations(), now));
        detections.addAll(marketDetectors.flowPriceDivergence(input.quotes(), heavy.correlations(), flowDropReported, now));
        detections.addAll(marketDetectors.predictionLeadsNews(input.predictionShifts(), heavy.clusters(), now));
        detections.addAll(situationDetectors.keywordSpikes(deviations, now));
        detections.addAll(situationDetectors.geoConvergence(convergence, now));
        detections.addAll(situationDetectors.ciiSpikes(scores, now));
        detections.addAll(situationDetectors.militarySurges(input.militarySurges(), now));

        boolean learning = context.learningGate().isLearning(now);
        DedupTable nextDedup = context.dedup().copy();
        List<Signal> signals = signalGenerator.generate(detections, nextDedup, now, learning);

        CycleOutput output = new CycleOutput(
                heavy.clusters(),
                heavy.correlations(),
                deviations,
                convergence,
                scores,
                signals,
                learning,
                now
        );
        return new CycleResult(output, staged, nextTrendState, nextDedup);
    }

    /**
     * Installs baselines, trend state, and dedup table of a finished cycle together.
     */
    public synchronized void commit(CycleResult result) {
        context.baselineStore().putAll(result.stagedBaselines());
        context.install(result.nextTrendState(), result.nextDedup());
        LOGGER.fine(() -> "Committed cycle at " + result.output().completedAt()
                + " with " + result.output().signals().size() + " signals");
    }

    public CycleOutput runCycle(CycleInput input) {
        CycleResult result = finish(input, computeHeavy(input));
        commit(result);
        return result.output();
    }
}
