package com.worldsentinel.service.runtime;

import com.worldsentinel.analysis.api.FeedContext;
import com.worldsentinel.analysis.api.FeedSource;
import com.worldsentinel.analysis.pipeline.AnalysisPipeline;
import com.worldsentinel.analysis.pipeline.CycleResult;
import com.worldsentinel.analysis.pipeline.HeavyStageResult;
import com.worldsentinel.core.bus.EventBus;
import com.worldsentinel.core.events.AlertRaised;
import com.worldsentinel.core.events.CountryScoresUpdated;
import com.worldsentinel.core.events.CycleCompleted;
import com.worldsentinel.core.events.CycleSkipped;
import com.worldsentinel.core.events.CycleStarted;
import com.worldsentinel.core.events.SignalRaised;
import com.worldsentinel.core.model.CycleInput;
import com.worldsentinel.core.model.CycleOutput;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.MarketQuote;
import com.worldsentinel.core.model.MilitarySurge;
import com.worldsentinel.core.model.NewsItem;
import com.worldsentinel.core.model.PredictionShift;
import com.worldsentinel.core.model.Signal;
import com.worldsentinel.service.config.RuntimeSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives refresh cycles: a timer thread fires ticks, a single orchestration thread runs one cycle at a
 * time, and clustering plus correlation run on a worker pool behind a bounded wait. A tick that finds
 * a cycle still in flight is skipped, never queued.
 */
public class RefreshCycleService {
    private static final Logger LOGGER = Logger.getLogger(RefreshCycleService.class.getName());

    private final AnalysisPipeline pipeline;
    private final CycleFeeds feeds;
    private final FeedContext context;
    private final RuntimeSettings settings;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService cycleExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService workerPool;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong();

    public RefreshCycleService(AnalysisPipeline pipeline, CycleFeeds feeds, FeedContext context, RuntimeSettings settings) {
        this(pipeline, feeds, context, settings, 1000);
    }

    RefreshCycleService(
            AnalysisPipeline pipeline,
            CycleFeeds feeds,
            FeedContext context,
            RuntimeSettings settings,
            long minIntervalMillis
    ) {
        this.pipeline = pipeline;
        this.feeds = feeds;
        this.context = context;
        this.settings = settings;
        this.minIntervalMillis = minIntervalMillis;
        this.workerPool = Executors.newFixedThreadPool(settings.workerThreads());
    }

    public void start() {
        long intervalMillis = Math.max(minIntervalMillis, settings.cycleInterval().toMillis());
        timerExecutor.scheduleAtFixedRate(this::tick, 0, intervalMillis, TimeUnit.MILLISECONDS);
        LOGGER.info(() -> "Refresh loop started, interval " + Duration.ofMillis(intervalMillis));
    }

    /**
     * Runs one cycle on the calling thread. Empty when the cycle was skipped or abandoned.
     */
    public Optional<CycleOutput> runOnce() {
        if (!inFlight.compareAndSet(false, true)) {
            skip();
            return Optional.empty();
        }
        return runClaimed();
    }

    public boolean isCycleInFlight() {
        return inFlight.get();
    }

    public void shutdown() {
        timerExecutor.shutdown();
        cycleExecutor.shutdown();
        workerPool.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            cycleExecutor.awaitTermination(5, TimeUnit.SECONDS);
            workerPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void tick() {
        if (!inFlight.compareAndSet(false, true)) {
            skip();
            return;
        }
        cycleExecutor.submit(this::runClaimed);
    }

    private void skip() {
        LOGGER.warning("Previous cycle still running; skipping this tick");
        context.eventBus().publish(new CycleSkipped(context.clock().instant(), "previous cycle still running"));
    }

    private Optional<CycleOutput> runClaimed() {
        boolean releaseNow = true;
        long cycleNumber = cycleCounter.incrementAndGet();
        Instant started = context.clock().instant();
        EventBus bus = context.eventBus();
        try {
            bus.publish(new CycleStarted(started, cycleNumber));
            CycleInput input = collect(started);

            CompletableFuture<HeavyStageResult> heavy =
                    CompletableFuture.supplyAsync(() -> pipeline.computeHeavy(input), workerPool);
            HeavyStageResult heavyResult;
            try {
                heavyResult = heavy.get(settings.cycleTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // The worker keeps the cycle slot until it drains.
                releaseNow = false;
                heavy.whenComplete((ignored, error) -> inFlight.set(false));
                abandon(cycleNumber, started, "Cycle " + cycleNumber + " exceeded " + settings.cycleTimeout());
                return Optional.empty();
            } catch (ExecutionException e) {
                LOGGER.log(Level.WARNING, "Cycle " + cycleNumber + " heavy stage failed", e.getCause());
                abandon(cycleNumber, started, "Cycle " + cycleNumber + " failed: " + e.getCause().getMessage());
                return Optional.empty();
            }

            CycleResult result = pipeline.finish(input, heavyResult);
            pipeline.commit(result);
            CycleOutput output = result.output();
            publishOutput(output);

            long durationMillis = Duration.between(started, context.clock().instant()).toMillis();
            bus.publish(new CycleCompleted(context.clock().instant(), cycleNumber, true, durationMillis,
                    output.clusters().size(), output.signals().size()));
            LOGGER.info(() -> "Cycle " + cycleNumber + " committed: " + output.clusters().size() + " clusters, "
                    + output.signals().size() + " signals in " + durationMillis + "ms");
            return Optional.of(output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(cycleNumber, started, "Cycle " + cycleNumber + " interrupted");
            return Optional.empty();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Cycle " + cycleNumber + " failed", e);
            abandon(cycleNumber, started, "Cycle " + cycleNumber + " failed: " + e.getMessage());
            return Optional.empty();
        } finally {
            if (releaseNow) {
                inFlight.set(false);
            }
        }
    }

    private CycleInput collect(Instant capturedAt) {
        CompletableFuture<List<NewsItem>> news = request(feeds.news());
        CompletableFuture<List<MarketQuote>> quotes = request(feeds.quotes());
        CompletableFuture<List<GeoEvent>> geo = request(feeds.geoEvents());
        CompletableFuture<List<PredictionShift>> predictions = request(feeds.predictionShifts());
        CompletableFuture<List<MilitarySurge>> surges = request(feeds.militarySurges());
        return new CycleInput(
                batch(feeds.news(), news),
                batch(feeds.quotes(), quotes),
                batch(feeds.geoEvents(), geo),
                batch(feeds.predictionShifts(), predictions),
                batch(feeds.militarySurges(), surges),
                capturedAt
        );
    }

    private <T> CompletableFuture<List<T>> request(FeedSource<T> feed) {
        try {
            return feed.fetch(context).orTimeout(context.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> List<T> batch(FeedSource<T> feed, CompletableFuture<List<T>> future) {
        try {
            List<T> items = future.join();
            if (items == null) {
                return List.of();
            }
            List<T> present = items.stream().filter(Objects::nonNull).toList();
            if (present.size() < items.size()) {
                LOGGER.warning("Feed " + feed.name() + " returned " + (items.size() - present.size())
                        + " null entries; dropped");
            }
            return present;
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOGGER.log(Level.WARNING, "Feed " + feed.name() + " failed; continuing with an empty batch", cause);
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "feed",
                    "Feed fetch failed: " + feed.name() + " - " + cause.getMessage(),
                    Map.of("feed", feed.name())
            ));
            return List.of();
        }
    }

    private void publishOutput(CycleOutput output) {
        EventBus bus = context.eventBus();
        for (Signal signal : output.signals()) {
            bus.publish(new SignalRaised(output.completedAt(), signal));
        }
        bus.publish(new CountryScoresUpdated(output.completedAt(), output.countryScores(), output.learning()));
    }

    private void abandon(long cycleNumber, Instant started, String message) {
        LOGGER.warning(message + "; nothing committed");
        Instant now = context.clock().instant();
        context.eventBus().publish(new AlertRaised(now, "cycle", message, Map.of("cycle", cycleNumber)));
        context.eventBus().publish(new CycleCompleted(now, cycleNumber, false,
                Duration.between(started, now).toMillis(), 0, 0));
    }
}
