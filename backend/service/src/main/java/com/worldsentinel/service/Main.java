package com.worldsentinel.service;

import com.worldsentinel.analysis.api.FeedContext;
import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.analysis.pipeline.AnalysisContext;
import com.worldsentinel.analysis.pipeline.AnalysisPipeline;
import com.worldsentinel.analysis.pipeline.LearningGate;
import com.worldsentinel.core.bus.EventBus;
import com.worldsentinel.core.events.Event;
import com.worldsentinel.core.model.MonitoredCountry;
import com.worldsentinel.service.config.ConfigLoader;
import com.worldsentinel.service.config.ServiceSettings;
import com.worldsentinel.service.feed.JsonFileFeedSource;
import com.worldsentinel.service.runtime.CycleDiagnostics;
import com.worldsentinel.service.runtime.CycleFeeds;
import com.worldsentinel.service.runtime.RefreshCycleService;
import com.worldsentinel.service.store.EventCodec;
import com.worldsentinel.service.store.EventStore;
import com.worldsentinel.service.store.JsonFileBaselineStore;
import com.worldsentinel.service.store.JsonlEventStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Duration REPLAY_WINDOW = Duration.ofHours(24);
    private static final int REPLAY_LIMIT = 10_000;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        installLogging();
        boolean once = List.of(args).contains("--once");
        Path configDir = Path.of("config");
        Path baselineFile = Path.of("state/baselines.json");
        Path eventLogFile = Path.of("logs/events.jsonl");
        Path inboxDir = Path.of("data/inbox");
        Clock clock = Clock.systemUTC();

        ServiceSettings settings;
        EntityRegistry registry;
        List<MonitoredCountry> countries;
        try {
            settings = ConfigLoader.loadSettings(configDir);
            registry = EntityRegistry.build(ConfigLoader.loadEntities(configDir));
            countries = ConfigLoader.loadCountries(configDir);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Invalid configuration in " + configDir.toAbsolutePath(), e);
            System.exit(1);
            return;
        }

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        CycleDiagnostics diagnostics = new CycleDiagnostics(eventBus);
        replayRecentHistory(eventStore, diagnostics, clock);
        EventCodec.subscribeAll(eventBus, eventStore::append);

        AnalysisContext analysisContext = new AnalysisContext(
                settings.analysis(),
                registry,
                countries,
                new JsonFileBaselineStore(baselineFile),
                new LearningGate(clock.instant(), settings.analysis().learningWarmup())
        );
        CycleFeeds feeds = new CycleFeeds(
                JsonFileFeedSource.news(inboxDir),
                JsonFileFeedSource.quotes(inboxDir),
                JsonFileFeedSource.geoEvents(inboxDir),
                JsonFileFeedSource.predictionShifts(inboxDir),
                JsonFileFeedSource.militarySurges(inboxDir)
        );
        FeedContext feedContext = new FeedContext(eventBus, clock, settings.runtime().requestTimeout(), Map.of());
        RefreshCycleService refreshService = new RefreshCycleService(
                new AnalysisPipeline(analysisContext),
                feeds,
                feedContext,
                settings.runtime()
        );

        LOGGER.info("Loaded " + registry.size() + " entities and " + countries.size() + " monitored countries");

        if (once) {
            refreshService.runOnce();
            refreshService.shutdown();
            LOGGER.info(() -> "Diagnostics: " + diagnostics.snapshot());
            return;
        }

        refreshService.start();
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            refreshService.shutdown();
            LOGGER.info(() -> "Diagnostics: " + diagnostics.snapshot());
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    private static void replayRecentHistory(EventStore eventStore, CycleDiagnostics diagnostics, Clock clock) {
        try {
            List<Event> history = eventStore.query(clock.instant().minus(REPLAY_WINDOW), Optional.empty(), REPLAY_LIMIT);
            int applied = diagnostics.replay(history);
            LOGGER.info("Replayed " + applied + " logged events from the last " + REPLAY_WINDOW.toHours() + "h");
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not replay event log; diagnostics start from zero", e);
        }
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read bundled logging.properties; using JVM defaults", e);
        }
    }
}
