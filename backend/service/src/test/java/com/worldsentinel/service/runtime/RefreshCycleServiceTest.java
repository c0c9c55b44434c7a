package com.worldsentinel.service.runtime;

import com.worldsentinel.analysis.api.FeedContext;
import com.worldsentinel.analysis.api.InMemoryBaselineStore;
import com.worldsentinel.analysis.config.AnalysisSettings;
import com.worldsentinel.analysis.entity.EntityRegistry;
import com.worldsentinel.analysis.pipeline.AnalysisContext;
import com.worldsentinel.analysis.pipeline.AnalysisPipeline;
import com.worldsentinel.analysis.pipeline.HeavyStageResult;
import com.worldsentinel.analysis.pipeline.LearningGate;
import com.worldsentinel.core.bus.EventBus;
import com.worldsentinel.core.events.AlertRaised;
import com.worldsentinel.core.events.CountryScoresUpdated;
import com.worldsentinel.core.events.CycleCompleted;
import com.worldsentinel.core.events.CycleSkipped;
import com.worldsentinel.core.events.CycleStarted;
import com.worldsentinel.core.model.CycleInput;
import com.worldsentinel.core.model.CycleOutput;
import com.worldsentinel.core.model.MonitoredCountry;
import com.worldsentinel.core.model.NewsItem;
import com.worldsentinel.core.model.SourceType;
import com.worldsentinel.service.config.RuntimeSettings;
import com.worldsentinel.service.support.StubFeed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefreshCycleServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final EventBus bus = new EventBus();
    private final InMemoryBaselineStore store = new InMemoryBaselineStore();
    private final List<AlertRaised> alerts = new CopyOnWriteArrayList<>();
    private final List<CycleCompleted> completed = new CopyOnWriteArrayList<>();
    private RefreshCycleService service;

    RefreshCycleServiceTest() {
        bus.subscribe(AlertRaised.class, alerts::add);
        bus.subscribe(CycleCompleted.class, completed::add);
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    @Test
    void runOnceCommitsAndPublishesCycleEvents() {
        List<CycleStarted> started = new CopyOnWriteArrayList<>();
        List<CountryScoresUpdated> scores = new CopyOnWriteArrayList<>();
        bus.subscribe(CycleStarted.class, started::add);
        bus.subscribe(CountryScoresUpdated.class, scores::add);
        service = service(pipeline(), feeds(StubFeed.of("news", headlines())), Duration.ofSeconds(5));

        Optional<CycleOutput> output = service.runOnce();

        assertTrue(output.isPresent());
        assertEquals(2, output.get().clusters().size());
        assertEquals(1, started.size());
        assertEquals(1, completed.size());
        assertTrue(completed.get(0).committed());
        assertEquals(2, completed.get(0).clusterCount());
        assertEquals(1, scores.size());
        assertEquals(1, scores.get(0).scores().size());
        assertEquals(1, store.get("news:all").observations().size());
        assertFalse(service.isCycleInFlight());
    }

    @Test
    void failingFeedRaisesAlertAndCycleStillCommits() {
        service = service(pipeline(), feeds(StubFeed.failing("news", new IllegalStateException("upstream 503"))),
                Duration.ofSeconds(5));

        Optional<CycleOutput> output = service.runOnce();

        assertTrue(output.isPresent());
        assertTrue(output.get().clusters().isEmpty());
        assertEquals(1, alerts.size());
        assertEquals("feed", alerts.get(0).category());
        assertEquals("news", alerts.get(0).details().get("feed"));
        assertTrue(alerts.get(0).message().contains("upstream 503"));
        assertTrue(completed.get(0).committed());
    }

    @Test
    void nullFeedEntriesAreDroppedAndCycleCommits() {
        List<NewsItem> withGaps = new ArrayList<>(headlines());
        withGaps.add(1, null);
        withGaps.add(null);
        service = service(pipeline(), feeds(StubFeed.of("news", withGaps)), Duration.ofSeconds(5));

        Optional<CycleOutput> output = service.runOnce();

        assertTrue(output.isPresent());
        assertEquals(2, output.get().clusters().size());
        assertTrue(completed.get(0).committed());
        assertTrue(alerts.isEmpty());
        assertEquals(1, store.get("news:all").observations().size());
    }

    @Test
    void hangingFeedTimesOutIntoEmptyBatch() {
        service = service(pipeline(), feeds(StubFeed.hanging("news")), Duration.ofSeconds(5));

        Optional<CycleOutput> output = service.runOnce();

        assertTrue(output.isPresent());
        assertEquals(1, alerts.size());
        assertEquals("news", alerts.get(0).details().get("feed"));
    }

    @Test
    void slowHeavyStageAbandonsCycleWithoutCommitting() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AnalysisPipeline blocking = new AnalysisPipeline(context()) {
            @Override
            public HeavyStageResult computeHeavy(CycleInput input) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.computeHeavy(input);
            }
        };
        List<CycleSkipped> skipped = new CopyOnWriteArrayList<>();
        bus.subscribe(CycleSkipped.class, skipped::add);
        service = service(blocking, feeds(StubFeed.of("news", headlines())), Duration.ofMillis(100));

        Optional<CycleOutput> first = service.runOnce();

        assertTrue(first.isEmpty());
        assertFalse(completed.get(0).committed());
        assertEquals("cycle", alerts.get(0).category());
        assertTrue(store.snapshot().isEmpty());
        assertTrue(service.isCycleInFlight());

        assertTrue(service.runOnce().isEmpty());
        assertEquals(1, skipped.size());
        assertEquals(1, completed.size());

        release.countDown();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (service.isCycleInFlight() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(service.isCycleInFlight());
        assertTrue(store.snapshot().isEmpty());
    }

    @Test
    void heavyStageFailureAbandonsAndReleasesSlot() {
        AnalysisPipeline failing = new AnalysisPipeline(context()) {
            @Override
            public HeavyStageResult computeHeavy(CycleInput input) {
                throw new IllegalStateException("index corrupted");
            }
        };
        service = service(failing, feeds(StubFeed.of("news", headlines())), Duration.ofSeconds(5));

        assertTrue(service.runOnce().isEmpty());
        assertFalse(completed.get(0).committed());
        assertTrue(alerts.get(0).message().contains("index corrupted"));
        assertFalse(service.isCycleInFlight());
    }

    @Test
    void scheduledTicksRunCycles() throws Exception {
        StubFeed<NewsItem> news = StubFeed.of("news", headlines());
        service = new RefreshCycleService(pipeline(), feeds(news), feedContext(),
                new RuntimeSettings(Duration.ofMillis(20), Duration.ofSeconds(5), Duration.ofSeconds(1), 1), 10);

        service.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (completed.size() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        service.shutdown();

        assertTrue(completed.size() >= 2);
        assertTrue(news.fetches() >= 2);
    }

    private RefreshCycleService service(AnalysisPipeline pipeline, CycleFeeds feeds, Duration cycleTimeout) {
        return new RefreshCycleService(pipeline, feeds, feedContext(),
                new RuntimeSettings(Duration.ofMinutes(5), cycleTimeout, Duration.ofMillis(200), 1));
    }

    private AnalysisPipeline pipeline() {
        return new AnalysisPipeline(context());
    }

    private AnalysisContext context() {
        return new AnalysisContext(AnalysisSettings.defaults(), EntityRegistry.build(List.of()),
                List.of(new MonitoredCountry("UA", "Ukraine", 55)), store, LearningGate.disabled());
    }

    private FeedContext feedContext() {
        return new FeedContext(bus, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMillis(200), Map.of());
    }

    private static CycleFeeds feeds(StubFeed<NewsItem> news) {
        return new CycleFeeds(news, StubFeed.of("quotes", List.of()), StubFeed.of("geo-events", List.of()),
                StubFeed.of("prediction-shifts", List.of()), StubFeed.of("military-surges", List.of()));
    }

    private static List<NewsItem> headlines() {
        return List.of(
                new NewsItem("a", "reuters", "Broadcom AI Revenue Beats Estimates", null, NOW, 1, SourceType.WIRE,
                        "markets", false),
                new NewsItem("b", "cnbc", "Broadcom Posts Strong AI Chip Revenue", null, NOW, 2,
                        SourceType.MAINSTREAM, "markets", false),
                new NewsItem("c", "ap", "Fed Holds Interest Rates Steady", null, NOW, 1, SourceType.WIRE,
                        "markets", false));
    }
}
