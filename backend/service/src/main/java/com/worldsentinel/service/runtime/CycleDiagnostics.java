package com.worldsentinel.service.runtime;

import com.worldsentinel.core.bus.EventBus;
import com.worldsentinel.core.events.AlertRaised;
import com.worldsentinel.core.events.CycleCompleted;
import com.worldsentinel.core.events.CycleSkipped;
import com.worldsentinel.core.events.Event;
import com.worldsentinel.core.events.SignalRaised;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Running counters over the refresh loop, fed from the event bus.
 */
public final class CycleDiagnostics {
    private final LongAdder committed = new LongAdder();
    private final LongAdder abandoned = new LongAdder();
    private final LongAdder skipped = new LongAdder();
    private final LongAdder signalsRaised = new LongAdder();
    private final AtomicReference<LastCycle> lastCycle = new AtomicReference<>();
    private final ConcurrentHashMap<String, String> feedErrors = new ConcurrentHashMap<>();

    public CycleDiagnostics(EventBus eventBus) {
        eventBus.subscribe(CycleCompleted.class, this::onCycleCompleted);
        eventBus.subscribe(CycleSkipped.class, event -> skipped.increment());
        eventBus.subscribe(SignalRaised.class, event -> signalsRaised.increment());
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    /**
     * Folds previously logged events into the counters without republishing them. Returns how many
     * events were recognized.
     */
    public int replay(List<Event> history) {
        int applied = 0;
        for (Event event : history) {
            if (event instanceof CycleCompleted completed) {
                onCycleCompleted(completed);
            } else if (event instanceof CycleSkipped) {
                skipped.increment();
            } else if (event instanceof SignalRaised) {
                signalsRaised.increment();
            } else if (event instanceof AlertRaised alert) {
                onAlertRaised(alert);
            } else {
                continue;
            }
            applied++;
        }
        return applied;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new HashMap<>();
        snapshot.put("cyclesCommitted", committed.longValue());
        snapshot.put("cyclesAbandoned", abandoned.longValue());
        snapshot.put("cyclesSkipped", skipped.longValue());
        snapshot.put("signalsRaised", signalsRaised.longValue());
        LastCycle last = lastCycle.get();
        if (last != null) {
            snapshot.put("lastCycleNumber", last.cycleNumber());
            snapshot.put("lastCycleAt", last.completedAt().toString());
            snapshot.put("lastDurationMillis", last.durationMillis());
            snapshot.put("lastCommitted", last.committed());
        }
        snapshot.put("feedErrors", new HashMap<>(feedErrors));
        return snapshot;
    }

    public long cyclesCommitted() {
        return committed.longValue();
    }

    public long cyclesAbandoned() {
        return abandoned.longValue();
    }

    public long cyclesSkipped() {
        return skipped.longValue();
    }

    private void onCycleCompleted(CycleCompleted event) {
        if (event.committed()) {
            committed.increment();
        } else {
            abandoned.increment();
        }
        lastCycle.set(new LastCycle(event.cycleNumber(), event.timestamp(), event.durationMillis(), event.committed()));
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"feed".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        Object feed = event.details().get("feed");
        if (feed instanceof String feedName && !feedName.isBlank()) {
            feedErrors.put(feedName, event.message());
        }
    }

    private record LastCycle(long cycleNumber, Instant completedAt, long durationMillis, boolean committed) {
    }
}
