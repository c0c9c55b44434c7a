package com.worldsentinel.service.store;

import com.worldsentinel.core.bus.EventBus;
import com.worldsentinel.core.events.AlertRaised;
import com.worldsentinel.core.events.CountryScoresUpdated;
import com.worldsentinel.core.events.Event;
import com.worldsentinel.core.events.SignalRaised;
import com.worldsentinel.core.model.CountryScore;
import com.worldsentinel.core.model.InstabilityLevel;
import com.worldsentinel.core.model.ScoreTrend;
import com.worldsentinel.core.model.Severity;
import com.worldsentinel.core.model.Signal;
import com.worldsentinel.core.model.SignalKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventCodecTest {
    private static final Instant AT = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void signalEventsSurviveTheLog() {
        Signal signal = new Signal("sig-1", SignalKind.GEO_CONVERGENCE, "cell:25,121", "3 activity types converging",
                0.87, Severity.CRITICAL, AT, Map.of("cellKey", "25,121", "score", 87));
        Event event = new SignalRaised(AT, signal);

        String line = EventCodec.toJsonLine(event);
        SignalRaised parsed = (SignalRaised) EventCodec.fromJsonLine(line);

        assertTrue(line.contains("\"type\":\"SignalRaised\""));
        assertEquals(signal.id(), parsed.signal().id());
        assertEquals(SignalKind.GEO_CONVERGENCE, parsed.signal().kind());
        assertEquals(87, parsed.signal().details().get("score"));
        assertEquals(AT, parsed.timestamp());
    }

    @Test
    void countryScoresKeepNullPreviousComposite() {
        CountryScore score = new CountryScore("UA", 0, 0, 0, 55, InstabilityLevel.ELEVATED, ScoreTrend.STABLE, null, AT);

        CountryScoresUpdated parsed = (CountryScoresUpdated) EventCodec.fromJsonLine(
                EventCodec.toJsonLine(new CountryScoresUpdated(AT, List.of(score), true)));

        assertEquals(List.of(score), parsed.scores());
        assertTrue(parsed.learning());
    }

    @Test
    void rejectsUnsupportedOrInvalidPayload() {
        IllegalArgumentException unsupported = assertThrows(IllegalArgumentException.class, () ->
                EventCodec.fromJsonLine("{\"type\":\"Nope\",\"timestamp\":\"2026-03-01T12:00:00Z\",\"event\":{}}"));
        assertTrue(unsupported.getMessage().contains("Unsupported event type"));

        assertThrows(IllegalStateException.class, () -> EventCodec.fromJsonLine("not-json"));
        assertEquals(6, EventCodec.allEventTypes().size());
    }

    @Test
    void subscribeAllForwardsKnownEvents() {
        EventBus bus = new EventBus();
        List<Event> received = new ArrayList<>();
        EventCodec.subscribeAll(bus, received::add);

        bus.publish(new AlertRaised(AT, "feed", "down", Map.of("feed", "news")));
        bus.publish(new Event() {
            @Override
            public String type() {
                return "Custom";
            }

            @Override
            public Instant timestamp() {
                return AT;
            }
        });

        assertEquals(1, received.size());
        assertEquals("AlertRaised", received.get(0).type());
    }
}
