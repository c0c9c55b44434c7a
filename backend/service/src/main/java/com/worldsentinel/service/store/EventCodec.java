package com.worldsentinel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worldsentinel.core.bus.EventBus;
import com.worldsentinel.core.events.AlertRaised;
import com.worldsentinel.core.events.CountryScoresUpdated;
import com.worldsentinel.core.events.CycleCompleted;
import com.worldsentinel.core.events.CycleSkipped;
import com.worldsentinel.core.events.CycleStarted;
import com.worldsentinel.core.events.Event;
import com.worldsentinel.core.events.SignalRaised;
import com.worldsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * One event per line: {@code {"type": ..., "timestamp": ..., "event": {...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "CycleStarted", CycleStarted.class,
            "CycleCompleted", CycleCompleted.class,
            "CycleSkipped", CycleSkipped.class,
            "SignalRaised", SignalRaised.class,
            "CountryScoresUpdated", CountryScoresUpdated.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize " + event.type() + " event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to parse event line", e);
        }
        String type = node.path("type").asText();
        Class<? extends Event> eventClass = TYPES.get(type);
        if (eventClass == null) {
            throw new IllegalArgumentException("Unsupported event type: " + type);
        }
        try {
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize " + type + " event", e);
        }
    }

    /**
     * Forwards every event type the codec knows to {@code consumer}.
     */
    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        bus.subscribeAll(event -> {
            if (TYPES.containsKey(event.type())) {
                consumer.accept(event);
            }
        });
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
