package com.worldsentinel.service.store;

import com.worldsentinel.core.events.Event;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EventStore {
    void append(Event event);

    /**
     * Most recent events at or after {@code since}, oldest first, at most {@code limit}.
     */
    List<Event> query(Instant since, Optional<String> type, int limit);
}
