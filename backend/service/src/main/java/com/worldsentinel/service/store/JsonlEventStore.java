package com.worldsentinel.service.store;

import com.worldsentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only event log, one JSON document per line.
 */
public class JsonlEventStore implements EventStore {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending " + event.type() + " event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            Deque<Event> window = new ArrayDeque<>(Math.min(limit, 1024));
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                String line;
                int lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (line.isBlank()) {
                        continue;
                    }
                    Event event = decode(line, lineNumber);
                    if (event.timestamp().isBefore(since)) {
                        continue;
                    }
                    if (type.isPresent() && !type.get().equals(event.type())) {
                        continue;
                    }
                    if (window.size() == limit) {
                        window.removeFirst();
                    }
                    window.addLast(event);
                }
            }
            return new ArrayList<>(window);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private static Event decode(String line, int lineNumber) {
        try {
            return EventCodec.fromJsonLine(line);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid JSONL event at line " + lineNumber, e);
        }
    }
}
