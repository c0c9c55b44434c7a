package com.worldsentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.worldsentinel.analysis.api.BaselineStore;
import com.worldsentinel.core.model.Baseline;
import com.worldsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All baselines in one JSON file, raw observations included. Writes go through a temp file that
 * replaces the previous snapshot, so a crash mid-write leaves the last committed cycle intact.
 */
public class JsonFileBaselineStore implements BaselineStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();

    public JsonFileBaselineStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public Baseline get(String metricKey) {
        Baseline baseline = baselines.get(metricKey);
        return baseline == null ? Baseline.empty(metricKey) : baseline;
    }

    @Override
    public void put(String metricKey, Baseline baseline) {
        putAll(Map.of(metricKey, baseline));
    }

    @Override
    public void putAll(Map<String, Baseline> updates) {
        lock.lock();
        try {
            Map<String, Baseline> next = new TreeMap<>(baselines);
            next.putAll(updates);
            persist(next);
            baselines.putAll(updates);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return baselines.size();
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                BaselineFile loaded = MAPPER.readValue(in, BaselineFile.class);
                if (loaded.baselines() != null) {
                    baselines.putAll(loaded.baselines());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading baselines from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist(Map<String, Baseline> snapshot) {
        Path parent = file.toAbsolutePath().getParent();
        Path temp = parent.resolve(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new BaselineFile(snapshot));
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing baselines to " + file, e);
        }
    }

    private record BaselineFile(Map<String, Baseline> baselines) {
    }
}
