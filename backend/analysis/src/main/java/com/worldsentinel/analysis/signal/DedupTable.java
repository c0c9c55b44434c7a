package com.worldsentinel.analysis.signal;

import com.worldsentinel.core.model.SignalKind;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Expiry per {@code (kind, subjectKey)}. Expired entries are swept lazily on lookup. Not thread-safe:
 * a cycle works on a {@link #copy()} and the copy replaces the live table on commit.
 */
public final class DedupTable {
    private final Map<String, Instant> expiries;

    public DedupTable() {
        this(new HashMap<>());
    }

    private DedupTable(Map<String, Instant> expiries) {
        this.expiries = expiries;
    }

    static String key(SignalKind kind, String subjectKey) {
        return kind.name() + "|" + subjectKey;
    }

    public boolean isSuppressed(SignalKind kind, String subjectKey, Instant now) {
        sweep(now);
        Instant expiresAt = expiries.get(key(kind, subjectKey));
        return expiresAt != null && now.isBefore(expiresAt);
    }

    public void record(SignalKind kind, String subjectKey, Instant now) {
        expiries.put(key(kind, subjectKey), now.plus(kind.dedupTtl()));
    }

    public DedupTable copy() {
        return new DedupTable(new HashMap<>(expiries));
    }

    public int size() {
        return expiries.size();
    }

    private void sweep(Instant now) {
        Iterator<Map.Entry<String, Instant>> iterator = expiries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (!now.isBefore(iterator.next().getValue())) {
                iterator.remove();
            }
        }
    }
}
