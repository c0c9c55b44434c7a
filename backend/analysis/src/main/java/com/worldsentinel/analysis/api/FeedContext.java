package com.worldsentinel.analysis.api;

import com.worldsentinel.core.bus.EventBus;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

public record FeedContext(
        EventBus eventBus,
        Clock clock,
        Duration requestTimeout,
        Map<String, Object> config
) {
    public FeedContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    public <T> T requiredConfig(String key, Class<T> type) {
        Object value = config.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing required config key: " + key);
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Config key '" + key + "' must be " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
