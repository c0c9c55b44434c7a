package com.worldsentinel.service.feed;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.worldsentinel.analysis.api.FeedContext;
import com.worldsentinel.analysis.api.FeedSource;
import com.worldsentinel.core.model.GeoEvent;
import com.worldsentinel.core.model.MarketQuote;
import com.worldsentinel.core.model.MilitarySurge;
import com.worldsentinel.core.model.NewsItem;
import com.worldsentinel.core.model.PredictionShift;
import com.worldsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reads the latest snapshot an upstream collector dropped at {@code <inbox>/<name>.json}. A missing
 * file is an empty batch; an unreadable one fails the future.
 */
public class JsonFileFeedSource<T> implements FeedSource<T> {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final String name;
    private final Path file;
    private final TypeReference<List<T>> type;

    public JsonFileFeedSource(String name, Path inboxDir, TypeReference<List<T>> type) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.file = inboxDir.resolve(name + ".json");
        this.type = Objects.requireNonNull(type, "type is required");
    }

    public static JsonFileFeedSource<NewsItem> news(Path inboxDir) {
        return new JsonFileFeedSource<>("news", inboxDir, new TypeReference<>() {
        });
    }

    public static JsonFileFeedSource<MarketQuote> quotes(Path inboxDir) {
        return new JsonFileFeedSource<>("quotes", inboxDir, new TypeReference<>() {
        });
    }

    public static JsonFileFeedSource<GeoEvent> geoEvents(Path inboxDir) {
        return new JsonFileFeedSource<>("geo-events", inboxDir, new TypeReference<>() {
        });
    }

    public static JsonFileFeedSource<PredictionShift> predictionShifts(Path inboxDir) {
        return new JsonFileFeedSource<>("prediction-shifts", inboxDir, new TypeReference<>() {
        });
    }

    public static JsonFileFeedSource<MilitarySurge> militarySurges(Path inboxDir) {
        return new JsonFileFeedSource<>("military-surges", inboxDir, new TypeReference<>() {
        });
    }

    @Override
    public String name() {
        return name;
    }

    public Path file() {
        return file;
    }

    @Override
    public CompletableFuture<List<T>> fetch(FeedContext ctx) {
        return CompletableFuture.supplyAsync(this::readSnapshot);
    }

    private List<T> readSnapshot() {
        if (!Files.exists(file)) {
            return List.of();
        }
        try (InputStream in = Files.newInputStream(file)) {
            List<T> items = MAPPER.readValue(in, type);
            return items == null ? List.of() : items;
        } catch (IOException e) {
            throw new CompletionException(new IllegalStateException("Failed reading feed " + name + " from " + file, e));
        }
    }
}
