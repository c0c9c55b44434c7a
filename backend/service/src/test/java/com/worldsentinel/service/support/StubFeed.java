package com.worldsentinel.service.support;

import com.worldsentinel.analysis.api.FeedContext;
import com.worldsentinel.analysis.api.FeedSource;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

public final class StubFeed<T> implements FeedSource<T> {
    private final String name;
    private final Supplier<CompletableFuture<List<T>>> behavior;
    private final AtomicInteger fetches = new AtomicInteger();

    private StubFeed(String name, Supplier<CompletableFuture<List<T>>> behavior) {
        this.name = name;
        this.behavior = behavior;
    }

    public static <T> StubFeed<T> of(String name, List<T> items) {
        return new StubFeed<>(name, () -> CompletableFuture.completedFuture(items));
    }

    public static <T> StubFeed<T> failing(String name, RuntimeException error) {
        return new StubFeed<>(name, () -> CompletableFuture.failedFuture(error));
    }

    public static <T> StubFeed<T> hanging(String name) {
        return new StubFeed<>(name, CompletableFuture::new);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<List<T>> fetch(FeedContext ctx) {
        fetches.incrementAndGet();
        return behavior.get();
    }

    public int fetches() {
        return fetches.get();
    }
}
