package com.worldsentinel.analysis.api;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Upstream collaborator delivering one batch of items per refresh cycle. A future that completes
 * exceptionally is treated as an empty batch by the caller.
 */
public interface FeedSource<T> {
    String name();

    CompletableFuture<List<T>> fetch(FeedContext ctx);
}
