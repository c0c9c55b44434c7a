package com.worldsentinel.core.model;

import java.time.Instant;

public record MarketQuote(
        String symbol,
        double price,
        double changePercent,
        Instant timestamp
) {
}
