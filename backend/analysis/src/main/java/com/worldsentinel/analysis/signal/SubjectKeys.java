package com.worldsentinel.analysis.signal;

import java.util.Locale;

/**
 * Deduplication identities. Keys never include magnitudes, so a repeat of the same situation with a
 * different percentage or count collapses into the already-fired signal.
 */
public final class SubjectKeys {
    static final int TITLE_KEY_LENGTH = 50;

    private SubjectKeys() {
    }

    public static String ticker(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static String title(String title) {
        String normalized = title == null ? "" : title.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return normalized.length() > TITLE_KEY_LENGTH ? normalized.substring(0, TITLE_KEY_LENGTH) : normalized;
    }

    public static String cluster(String clusterId) {
        return clusterId;
    }

    public static String metric(String metricKey) {
        return metricKey;
    }

    public static String cell(String cellKey) {
        return "cell:" + cellKey;
    }

    public static String country(String countryCode) {
        return countryCode.trim().toUpperCase(Locale.ROOT);
    }

    public static String theater(String theaterId) {
        return theaterId.trim().toLowerCase(Locale.ROOT);
    }
}
