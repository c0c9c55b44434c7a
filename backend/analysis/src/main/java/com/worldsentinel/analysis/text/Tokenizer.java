package com.worldsentinel.analysis.text;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a headline into the token set used for similarity. Pure; callers may cache per title.
 */
public final class Tokenizer {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    // General English function words plus reporting and earnings boilerplate that carries no topic.
    static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "nor", "but", "yet", "with", "from", "into", "onto", "over", "under",
            "after", "before", "amid", "about", "above", "below", "than", "that", "this", "these", "those",
            "then", "there", "their", "they", "them", "its", "his", "her", "has", "have", "had", "was",
            "were", "are", "been", "being", "will", "would", "could", "should", "can", "may", "might",
            "not", "all", "any", "more", "most", "new", "now", "just", "also", "out", "off", "per", "via",
            "you", "your", "our", "what", "when", "where", "who", "why", "how", "says", "said", "say",
            "report", "reports", "reported", "post", "posts", "beat", "beats", "miss", "misses",
            "estimate", "estimates", "expectations", "strong", "weak", "update", "updates", "live",
            "breaking", "today", "week", "year"
    );

    private final int minLength;

    public Tokenizer() {
        this(3);
    }

    public Tokenizer(int minLength) {
        this.minLength = Math.max(1, minLength);
    }

    public Set<String> tokenize(String title) {
        if (title == null || title.isBlank()) {
            return Set.of();
        }
        Set<String> tokens = new LinkedHashSet<>();
        for (String raw : NON_WORD.split(title.toLowerCase(Locale.ROOT))) {
            if (raw.length() >= minLength && !STOP_WORDS.contains(raw)) {
                tokens.add(raw);
            }
        }
        return Collections.unmodifiableSet(tokens);
    }
}
