package com.worldsentinel.analysis.entity;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Matches entity aliases and keywords against free text.
 */
public final class TextMatcher {
    public static final int MIN_ALIAS_LENGTH = 3;

    private static final Map<String, Pattern> WORD_PATTERNS = new ConcurrentHashMap<>();

    private TextMatcher() {
    }

    /**
     * Case-insensitive match of {@code term} as a whole word: "Broadcom" matches "Broadcom's" but
     * "RAI" does not match inside "RAID". Terms shorter than {@link #MIN_ALIAS_LENGTH} never match.
     */
    public static boolean containsWord(String text, String term) {
        if (text == null || term == null || term.trim().length() < MIN_ALIAS_LENGTH) {
            return false;
        }
        Pattern pattern = WORD_PATTERNS.computeIfAbsent(term.trim().toLowerCase(Locale.ROOT), TextMatcher::wordPattern);
        return pattern.matcher(text).find();
    }

    /**
     * Case-insensitive substring match, used for topical keywords ("chip" matches "chipmakers").
     */
    public static boolean containsKeyword(String text, String keyword) {
        if (text == null || keyword == null || keyword.trim().length() < MIN_ALIAS_LENGTH) {
            return false;
        }
        return text.toLowerCase(Locale.ROOT).contains(keyword.trim().toLowerCase(Locale.ROOT));
    }

    private static Pattern wordPattern(String term) {
        return Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(term) + "(?![\\p{L}\\p{N}])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE
        );
    }
}
