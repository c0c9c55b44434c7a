package com.worldsentinel.analysis.correlation;

import com.worldsentinel.analysis.entity.TextMatcher;
import com.worldsentinel.core.model.MatchKind;

record SearchTerm(String term, MatchKind kind) {
    boolean matches(String text) {
        if (kind == MatchKind.KEYWORD) {
            return TextMatcher.containsKeyword(text, term);
        }
        return TextMatcher.containsWord(text, term);
    }
}
