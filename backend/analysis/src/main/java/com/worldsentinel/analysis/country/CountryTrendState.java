package com.worldsentinel.analysis.country;

import com.worldsentinel.core.model.CountryScore;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Previous and current composite per country. Immutable: {@link #advance} returns the state for
 * the next cycle and leaves this one untouched until the cycle commits.
 */
public final class CountryTrendState {
    public static final CountryTrendState EMPTY = new CountryTrendState(Map.of());

    private final Map<String, CompositePair> pairs;

    private CountryTrendState(Map<String, CompositePair> pairs) {
        this.pairs = Map.copyOf(pairs);
    }

    /**
     * Composite the country ended the last committed cycle with.
     */
    public Optional<Integer> lastComposite(String countryCode) {
        return Optional.ofNullable(pairs.get(countryCode)).map(CompositePair::current);
    }

    public CountryTrendState advance(Collection<CountryScore> scores) {
        Map<String, CompositePair> next = new HashMap<>(pairs);
        for (CountryScore score : scores) {
            next.put(score.countryCode(), new CompositePair(score.previousComposite(), score.composite()));
        }
        return new CountryTrendState(next);
    }

    public Map<String, CompositePair> pairs() {
        return pairs;
    }

    public record CompositePair(Integer previous, int current) {
    }
}
