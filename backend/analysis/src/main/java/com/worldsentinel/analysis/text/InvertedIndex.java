package com.worldsentinel.analysis.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Token to item-position postings. Pairs that share no token never appear as candidates.
 */
public final class InvertedIndex {
    private final Map<String, List<Integer>> postings;
    private final List<Set<String>> tokenSets;

    private InvertedIndex(Map<String, List<Integer>> postings, List<Set<String>> tokenSets) {
        this.postings = postings;
        this.tokenSets = tokenSets;
    }

    public static InvertedIndex build(List<Set<String>> tokenSets) {
        Map<String, List<Integer>> postings = new HashMap<>();
        for (int i = 0; i < tokenSets.size(); i++) {
            for (String token : tokenSets.get(i)) {
                postings.computeIfAbsent(token, ignored -> new ArrayList<>()).add(i);
            }
        }
        return new InvertedIndex(postings, List.copyOf(tokenSets));
    }

    public List<Integer> postings(String token) {
        return Collections.unmodifiableList(postings.getOrDefault(token, List.of()));
    }

    /**
     * Positions greater than {@code position} that share at least one token with it, ascending.
     */
    public Set<Integer> candidatesAfter(int position) {
        Set<Integer> candidates = new TreeSet<>();
        for (String token : tokenSets.get(position)) {
            for (int other : postings.getOrDefault(token, List.of())) {
                if (other > position) {
                    candidates.add(other);
                }
            }
        }
        return candidates;
    }

    public int tokenCount() {
        return postings.size();
    }
}
