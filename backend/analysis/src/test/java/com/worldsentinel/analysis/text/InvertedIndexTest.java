package com.worldsentinel.analysis.text;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InvertedIndexTest {
    @Test
    void candidatesOnlyIncludeLaterItemsSharingAToken() {
        InvertedIndex index = InvertedIndex.build(List.of(
                Set.of("broadcom", "revenue"),
                Set.of("fed", "rates"),
                Set.of("broadcom", "chip"),
                Set.of("rates", "revenue")
        ));

        assertEquals(Set.of(2, 3), index.candidatesAfter(0));
        assertEquals(Set.of(3), index.candidatesAfter(1));
        assertTrue(index.candidatesAfter(2).isEmpty());
        assertTrue(index.candidatesAfter(3).isEmpty());
    }

    @Test
    void postingsListPositionsPerToken() {
        InvertedIndex index = InvertedIndex.build(List.of(Set.of("oil"), Set.of(), Set.of("oil", "opec")));

        assertEquals(List.of(0, 2), index.postings("oil"));
        assertEquals(List.of(), index.postings("gas"));
        assertEquals(2, index.tokenCount());
    }
}
