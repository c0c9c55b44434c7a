package com.worldsentinel.analysis.text;

import java.util.Set;

public final class Similarity {
    private Similarity() {
    }

    /**
     * |A∩B| / |A∪B|. Two empty sets are treated as unrelated (0), not identical.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}
