package com.deepansh.assistant.memory;

import com.deepansh.assistant.search.KeywordRelevance;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Importance-weighted keyword ranking shared by the memory stores.
 */
final class MemoryRanker {

    private MemoryRanker() {
    }

    /**
     * Scores every item against the query and returns at most {@code topK}
     * with a positive score. The sort is stable, so ties keep the iteration
     * order of {@code items}.
     */
    static List<MemoryItem> rank(Collection<MemoryItem> items, String query, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        List<Scored> scored = new ArrayList<>();
        for (MemoryItem item : items) {
            double score = KeywordRelevance.score(query, item.getContent()) * item.getImportance();
            if (score > 0) {
                scored.add(new Scored(item, score));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        return scored.stream()
                .limit(topK)
                .map(Scored::item)
                .toList();
    }

    private record Scored(MemoryItem item, double score) {}
}
