package com.stone.orchestrator.classify;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Case-insensitive substring matcher over an ordered rule table.
 *
 * Rules are tried in insertion order and the first category with a matching
 * keyword wins, so the table order is the tie-break policy.
 */
public class KeywordClassifier<T> implements TextClassifier<T> {

    private final Map<T, List<String>> rules;
    private final T fallback;

    public KeywordClassifier(Map<T, List<String>> rules, T fallback) {
        this.rules    = new LinkedHashMap<>(rules);
        this.fallback = fallback;
    }

    @Override
    public Optional<T> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<T, List<String>> rule : rules.entrySet()) {
            for (String keyword : rule.getValue()) {
                if (lower.contains(keyword)) {
                    return Optional.of(rule.getKey());
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public T fallback() {
        return fallback;
    }
}
