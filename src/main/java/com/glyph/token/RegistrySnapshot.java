package com.glyph.token;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of a token registry.
 *
 * @param tokens   category key to (canonical value to identifier suffix)
 * @param counters category key to highest suffix ever allocated
 */
public record RegistrySnapshot(
        Map<String, Map<String, String>> tokens,
        Map<String, Integer> counters
) {
    public RegistrySnapshot {
        tokens = tokens == null ? Map.of() : tokens;
        counters = counters == null ? Map.of() : counters;
    }

    /**
     * Snapshot of a registry with no entries.
     */
    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public boolean isEmpty() {
        return tokens.values().stream().allMatch(Map::isEmpty);
    }
}
