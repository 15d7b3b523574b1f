package com.glyph.token;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Registry store kept in memory. Useful for sharing a registry between
 * generator instances within one process, and in tests.
 */
public class InMemoryRegistryStore implements RegistryStore {

    private RegistrySnapshot snapshot = RegistrySnapshot.empty();
    private int saveCount;

    @Override
    public RegistrySnapshot load() {
        return copy(snapshot);
    }

    @Override
    public void save(RegistrySnapshot snapshot) {
        this.snapshot = copy(snapshot);
        saveCount++;
    }

    @Override
    public String describe() {
        return "memory";
    }

    /**
     * Number of successful saves so far.
     */
    public int getSaveCount() {
        return saveCount;
    }

    private static RegistrySnapshot copy(RegistrySnapshot source) {
        Map<String, Map<String, String>> tokens = new LinkedHashMap<>();
        source.tokens().forEach((category, entries) -> tokens.put(category, new LinkedHashMap<>(entries)));
        return new RegistrySnapshot(tokens, new LinkedHashMap<>(source.counters()));
    }
}
