package com.glyph.token;

import com.glyph.exception.RegistryPersistenceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenRegistry.
 */
class TokenRegistryTest {

    @Test
    @DisplayName("Counter should never fall below the highest bound suffix on load")
    void shouldDeriveCounterFromBindings() {
        InMemoryRegistryStore store = storeWith(Map.of("task", Map.of("deploy", "07")), Map.of("task", 3));

        TokenRegistry registry = new TokenRegistry(store);

        assertEquals(7, registry.counter(TokenCategory.TASK));
        assertEquals(Optional.of("07"), registry.findSuffix(TokenCategory.TASK, "deploy"));
    }

    @Test
    @DisplayName("A persisted counter above every binding should be kept")
    void shouldKeepHigherPersistedCounter() {
        InMemoryRegistryStore store = storeWith(Map.of("task", Map.of("deploy", "07")), Map.of("task", 12));

        TokenRegistry registry = new TokenRegistry(store);

        assertEquals(12, registry.counter(TokenCategory.TASK));
        assertEquals("T13", new TokenIdGenerator(registry).generateId("rollback", TokenCategory.TASK));
    }

    @Test
    @DisplayName("Unknown categories in stored data should be skipped")
    void shouldIgnoreUnknownCategories() {
        InMemoryRegistryStore store = storeWith(
                Map.of("telemetry", Map.of("cpu", "01"), "resource", Map.of("gpu", "02")),
                Map.of("telemetry", 5));

        TokenRegistry registry = new TokenRegistry(store);

        assertEquals(1, registry.size());
        assertEquals(2, registry.counter(TokenCategory.RESOURCE));
    }

    @Test
    @DisplayName("Reverse lookup should compare numeric suffixes by value")
    void shouldMatchNumericSuffixesByValue() {
        TokenRegistry registry = new TokenRegistry();
        registry.bind(TokenCategory.TASK, "deploy", "07");

        assertEquals(Optional.of("deploy"), registry.findValue(TokenCategory.TASK, "7"));
        assertEquals(Optional.of("deploy"), registry.findValue(TokenCategory.TASK, "007"));
        assertEquals(Optional.empty(), registry.findValue(TokenCategory.TASK, "70"));
    }

    @Test
    @DisplayName("advanceCounter should never lower a counter")
    void shouldOnlyRaiseCounters() {
        TokenRegistry registry = new TokenRegistry();
        registry.advanceCounter(TokenCategory.QUERY, 9);
        registry.advanceCounter(TokenCategory.QUERY, 4);

        assertEquals(9, registry.counter(TokenCategory.QUERY));
    }

    @Test
    @DisplayName("A memory-only registry reports no store and never persists")
    void shouldNotPersistWithoutStore() {
        TokenRegistry registry = new TokenRegistry();
        registry.bind(TokenCategory.TASK, "deploy", "01");

        assertFalse(registry.hasStore());
        assertFalse(registry.hasUnsavedChanges());
        assertFalse(registry.persist());
    }

    @Test
    @DisplayName("Snapshot should carry every category with its counter")
    void shouldSnapshotAllCategories() {
        TokenRegistry registry = new TokenRegistry();
        registry.bind(TokenCategory.NETWORK, "vpn", "04");

        RegistrySnapshot snapshot = registry.snapshot();

        assertEquals(TokenCategory.values().length, snapshot.tokens().size());
        assertEquals(Map.of("vpn", "04"), snapshot.tokens().get("network"));
        assertEquals(4, snapshot.counters().get("network"));
        assertFalse(snapshot.isEmpty());
    }

    @Test
    @DisplayName("parseSuffix should accept only all-digit suffixes")
    void shouldParseSuffixes() {
        assertEquals(12, TokenRegistry.parseSuffix("012").getAsInt());
        assertTrue(TokenRegistry.parseSuffix("main").isEmpty());
        assertTrue(TokenRegistry.parseSuffix("1a").isEmpty());
        assertTrue(TokenRegistry.parseSuffix("").isEmpty());
        assertTrue(TokenRegistry.parseSuffix("99999999999").isEmpty());
    }

    private static InMemoryRegistryStore storeWith(Map<String, Map<String, String>> tokens,
                                                   Map<String, Integer> counters) {
        InMemoryRegistryStore store = new InMemoryRegistryStore();
        store.save(new RegistrySnapshot(new LinkedHashMap<>(tokens), new LinkedHashMap<>(counters)));
        return store;
    }

    @Test
    @DisplayName("save should throw when the store rejects the write, persist should not")
    void shouldSeparateSaveAndPersist() {
        TokenRegistry registry = new TokenRegistry(new RegistryStore() {
            @Override
            public RegistrySnapshot load() {
                return RegistrySnapshot.empty();
            }

            @Override
            public void save(RegistrySnapshot snapshot) {
                throw new RegistryPersistenceException("read-only");
            }

            @Override
            public String describe() {
                return "read-only";
            }
        });
        registry.bind(TokenCategory.TASK, "deploy", "01");

        assertThrows(RegistryPersistenceException.class, registry::save);
        assertFalse(registry.persist());
        assertTrue(registry.hasUnsavedChanges());
    }

    @Test
    @DisplayName("entries should expose a read-only view of one category")
    void shouldExposeReadOnlyEntries() {
        TokenRegistry registry = new TokenRegistry();
        registry.bind(TokenCategory.BATCH, "nightly", "03");

        Map<String, String> entries = registry.entries(TokenCategory.BATCH);

        assertEquals(Map.of("nightly", "03"), entries);
        assertThrows(UnsupportedOperationException.class, () -> entries.put("hourly", "04"));
        assertTrue(registry.entries(TokenCategory.MEMORY).isEmpty());
    }
}
