package com.glyph.token;

import com.glyph.exception.RegistryPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Mapping of category to (canonical value to identifier suffix), plus a per-category
 * counter holding the highest numeric suffix ever handed out. Counters never decrease,
 * so a suffix is never reused even after its binding is replaced.
 * <p>
 * Loaded once at construction. Not thread-safe: callers sharing an instance must
 * serialize access themselves.
 */
public class TokenRegistry {

    private static final Logger log = LoggerFactory.getLogger(TokenRegistry.class);

    private final RegistryStore store;
    private final Map<TokenCategory, Map<String, String>> entries = new EnumMap<>(TokenCategory.class);
    private final Map<TokenCategory, Integer> counters = new EnumMap<>(TokenCategory.class);
    private boolean unsavedChanges;

    /**
     * Create a registry that lives in memory only.
     */
    public TokenRegistry() {
        this(null);
    }

    /**
     * Create a registry backed by the given store.
     *
     * @param store Backing store, or {@code null} for a memory-only registry
     * @throws RegistryPersistenceException if the store exists but cannot be read
     */
    public TokenRegistry(RegistryStore store) {
        this.store = store;
        for (TokenCategory category : TokenCategory.values()) {
            entries.put(category, new LinkedHashMap<>());
            counters.put(category, 0);
        }
        if (store != null) {
            restore(store.load());
            log.info("Token registry loaded from {}: {} tokens", store.describe(), size());
        }
    }

    /**
     * Suffix bound to a canonical value, if any.
     */
    public Optional<String> findSuffix(TokenCategory category, String canonicalValue) {
        return Optional.ofNullable(entries.get(category).get(canonicalValue));
    }

    /**
     * Reverse lookup: canonical value bound to a suffix, if any.
     * Numeric suffixes compare by value, so {@code 7} and {@code 07} are the same suffix.
     */
    public Optional<String> findValue(TokenCategory category, String suffix) {
        for (Map.Entry<String, String> entry : entries.get(category).entrySet()) {
            if (sameSuffix(entry.getValue(), suffix)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * Highest numeric suffix allocated so far in the category (0 when none).
     */
    public int counter(TokenCategory category) {
        return counters.get(category);
    }

    /**
     * Bind a canonical value to a suffix, replacing any earlier binding of that value.
     * A numeric suffix above the counter advances the counter to it.
     */
    public void bind(TokenCategory category, String canonicalValue, String suffix) {
        String previous = entries.get(category).put(canonicalValue, suffix);
        if (previous != null && !previous.equals(suffix)) {
            log.debug("Rebound '{}' in {} from {} to {}", canonicalValue, category.key(), previous, suffix);
        }
        parseSuffix(suffix).ifPresent(number -> advanceCounter(category, number));
        unsavedChanges = true;
    }

    /**
     * Raise the category counter to at least {@code value}. Never lowers it.
     */
    public void advanceCounter(TokenCategory category, int value) {
        counters.merge(category, value, Math::max);
    }

    /**
     * Read-only view of one category's bindings.
     */
    public Map<String, String> entries(TokenCategory category) {
        return Collections.unmodifiableMap(entries.get(category));
    }

    /**
     * Total number of bindings across all categories.
     */
    public int size() {
        return entries.values().stream().mapToInt(Map::size).sum();
    }

    public boolean hasStore() {
        return store != null;
    }

    /**
     * Whether in-memory state has changes the store has not accepted yet.
     */
    public boolean hasUnsavedChanges() {
        return store != null && unsavedChanges;
    }

    /**
     * Write the whole registry to the backing store. Does nothing without a store.
     * <p>
     * On failure in-memory state is left untouched and stays marked as unsaved.
     *
     * @throws RegistryPersistenceException if the store rejects the write
     */
    public void save() {
        if (store == null) {
            return;
        }
        store.save(snapshot());
        unsavedChanges = false;
    }

    /**
     * Like {@link #save()}, but logs a failure instead of throwing.
     *
     * @return true if saved, false if the save failed or there is no store
     */
    public boolean persist() {
        if (store == null) {
            return false;
        }
        try {
            save();
            return true;
        } catch (RegistryPersistenceException e) {
            log.error("Could not save token registry to {}: {}", store.describe(), e.getMessage());
            return false;
        }
    }

    /**
     * Copy of the current state in persisted form.
     */
    public RegistrySnapshot snapshot() {
        Map<String, Map<String, String>> tokens = new LinkedHashMap<>();
        Map<String, Integer> counterSnapshot = new LinkedHashMap<>();
        for (TokenCategory category : TokenCategory.values()) {
            tokens.put(category.key(), new LinkedHashMap<>(entries.get(category)));
            counterSnapshot.put(category.key(), counters.get(category));
        }
        return new RegistrySnapshot(tokens, counterSnapshot);
    }

    private void restore(RegistrySnapshot snapshot) {
        snapshot.tokens().forEach((key, bindings) -> {
            Optional<TokenCategory> category = TokenCategory.fromKey(key);
            if (category.isEmpty()) {
                log.warn("Ignoring unknown category '{}' in stored registry", key);
                return;
            }
            Map<String, String> target = entries.get(category.get());
            bindings.forEach((value, suffix) -> {
                target.put(value, suffix);
                parseSuffix(suffix).ifPresent(number -> advanceCounter(category.get(), number));
            });
        });
        snapshot.counters().forEach((key, value) ->
                TokenCategory.fromKey(key).ifPresent(category -> advanceCounter(category, value)));
        for (TokenCategory category : TokenCategory.values()) {
            log.debug("Counter for '{}' starts at {}", category.key(), counters.get(category));
        }
    }

    /**
     * Numeric value of a suffix, or empty if it is not all digits.
     */
    static OptionalInt parseSuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < suffix.length(); i++) {
            if (!Character.isDigit(suffix.charAt(i))) {
                return OptionalInt.empty();
            }
        }
        try {
            return OptionalInt.of(Integer.parseInt(suffix));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    private static boolean sameSuffix(String left, String right) {
        if (left.equals(right)) {
            return true;
        }
        OptionalInt leftNumber = parseSuffix(left);
        OptionalInt rightNumber = parseSuffix(right);
        return leftNumber.isPresent() && rightNumber.isPresent()
                && leftNumber.getAsInt() == rightNumber.getAsInt();
    }
}
