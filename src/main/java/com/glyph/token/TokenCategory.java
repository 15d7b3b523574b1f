package com.glyph.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed namespaces partitioning the token identifier space.
 * <p>
 * HANDLER and SECURITY share the {@code H} prefix. Their registries stay separate,
 * but identifier suffixes are allocated across the whole prefix group so that an
 * identifier still resolves to exactly one category.
 */
public enum TokenCategory {
    SYSTEM("S"),
    CONTEXT("C"),
    TASK("T"),
    CONDITION("L"),
    ACTION("P"),
    RESOURCE("R"),
    QUERY("Q"),
    BATCH("B"),
    DIRECTIVE("D"),
    MEMORY("M"),
    NETWORK("N"),
    HANDLER("H"),
    SECURITY("H");

    private final String prefix;

    TokenCategory(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Lowercase name used in persisted registries and request files.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Categories sharing this category's prefix, in declaration order (includes this one).
     */
    public List<TokenCategory> prefixGroup() {
        return forPrefix(prefix);
    }

    /**
     * Look up a category by its key, case-insensitively.
     */
    public static Optional<TokenCategory> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = key.trim().toUpperCase(Locale.ROOT).replace("-", "_");
        for (TokenCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * All categories using the given prefix. Empty if the prefix is unknown.
     */
    public static List<TokenCategory> forPrefix(String prefix) {
        List<TokenCategory> group = new ArrayList<>();
        for (TokenCategory category : values()) {
            if (category.prefix.equals(prefix)) {
                group.add(category);
            }
        }
        return group;
    }
}
