package com.glyph.token;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes token values so that spellings differing only in case,
 * punctuation or spacing map to the same registry entry.
 */
public final class ValueNormalizer {

    private static final Pattern PUNCTUATION =
            Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Separator that replaces whitespace runs.
     */
    public static final String SEPARATOR = "_";

    private ValueNormalizer() {
    }

    /**
     * Lowercase, strip punctuation, collapse whitespace runs into a single separator.
     * Leading and trailing whitespace is dropped. {@code null} becomes the empty string.
     */
    public static String canonicalize(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        normalized = PUNCTUATION.matcher(normalized).replaceAll("");
        normalized = normalized.strip();
        return WHITESPACE.matcher(normalized).replaceAll(SEPARATOR);
    }
}
