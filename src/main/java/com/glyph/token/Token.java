package com.glyph.token;

/**
 * An atomic symbolic unit referencing one semantic value.
 *
 * @param identifier     Short code such as {@code T03}
 * @param category       Namespace the identifier belongs to
 * @param canonicalValue Normalized value the identifier is bound to
 */
public record Token(String identifier, TokenCategory category, String canonicalValue) {

    @Override
    public String toString() {
        return identifier + "(" + category.key() + ":" + canonicalValue + ")";
    }
}
