package com.glyph.exception;

import com.glyph.token.TokenCategory;

/**
 * Exception thrown when no free identifier suffix can be found for a category,
 * either because the collision retries ran out or the suffix space is used up.
 */
public class CategoryExhaustedException extends GlyphException {

    private final TokenCategory category;

    public CategoryExhaustedException(TokenCategory category, String message) {
        super(message);
        this.category = category;
    }

    public TokenCategory getCategory() {
        return category;
    }
}
