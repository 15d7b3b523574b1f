package com.glyph.exception;

/**
 * Base exception for the Glyph compiler.
 */
public class GlyphException extends RuntimeException {

    public GlyphException(String message) {
        super(message);
    }

    public GlyphException(String message, Throwable cause) {
        super(message, cause);
    }
}
