package com.glyph.exception;

/**
 * Exception thrown when configuration or a compilation request is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends GlyphException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
