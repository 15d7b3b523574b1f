package com.glyph.exception;

/**
 * Exception thrown by a registry store when the backing medium
 * cannot be read or written.
 */
public class RegistryPersistenceException extends GlyphException {

    public RegistryPersistenceException(String message) {
        super(message);
    }

    public RegistryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
