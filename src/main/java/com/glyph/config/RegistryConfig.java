package com.glyph.config;

/**
 * Configuration for the token registry's backing store.
 *
 * @param path File holding the registry, or {@code null} for a memory-only registry
 */
public record RegistryConfig(String path) {

    public static RegistryConfig inMemory() {
        return new RegistryConfig(null);
    }

    public boolean isPersistent() {
        return path != null && !path.isBlank();
    }
}
