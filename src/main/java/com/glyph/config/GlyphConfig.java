package com.glyph.config;

/**
 * Root configuration for the Glyph compiler.
 *
 * @param name      Compiler instance name, used in log messages
 * @param registry  Token registry configuration
 * @param generator Identifier generation configuration
 */
public record GlyphConfig(
        String name,
        RegistryConfig registry,
        GeneratorConfig generator
) {
    /**
     * Create a minimal configuration: memory-only registry, default generator settings.
     */
    public static GlyphConfig minimal() {
        return new GlyphConfig("default", RegistryConfig.inMemory(), GeneratorConfig.defaults());
    }
}
