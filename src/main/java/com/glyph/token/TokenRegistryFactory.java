package com.glyph.token;

import com.glyph.config.RegistryConfig;

import java.nio.file.Path;

/**
 * Factory for creating a TokenRegistry based on config.
 */
public final class TokenRegistryFactory {

    private TokenRegistryFactory() {
    }

    public static TokenRegistry create(RegistryConfig config) {
        if (config != null && config.isPersistent()) {
            return new TokenRegistry(new YamlRegistryStore(Path.of(config.path())));
        }
        return new TokenRegistry();
    }
}
