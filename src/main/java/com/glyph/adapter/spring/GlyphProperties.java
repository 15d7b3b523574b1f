package com.glyph.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Glyph.
 * <p>
 * Compiler settings live in the YAML file named by {@code glyph.config-path}. The
 * registry location is the one setting that usually differs per deployment, so it
 * can be overridden here without editing that file:
 * <pre>
 * glyph:
 *   config-path: classpath:glyph.yaml
 *   registry-path: /var/lib/glyph/registry.yaml
 *   save-on-shutdown: true
 * </pre>
 */
@ConfigurationProperties(prefix = "glyph")
public class GlyphProperties {

    /**
     * Whether the compiler beans are created.
     */
    private boolean enabled = true;

    /**
     * Glyph YAML file holding name, registry and generator settings.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:glyph.yaml";

    /**
     * Registry file replacing {@code glyph.registry.path} from the config file.
     * Unset keeps the file's setting; a blank value forces an in-memory registry.
     */
    private String registryPath;

    /**
     * Whether registry changes whose save failed are retried when the context closes.
     */
    private boolean saveOnShutdown = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getRegistryPath() {
        return registryPath;
    }

    public void setRegistryPath(String registryPath) {
        this.registryPath = registryPath;
    }

    public boolean isSaveOnShutdown() {
        return saveOnShutdown;
    }

    public void setSaveOnShutdown(boolean saveOnShutdown) {
        this.saveOnShutdown = saveOnShutdown;
    }
}
