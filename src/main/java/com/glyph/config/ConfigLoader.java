package com.glyph.config;

import com.glyph.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads Glyph configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static GlyphConfig load(String path) {
        log.info("Loading Glyph configuration from: {}", path);
        return parseConfig(readYaml(path));
    }

    /**
     * Read a YAML document into a map.
     *
     * @throws ConfigurationException if the resource is missing, unreadable, empty or not a mapping
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> readYaml(String path) {
        Object document;
        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                document = new Yaml().load(inputStream);
            }
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty: " + path);
        }
        if (!(document instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping: " + path);
        }
        return (Map<String, Object>) document;
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static GlyphConfig parseConfig(Map<String, Object> root) {
        // The glyph section may sit at the root or under a 'glyph' key
        Map<String, Object> glyphConfig = root.containsKey("glyph")
                ? (Map<String, Object>) root.get("glyph")
                : root;

        String name = getString(glyphConfig, "name", "default");
        RegistryConfig registry = parseRegistryConfig((Map<String, Object>) glyphConfig.get("registry"));
        GeneratorConfig generator = parseGeneratorConfig((Map<String, Object>) glyphConfig.get("generator"));

        GlyphConfig config = new GlyphConfig(name, registry, generator);
        log.info("Loaded Glyph configuration: {} with {} registry, {}-digit identifiers, {} collision retries",
                name, registry.isPersistent() ? registry.path() : "in-memory",
                generator.minDigits(), generator.maxCollisionRetries());
        return config;
    }

    private static RegistryConfig parseRegistryConfig(Map<String, Object> map) {
        if (map == null) {
            return RegistryConfig.inMemory();
        }
        return new RegistryConfig(getString(map, "path", null));
    }

    private static GeneratorConfig parseGeneratorConfig(Map<String, Object> map) {
        if (map == null) {
            return GeneratorConfig.defaults();
        }
        try {
            return new GeneratorConfig(
                    getInt(map, "min-digits", GeneratorConfig.DEFAULT_MIN_DIGITS),
                    getInt(map, "max-collision-retries", GeneratorConfig.DEFAULT_MAX_COLLISION_RETRIES),
                    getInt(map, "max-suffix", GeneratorConfig.DEFAULT_MAX_SUFFIX)
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid generator configuration: " + e.getMessage(), e);
        }
    }

    // Helper methods

    static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Value of '" + key + "' is not an integer: " + value, e);
        }
    }
}
