package com.glyph.token;

import com.glyph.exception.RegistryPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a token registry as a YAML file:
 * <pre>
 * tokens:
 *   task:
 *     deploy_app: "01"
 * counters:
 *   task: 1
 * </pre>
 * A missing file loads as an empty registry.
 */
public class YamlRegistryStore implements RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(YamlRegistryStore.class);

    private static final String TOKENS_KEY = "tokens";
    private static final String COUNTERS_KEY = "counters";

    private final Path path;

    public YamlRegistryStore(Path path) {
        this.path = path;
    }

    @Override
    @SuppressWarnings("unchecked")
    public RegistrySnapshot load() {
        if (!Files.exists(path)) {
            log.debug("Registry file {} does not exist, starting empty", path);
            return RegistrySnapshot.empty();
        }

        Map<String, Object> root;
        try (InputStream inputStream = Files.newInputStream(path)) {
            root = new Yaml().load(inputStream);
        } catch (IOException | YAMLException e) {
            throw new RegistryPersistenceException("Failed to read token registry from: " + path, e);
        }
        if (root == null) {
            return RegistrySnapshot.empty();
        }

        Map<String, Map<String, String>> tokens = new LinkedHashMap<>();
        Object tokensSection = root.get(TOKENS_KEY);
        if (tokensSection instanceof Map<?, ?> categories) {
            for (Map.Entry<?, ?> category : categories.entrySet()) {
                Map<String, String> entries = new LinkedHashMap<>();
                if (category.getValue() instanceof Map<?, ?> bindings) {
                    bindings.forEach((value, suffix) ->
                            entries.put(String.valueOf(value), String.valueOf(suffix)));
                }
                tokens.put(String.valueOf(category.getKey()), entries);
            }
        }

        Map<String, Integer> counters = new LinkedHashMap<>();
        Object countersSection = root.get(COUNTERS_KEY);
        if (countersSection instanceof Map<?, ?> counterMap) {
            for (Map.Entry<?, ?> counter : counterMap.entrySet()) {
                counters.put(String.valueOf(counter.getKey()), toInt(counter.getValue()));
            }
        }

        log.debug("Loaded token registry from {} ({} categories)", path, tokens.size());
        return new RegistrySnapshot(tokens, counters);
    }

    @Override
    public void save(RegistrySnapshot snapshot) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(TOKENS_KEY, snapshot.tokens());
        root.put(COUNTERS_KEY, snapshot.counters());

        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                new Yaml(options).dump(root, writer);
            }
        } catch (IOException | YAMLException e) {
            throw new RegistryPersistenceException("Failed to write token registry to: " + path, e);
        }
        log.debug("Saved token registry to {}", path);
    }

    @Override
    public String describe() {
        return path.toString();
    }

    private int toInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value));
        } catch (NumberFormatException e) {
            throw new RegistryPersistenceException("Invalid counter value '" + value + "' in " + path, e);
        }
    }
}
