package com.glyph.mapper;

import java.util.Map;

/**
 * A command recognized upstream.
 *
 * @param line       Source line, unique per command
 * @param name       Command name (e.g. {@code EXECUTE_TASK})
 * @param parameters Command parameters by name
 */
public record CommandRecord(String line, String name, Map<String, String> parameters) {

    public CommandRecord {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * Parameter value by name, ignoring case, or {@code null}.
     */
    public String parameter(String key) {
        String exact = parameters.get(key);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, String> entry : parameters.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
