package com.glyph.config;

import com.glyph.exception.ConfigurationException;
import com.glyph.mapper.CommandNode;
import com.glyph.mapper.CommandRecord;
import com.glyph.mapper.CompilationRequest;
import com.glyph.mapper.EntityRecord;
import com.glyph.mapper.RelationshipRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads compilation requests (recognized entities, relationships and command
 * hierarchies) from YAML files.
 * <pre>
 * entities:
 *   - match: "build the project"
 *     type: task_name
 *     value: build project
 * relationships:
 *   - type: sequence
 *     participants: ["build the project", "run the tests"]
 * commands:
 *   - line: "&gt;&gt;&gt;EXECUTE_TASK[TASK=build]"
 *     name: EXECUTE_TASK
 *     parameters: {TASK: build}
 *     children: []
 * </pre>
 */
public class CompilationRequestLoader {

    private static final Logger log = LoggerFactory.getLogger(CompilationRequestLoader.class);

    /**
     * Load a request from a path. Supports classpath: prefix for classpath resources.
     */
    public static CompilationRequest load(String path) {
        log.info("Loading compilation request from: {}", path);
        Map<String, Object> root = ConfigLoader.readYaml(path);

        List<EntityRecord> entities = parseEntities(listOfMaps(root, "entities"));
        List<RelationshipRecord> relationships = parseRelationships(listOfMaps(root, "relationships"));
        List<CommandNode> commands = parseCommands(listOfMaps(root, "commands"));

        log.info("Loaded compilation request: {} entities, {} relationships, {} root commands",
                entities.size(), relationships.size(), commands.size());
        return new CompilationRequest(entities, relationships, commands);
    }

    private static List<EntityRecord> parseEntities(List<Map<String, Object>> list) {
        List<EntityRecord> entities = new ArrayList<>();
        for (Map<String, Object> item : list) {
            String value = ConfigLoader.getString(item, "value", null);
            String match = ConfigLoader.getString(item, "match", value);
            if (match == null) {
                throw new ConfigurationException("Entity needs a 'match' or a 'value': " + item);
            }
            entities.add(new EntityRecord(match, ConfigLoader.getString(item, "type", null),
                    value != null ? value : match));
        }
        return entities;
    }

    private static List<RelationshipRecord> parseRelationships(List<Map<String, Object>> list) {
        List<RelationshipRecord> relationships = new ArrayList<>();
        for (Map<String, Object> item : list) {
            String type = ConfigLoader.getString(item, "type", null);
            if (type == null) {
                throw new ConfigurationException("Relationship needs a 'type': " + item);
            }
            List<String> participants = new ArrayList<>();
            Object rawParticipants = item.get("participants");
            if (rawParticipants instanceof List<?> values) {
                for (Object value : values) {
                    participants.add(String.valueOf(value));
                }
            } else if (rawParticipants != null) {
                throw new ConfigurationException("Relationship 'participants' must be a list: " + item);
            }
            Integer count = item.containsKey("count") ? ConfigLoader.getInt(item, "count", 1) : null;
            relationships.add(new RelationshipRecord(type, participants, count));
        }
        return relationships;
    }

    private static List<CommandNode> parseCommands(List<Map<String, Object>> list) {
        List<CommandNode> nodes = new ArrayList<>();
        for (Map<String, Object> item : list) {
            nodes.add(parseCommand(item));
        }
        return nodes;
    }

    private static CommandNode parseCommand(Map<String, Object> item) {
        String name = ConfigLoader.getString(item, "name", null);
        if (name == null) {
            throw new ConfigurationException("Command needs a 'name': " + item);
        }
        String line = ConfigLoader.getString(item, "line", name);

        Map<String, String> parameters = new LinkedHashMap<>();
        Object rawParameters = item.get("parameters");
        if (rawParameters instanceof Map<?, ?> map) {
            map.forEach((key, value) -> parameters.put(String.valueOf(key), String.valueOf(value)));
        }

        List<CommandNode> children = parseCommands(listOfMaps(item, "children"));
        return new CommandNode(new CommandRecord(line, name, parameters), children);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listOfMaps(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        for (Object element : list) {
            if (!(element instanceof Map)) {
                throw new ConfigurationException("Every entry of '" + key + "' must be a mapping, found: " + element);
            }
        }
        return (List<Map<String, Object>>) value;
    }
}
