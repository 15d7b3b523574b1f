package com.glyph.mapper;

import java.util.List;

/**
 * Everything upstream recognition delivers for one compilation: either flat entities
 * plus relationship records, or a command hierarchy.
 *
 * @param entities      Categorized entities in recognition order
 * @param relationships Typed relationship records
 * @param commands      Root command nodes; when present the hierarchy drives mapping
 */
public record CompilationRequest(
        List<EntityRecord> entities,
        List<RelationshipRecord> relationships,
        List<CommandNode> commands
) {
    public CompilationRequest {
        entities = entities == null ? List.of() : List.copyOf(entities);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        commands = commands == null ? List.of() : List.copyOf(commands);
    }

    public static CompilationRequest ofEntities(List<EntityRecord> entities, List<RelationshipRecord> relationships) {
        return new CompilationRequest(entities, relationships, List.of());
    }

    public static CompilationRequest ofCommands(List<CommandNode> commands) {
        return new CompilationRequest(List.of(), List.of(), commands);
    }

    public boolean isHierarchical() {
        return !commands.isEmpty();
    }
}
