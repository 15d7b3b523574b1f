package com.glyph.mapper;

import com.glyph.relationship.RelationshipType;
import com.glyph.token.TokenCategory;

import java.util.Map;

/**
 * Fixed lookup tables used when mapping upstream records to tokens and relationships.
 */
public final class MappingTables {

    private MappingTables() {
    }

    /**
     * Upstream entity types mapped to token categories. Unlisted types map to DIRECTIVE.
     */
    public static final Map<String, TokenCategory> ENTITY_TYPE_CATEGORIES = Map.ofEntries(
            Map.entry("system_type", TokenCategory.SYSTEM),
            Map.entry("context_parameter", TokenCategory.CONTEXT),
            Map.entry("task_name", TokenCategory.TASK),
            Map.entry("resource_identifier", TokenCategory.RESOURCE),
            Map.entry("condition", TokenCategory.CONDITION),
            Map.entry("action", TokenCategory.ACTION),
            Map.entry("quantifier", TokenCategory.ACTION)
    );

    /**
     * Command names mapped to token categories. Unlisted commands map to DIRECTIVE.
     */
    public static final Map<String, TokenCategory> COMMAND_CATEGORIES = Map.ofEntries(
            Map.entry("INITIALIZE", TokenCategory.SYSTEM),
            Map.entry("SET_CONTEXT", TokenCategory.CONTEXT),
            Map.entry("EXECUTE", TokenCategory.TASK),
            Map.entry("EXECUTE_TASK", TokenCategory.TASK),
            Map.entry("CONDITIONAL", TokenCategory.CONDITION),
            Map.entry("PARALLEL", TokenCategory.ACTION),
            Map.entry("REPEAT", TokenCategory.ACTION),
            Map.entry("BATCH_OPERATION", TokenCategory.BATCH),
            Map.entry("ACTIVATE_CONTEXT", TokenCategory.CONTEXT),
            Map.entry("ALLOCATE_RESOURCE", TokenCategory.RESOURCE),
            Map.entry("APPLY_SECURITY", TokenCategory.SYSTEM),
            Map.entry("EXECUTE_QUERY", TokenCategory.QUERY)
    );

    /**
     * Parameter whose value a command's token is minted from, per category.
     * Unlisted categories use {@link #DEFAULT_KEY_PARAMETER}.
     */
    public static final Map<TokenCategory, String> KEY_PARAMETERS = Map.of(
            TokenCategory.SYSTEM, "SYSTEM",
            TokenCategory.CONTEXT, "CONTEXT",
            TokenCategory.TASK, "TASK",
            TokenCategory.CONDITION, "CONDITION",
            TokenCategory.ACTION, "PROCESS",
            TokenCategory.RESOURCE, "RESOURCE",
            TokenCategory.QUERY, "QUERY",
            TokenCategory.BATCH, "BATCH"
    );

    public static final String DEFAULT_KEY_PARAMETER = "ID";

    /**
     * Commands whose children form a structural relationship rather than a sequence.
     */
    public static final Map<String, RelationshipType> STRUCTURAL_COMMANDS = Map.of(
            "CONDITIONAL", RelationshipType.CONDITIONAL,
            "PARALLEL", RelationshipType.PARALLEL,
            "REPEAT", RelationshipType.REPETITION
    );

    /**
     * Parameter holding a REPEAT command's count.
     */
    public static final String COUNT_PARAMETER = "count";

    public static TokenCategory categoryForEntityType(String entityType) {
        if (entityType == null) {
            return TokenCategory.DIRECTIVE;
        }
        return ENTITY_TYPE_CATEGORIES.getOrDefault(entityType.toLowerCase(), TokenCategory.DIRECTIVE);
    }

    public static TokenCategory categoryForCommand(String commandName) {
        if (commandName == null) {
            return TokenCategory.DIRECTIVE;
        }
        return COMMAND_CATEGORIES.getOrDefault(commandName.toUpperCase(), TokenCategory.DIRECTIVE);
    }

    public static String keyParameterFor(TokenCategory category) {
        return KEY_PARAMETERS.getOrDefault(category, DEFAULT_KEY_PARAMETER);
    }
}
