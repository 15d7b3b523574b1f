package com.glyph.mapper;

import com.glyph.exception.ConfigurationException;
import com.glyph.exception.UnrecognizedRelationshipException;
import com.glyph.relationship.ConditionalRelationship;
import com.glyph.relationship.ParallelRelationship;
import com.glyph.relationship.Relationship;
import com.glyph.relationship.RelationshipType;
import com.glyph.relationship.RepetitionRelationship;
import com.glyph.relationship.SequenceRelationship;
import com.glyph.token.Token;
import com.glyph.token.TokenCategory;
import com.glyph.token.TokenIdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns upstream records into the canonical {tokens, relationships} structure.
 * <p>
 * Flat input: every entity gets a token from its entity type's category, and each
 * relationship record becomes one relationship over token identifiers.
 * <p>
 * Hierarchical input: every command gets a token from its command's category, and
 * each command with children contributes relationships:
 * - CONDITIONAL: children become condition, true branch and optional false branch
 * - PARALLEL: one parallel relationship over all children
 * - REPEAT: one repetition of its child using the {@code count} parameter (default 1)
 * - anything else: a sequence between each pair of consecutive children
 * Root commands are not linked to each other; a hierarchy with no relationships
 * compiles to its first command's token.
 * <p>
 * Command tokens are tracked per node, so commands sharing a source line (or missing
 * one) still get their own tokens.
 */
public class SemanticMapper {

    private static final Logger log = LoggerFactory.getLogger(SemanticMapper.class);

    private final TokenIdGenerator generator;

    public SemanticMapper(TokenIdGenerator generator) {
        this.generator = generator;
    }

    /**
     * Map a request, using the command hierarchy when one is present.
     */
    public MappedStructure map(CompilationRequest request) {
        if (request.isHierarchical()) {
            return mapHierarchy(request.commands());
        }
        return mapEntities(request.entities(), request.relationships());
    }

    /**
     * Map flat entities and relationship records.
     *
     * @throws UnrecognizedRelationshipException if a record's type tag is unknown
     * @throws ConfigurationException            if a record has the wrong number of participants
     */
    public MappedStructure mapEntities(List<EntityRecord> entities, List<RelationshipRecord> records) {
        Map<String, Token> tokens = new LinkedHashMap<>();
        for (EntityRecord entity : entities) {
            TokenCategory category = MappingTables.categoryForEntityType(entity.entityType());
            Token token = generator.token(entity.value(), category);
            tokens.put(entity.match(), token);
            log.debug("Entity '{}' ({}) -> {}", entity.match(), entity.entityType(), token.identifier());
        }

        List<Relationship> relationships = new ArrayList<>();
        for (RelationshipRecord record : records) {
            relationships.add(toRelationship(record, tokens));
        }

        log.debug("Mapped {} entities and {} relationships", tokens.size(), relationships.size());
        return new MappedStructure(tokens, relationships);
    }

    /**
     * Map a command hierarchy.
     *
     * @throws ConfigurationException if a structural command has too few children
     *                                or a non-numeric count
     */
    public MappedStructure mapHierarchy(List<CommandNode> roots) {
        Map<CommandNode, Token> nodeTokens = new IdentityHashMap<>();
        Map<String, Token> tokens = new LinkedHashMap<>();
        for (CommandNode root : roots) {
            mapCommandTokens(root, nodeTokens, tokens);
        }

        List<Relationship> relationships = new ArrayList<>();
        for (CommandNode root : roots) {
            addCommandRelationships(root, nodeTokens, relationships);
        }

        log.debug("Mapped {} commands and {} relationships", nodeTokens.size(), relationships.size());
        return new MappedStructure(tokens, relationships);
    }

    /**
     * Convert one relationship record, resolving participants against mapped tokens.
     * A participant naming a mapped source resolves to that token's identifier;
     * anything else is taken as a token value already.
     */
    public Relationship toRelationship(RelationshipRecord record, Map<String, Token> tokens) {
        RelationshipType type = RelationshipType.fromTag(record.type())
                .orElseThrow(() -> new UnrecognizedRelationshipException(record.type()));

        List<String> participants = new ArrayList<>();
        for (String participant : record.participants()) {
            Token token = tokens.get(participant);
            participants.add(token != null ? token.identifier() : participant);
        }

        return switch (type) {
            case SEQUENCE -> {
                requireParticipants(type, participants, 2, 2);
                yield new SequenceRelationship(participants.get(0), participants.get(1));
            }
            case PARALLEL -> {
                requireParticipants(type, participants, 1, Integer.MAX_VALUE);
                yield new ParallelRelationship(participants);
            }
            case CONDITIONAL -> {
                requireParticipants(type, participants, 2, 3);
                yield new ConditionalRelationship(participants.get(0), participants.get(1),
                        participants.size() > 2 ? participants.get(2) : null);
            }
            case REPETITION -> {
                requireParticipants(type, participants, 1, 1);
                int count = record.count() == null ? 1 : record.count();
                if (count < 1) {
                    throw new ConfigurationException("Repetition count must be positive, got " + count);
                }
                yield new RepetitionRelationship(participants.get(0), count);
            }
        };
    }

    private void mapCommandTokens(CommandNode node, Map<CommandNode, Token> nodeTokens,
                                  Map<String, Token> tokens) {
        CommandRecord command = node.command();
        TokenCategory category = MappingTables.categoryForCommand(command.name());
        String keyParameter = MappingTables.keyParameterFor(category);

        String value = command.parameter(keyParameter);
        if (value == null || value.isBlank()) {
            log.debug("Command '{}' has no {} parameter, minting from its line", command.line(), keyParameter);
            value = command.line();
        }

        Token token = generator.token(value, category);
        nodeTokens.put(node, token);
        tokens.put(sourceKey(command.line(), tokens), token);
        log.debug("Command '{}' -> {}", command.line(), token.identifier());

        for (CommandNode child : node.children()) {
            mapCommandTokens(child, nodeTokens, tokens);
        }
    }

    private void addCommandRelationships(CommandNode node, Map<CommandNode, Token> tokens,
                                         List<Relationship> relationships) {
        if (node.isLeaf()) {
            return;
        }

        CommandRecord command = node.command();
        List<String> children = identifiers(node.children(), tokens);
        RelationshipType structural = command.name() == null
                ? null
                : MappingTables.STRUCTURAL_COMMANDS.get(command.name().toUpperCase());

        if (structural == RelationshipType.CONDITIONAL) {
            if (children.size() < 2) {
                throw new ConfigurationException("CONDITIONAL command '" + command.line()
                        + "' needs a condition and a true branch, found " + children.size() + " children");
            }
            warnIgnoredChildren(command, children, 3);
            relationships.add(new ConditionalRelationship(children.get(0), children.get(1),
                    children.size() > 2 ? children.get(2) : null));
        } else if (structural == RelationshipType.PARALLEL) {
            relationships.add(new ParallelRelationship(children));
        } else if (structural == RelationshipType.REPETITION) {
            warnIgnoredChildren(command, children, 1);
            relationships.add(new RepetitionRelationship(children.get(0), parseCount(command)));
        } else {
            addSequenceChain(children, relationships);
        }

        for (CommandNode child : node.children()) {
            addCommandRelationships(child, tokens, relationships);
        }
    }

    private void addSequenceChain(List<String> identifiers, List<Relationship> relationships) {
        for (int i = 0; i + 1 < identifiers.size(); i++) {
            relationships.add(new SequenceRelationship(identifiers.get(i), identifiers.get(i + 1)));
        }
    }

    private List<String> identifiers(List<CommandNode> nodes, Map<CommandNode, Token> tokens) {
        List<String> identifiers = new ArrayList<>(nodes.size());
        for (CommandNode node : nodes) {
            identifiers.add(tokens.get(node).identifier());
        }
        return identifiers;
    }

    /**
     * Source key for a command in the exported token map. A repeated line gets a
     * {@code #n} occurrence suffix so no token is hidden.
     */
    private static String sourceKey(String line, Map<String, Token> tokens) {
        if (!tokens.containsKey(line)) {
            return line;
        }
        int occurrence = 2;
        while (tokens.containsKey(line + "#" + occurrence)) {
            occurrence++;
        }
        return line + "#" + occurrence;
    }

    private int parseCount(CommandRecord command) {
        String raw = command.parameter(MappingTables.COUNT_PARAMETER);
        if (raw == null || raw.isBlank()) {
            return 1;
        }
        try {
            int count = Integer.parseInt(raw.trim());
            if (count < 1) {
                throw new ConfigurationException("REPEAT command '" + command.line()
                        + "' has non-positive count " + count);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("REPEAT command '" + command.line()
                    + "' has invalid count '" + raw + "'", e);
        }
    }

    private void warnIgnoredChildren(CommandRecord command, List<String> children, int used) {
        if (children.size() > used) {
            log.warn("Command '{}' uses {} children, ignoring {}",
                    command.line(), used, children.subList(used, children.size()));
        }
    }

    private static void requireParticipants(RelationshipType type, List<String> participants, int min, int max) {
        int size = participants.size();
        if (size < min || size > max) {
            String expected = min == max ? String.valueOf(min)
                    : max == Integer.MAX_VALUE ? "at least " + min : min + " to " + max;
            throw new ConfigurationException("Relationship '" + type.tag() + "' needs "
                    + expected + " participants, got " + size);
        }
    }
}
