package com.glyph.mapper;

import com.glyph.exception.ConfigurationException;
import com.glyph.exception.UnrecognizedRelationshipException;
import com.glyph.relationship.ConditionalRelationship;
import com.glyph.relationship.ParallelRelationship;
import com.glyph.relationship.Relationship;
import com.glyph.relationship.RepetitionRelationship;
import com.glyph.relationship.SequenceRelationship;
import com.glyph.token.Token;
import com.glyph.token.TokenCategory;
import com.glyph.token.TokenIdGenerator;
import com.glyph.token.TokenRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SemanticMapper.
 */
class SemanticMapperTest {

    private SemanticMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new SemanticMapper(new TokenIdGenerator(new TokenRegistry()));
    }

    // =====================================================================
    // Flat entities
    // =====================================================================

    @Test
    @DisplayName("Entities should receive tokens from their entity type's category")
    void shouldMapEntityTypes() {
        MappedStructure structure = mapper.mapEntities(List.of(
                new EntityRecord("build the project", "task_name", "build project"),
                new EntityRecord("the build is green", "condition", "build is green"),
                new EntityRecord("twice", "quantifier", "twice"),
                new EntityRecord("somewhere", "location", "somewhere")
        ), List.of());

        assertEquals("T01", structure.tokens().get("build the project").identifier());
        assertEquals("L01", structure.tokens().get("the build is green").identifier());
        assertEquals(TokenCategory.ACTION, structure.tokens().get("twice").category());
        assertEquals(TokenCategory.DIRECTIVE, structure.tokens().get("somewhere").category());
        assertEquals("T01", structure.firstToken().orElseThrow().identifier());
    }

    @Test
    @DisplayName("Participants should resolve to identifiers of mapped sources")
    void shouldResolveParticipants() {
        MappedStructure structure = mapper.mapEntities(List.of(
                new EntityRecord("build", "task_name", "build"),
                new EntityRecord("test", "task_name", "test")
        ), List.of(
                new RelationshipRecord("sequence", List.of("build", "test")),
                new RelationshipRecord("sequence", List.of("test", "T07"))
        ));

        assertEquals(List.of(
                new SequenceRelationship("T01", "T02"),
                new SequenceRelationship("T02", "T07")
        ), structure.relationships());
    }

    @Test
    @DisplayName("Each relationship kind should be converted with its arity")
    void shouldConvertEveryKind() {
        Map<String, Token> none = Map.of();

        assertEquals(ParallelRelationship.of("T1", "T2", "T3"),
                mapper.toRelationship(new RelationshipRecord("parallel", List.of("T1", "T2", "T3")), none));
        assertEquals(new ConditionalRelationship("L1", "T1", "T2"),
                mapper.toRelationship(new RelationshipRecord("conditional", List.of("L1", "T1", "T2")), none));
        assertEquals(new ConditionalRelationship("L1", "T1"),
                mapper.toRelationship(new RelationshipRecord("conditional", List.of("L1", "T1")), none));
        assertEquals(new RepetitionRelationship("T1", 4),
                mapper.toRelationship(new RelationshipRecord("repetition", List.of("T1"), 4), none));
        assertEquals(new RepetitionRelationship("T1", 1),
                mapper.toRelationship(new RelationshipRecord("repetition", List.of("T1")), none));
    }

    @Test
    @DisplayName("An unknown relationship kind should be reported with its tag")
    void shouldRejectUnknownKind() {
        UnrecognizedRelationshipException e = assertThrows(UnrecognizedRelationshipException.class,
                () -> mapper.toRelationship(new RelationshipRecord("loop", List.of("T1")), Map.of()));

        assertEquals("loop", e.getTypeTag());
    }

    @Test
    @DisplayName("Wrong participant counts should be rejected")
    void shouldRejectWrongArity() {
        assertThrows(ConfigurationException.class,
                () -> mapper.toRelationship(new RelationshipRecord("sequence", List.of("T1")), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> mapper.toRelationship(new RelationshipRecord("conditional", List.of("L1")), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> mapper.toRelationship(new RelationshipRecord("parallel", List.of()), Map.of()));
        assertThrows(ConfigurationException.class,
                () -> mapper.toRelationship(new RelationshipRecord("repetition", List.of("T1"), 0), Map.of()));
    }

    // =====================================================================
    // Command hierarchies
    // =====================================================================

    @Test
    @DisplayName("Plain children should chain in sequence while roots stay unlinked")
    void shouldChainChildrenOnly() {
        CommandNode first = CommandNode.leaf(command("INITIALIZE", Map.of("SYSTEM", "ci")));
        CommandNode second = new CommandNode(command("EXECUTE", Map.of("TASK", "release")), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "compile"))),
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "package")))));

        MappedStructure structure = mapper.mapHierarchy(List.of(first, second));

        assertEquals(List.of(new SequenceRelationship("T02", "T03")), structure.relationships());
        assertEquals(4, structure.tokens().size());
        assertEquals("S01", structure.firstToken().orElseThrow().identifier());
    }

    @Test
    @DisplayName("Leaf-only roots produce no relationships")
    void shouldLeaveLeafRootsUnrelated() {
        MappedStructure structure = mapper.mapHierarchy(List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "a"))),
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "b")))));

        assertTrue(structure.relationships().isEmpty());
        assertEquals("T01", structure.firstToken().orElseThrow().identifier());
    }

    @Test
    @DisplayName("Siblings sharing a source line should keep their own tokens")
    void shouldKeepSiblingsWithSameLineApart() {
        CommandNode parent = new CommandNode(new CommandRecord("EXECUTE", "EXECUTE", Map.of("TASK", "release")), List.of(
                CommandNode.leaf(new CommandRecord("EXECUTE_TASK", "EXECUTE_TASK", Map.of("TASK", "compile"))),
                CommandNode.leaf(new CommandRecord("EXECUTE_TASK", "EXECUTE_TASK", Map.of("TASK", "package")))));

        MappedStructure structure = mapper.mapHierarchy(List.of(parent));

        assertEquals(List.of(new SequenceRelationship("T02", "T03")), structure.relationships());
        assertEquals("T02", structure.tokens().get("EXECUTE_TASK").identifier());
        assertEquals("T03", structure.tokens().get("EXECUTE_TASK#2").identifier());
        assertEquals(3, structure.tokens().size());
    }

    @Test
    @DisplayName("CONDITIONAL children should become condition and branches")
    void shouldMapConditionalCommand() {
        CommandNode conditional = new CommandNode(command("CONDITIONAL", Map.of("CONDITION", "ready")), List.of(
                CommandNode.leaf(command("CONDITIONAL", Map.of("CONDITION", "tests pass"))),
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "deploy"))),
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "rollback")))));

        MappedStructure structure = mapper.mapHierarchy(List.of(conditional));

        assertEquals(List.<Relationship>of(new ConditionalRelationship("L02", "T01", "T02")),
                structure.relationships());
    }

    @Test
    @DisplayName("CONDITIONAL with a single child should be rejected")
    void shouldRejectShortConditional() {
        CommandNode conditional = new CommandNode(command("CONDITIONAL", Map.of("CONDITION", "ready")), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "deploy")))));

        assertThrows(ConfigurationException.class, () -> mapper.mapHierarchy(List.of(conditional)));
    }

    @Test
    @DisplayName("PARALLEL children should run side by side")
    void shouldMapParallelCommand() {
        CommandNode parallel = new CommandNode(command("PARALLEL", Map.of("PROCESS", "checks")), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "lint"))),
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "test"))),
                CommandNode.leaf(command("EXECUTE_QUERY", Map.of("QUERY", "coverage")))));

        MappedStructure structure = mapper.mapHierarchy(List.of(parallel));

        assertEquals("P01", structure.firstToken().orElseThrow().identifier());
        assertEquals(List.<Relationship>of(ParallelRelationship.of("T01", "T02", "Q01")),
                structure.relationships());
    }

    @Test
    @DisplayName("REPEAT should use its count parameter, defaulting to one")
    void shouldMapRepeatCommand() {
        CommandNode counted = new CommandNode(command("REPEAT", Map.of("count", "3")), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "ping")))));
        CommandNode uncounted = new CommandNode(new CommandRecord(">>>REPEAT", "REPEAT", Map.of()), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "pong")))));

        MappedStructure structure = mapper.mapHierarchy(List.of(counted, uncounted));

        assertTrue(structure.relationships().contains(new RepetitionRelationship("T01", 3)));
        assertTrue(structure.relationships().contains(new RepetitionRelationship("T02", 1)));
    }

    @Test
    @DisplayName("REPEAT with a non-numeric or non-positive count should be rejected")
    void shouldRejectInvalidRepeatCount() {
        CommandNode invalid = new CommandNode(command("REPEAT", Map.of("count", "often")), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "ping")))));
        CommandNode zero = new CommandNode(command("REPEAT", Map.of("COUNT", "0")), List.of(
                CommandNode.leaf(command("EXECUTE_TASK", Map.of("TASK", "ping")))));

        assertThrows(ConfigurationException.class, () -> mapper.mapHierarchy(List.of(invalid)));
        assertThrows(ConfigurationException.class, () -> mapper.mapHierarchy(List.of(zero)));
    }

    @Test
    @DisplayName("A command without its key parameter should be minted from its line")
    void shouldFallBackToLine() {
        MappedStructure structure = mapper.mapHierarchy(List.of(
                CommandNode.leaf(new CommandRecord(">>>EXECUTE_TASK[name=deploy]", "EXECUTE_TASK",
                        Map.of("name", "deploy")))));

        assertEquals("execute_tasknamedeploy",
                structure.tokens().get(">>>EXECUTE_TASK[name=deploy]").canonicalValue());
    }

    @Test
    @DisplayName("map should dispatch on the shape of the request")
    void shouldDispatchOnRequestShape() {
        CompilationRequest flat = CompilationRequest.ofEntities(
                List.of(new EntityRecord("build", "task_name", "build")), List.of());
        CompilationRequest hierarchical = CompilationRequest.ofCommands(
                List.of(CommandNode.leaf(command("EXECUTE_QUERY", Map.of("QUERY", "status")))));

        assertEquals("T01", mapper.map(flat).firstToken().orElseThrow().identifier());
        assertEquals("Q01", mapper.map(hierarchical).firstToken().orElseThrow().identifier());
    }

    private static CommandRecord command(String name, Map<String, String> parameters) {
        StringBuilder line = new StringBuilder(">>>").append(name);
        parameters.forEach((key, value) -> line.append('[').append(key).append('=').append(value).append(']'));
        return new CommandRecord(line.toString(), name, parameters);
    }
}
