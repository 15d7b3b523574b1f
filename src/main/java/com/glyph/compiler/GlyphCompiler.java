package com.glyph.compiler;

import com.glyph.config.GlyphConfig;
import com.glyph.mapper.CommandNode;
import com.glyph.mapper.CompilationRequest;
import com.glyph.mapper.EntityRecord;
import com.glyph.mapper.MappedStructure;
import com.glyph.mapper.RelationshipRecord;
import com.glyph.mapper.SemanticMapper;
import com.glyph.token.Token;
import com.glyph.token.TokenCategory;
import com.glyph.token.TokenIdGenerator;
import com.glyph.token.TokenRegistry;
import com.glyph.token.TokenRegistryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Entry point: maps upstream records to tokens and relationships, then synthesizes
 * the symbolic expression string.
 * <p>
 * Instances are not thread-safe; the registry they share is mutable state without
 * locking. Use one compiler per thread or serialize calls.
 */
public class GlyphCompiler {

    private static final Logger log = LoggerFactory.getLogger(GlyphCompiler.class);

    private final TokenIdGenerator generator;
    private final SemanticMapper mapper;
    private final StructureSynthesizer synthesizer;

    public GlyphCompiler(TokenIdGenerator generator) {
        this(generator, new SemanticMapper(generator), new StructureSynthesizer());
    }

    public GlyphCompiler(TokenIdGenerator generator, SemanticMapper mapper, StructureSynthesizer synthesizer) {
        this.generator = generator;
        this.mapper = mapper;
        this.synthesizer = synthesizer;
    }

    /**
     * Create a compiler with its own registry as described by the configuration.
     */
    public static GlyphCompiler create(GlyphConfig config) {
        TokenRegistry registry = TokenRegistryFactory.create(config.registry());
        log.info("Creating compiler '{}' with {} registry", config.name(),
                registry.hasStore() ? "persistent" : "in-memory");
        return new GlyphCompiler(new TokenIdGenerator(registry, config.generator()));
    }

    public String compile(CompilationRequest request) {
        return compile(mapper.map(request));
    }

    public String compile(List<EntityRecord> entities, List<RelationshipRecord> relationships) {
        return compile(mapper.mapEntities(entities, relationships));
    }

    public String compileHierarchy(List<CommandNode> commands) {
        return compile(mapper.mapHierarchy(commands));
    }

    public String compile(MappedStructure structure) {
        String result = synthesizer.synthesize(structure);
        log.debug("Compiled {} tokens / {} relationships to '{}'",
                structure.tokens().size(), structure.relationships().size(), result);
        return result;
    }

    public String generateId(String value, TokenCategory category) {
        return generator.generateId(value, category);
    }

    public boolean registerId(String value, TokenCategory category, String identifier) {
        return generator.registerId(value, category, identifier);
    }

    public Optional<Token> resolve(String identifier) {
        return generator.resolve(identifier);
    }

    public TokenIdGenerator getGenerator() {
        return generator;
    }

    public SemanticMapper getMapper() {
        return mapper;
    }
}
