package com.glyph.compiler;

import com.glyph.expression.ExpressionSynthesizer;
import com.glyph.expression.ExpressionTree;
import com.glyph.expression.ExpressionTreeBuilder;
import com.glyph.mapper.MappedStructure;
import com.glyph.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the final symbolic string for a mapped structure.
 * <p>
 * With no relationships, tree building is skipped and the first mapped token's
 * identifier is emitted as is (empty string when there are no tokens either).
 */
public class StructureSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(StructureSynthesizer.class);

    private final ExpressionTreeBuilder treeBuilder;
    private final ExpressionSynthesizer expressionSynthesizer;

    public StructureSynthesizer() {
        this(new ExpressionTreeBuilder(), new ExpressionSynthesizer());
    }

    public StructureSynthesizer(ExpressionTreeBuilder treeBuilder, ExpressionSynthesizer expressionSynthesizer) {
        this.treeBuilder = treeBuilder;
        this.expressionSynthesizer = expressionSynthesizer;
    }

    public String synthesize(MappedStructure structure) {
        if (structure.relationships().isEmpty()) {
            String single = structure.firstToken().map(Token::identifier).orElse("");
            log.debug("No relationships, emitting first token '{}'", single);
            return single;
        }

        ExpressionTree tree = treeBuilder.build(structure.relationships());
        String result = expressionSynthesizer.synthesize(tree);
        log.debug("Synthesized '{}' from {} nodes", result, tree.size());
        return result;
    }
}
