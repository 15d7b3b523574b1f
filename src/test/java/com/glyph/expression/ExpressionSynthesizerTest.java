package com.glyph.expression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.glyph.expression.ExpressionTree.NONE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionSynthesizer.
 */
class ExpressionSynthesizerTest {

    private final ExpressionSynthesizer synthesizer = new ExpressionSynthesizer();

    @Test
    @DisplayName("An empty or missing tree synthesizes to the empty string")
    void shouldSynthesizeNothing() {
        assertEquals("", synthesizer.synthesize(new ExpressionTree()));
        assertEquals("", synthesizer.synthesize(null));
    }

    @Test
    @DisplayName("A lone leaf is its identifier")
    void shouldSynthesizeLeaf() {
        ExpressionTree tree = new ExpressionTree();
        tree.setRoot(tree.leaf("T9"));

        assertEquals("T9", synthesizer.synthesize(tree));
    }

    @Test
    @DisplayName("Grouping is carried by shape only, never by parentheses")
    void shouldNotEmitParentheses() {
        ExpressionTree tree = new ExpressionTree();
        int parallel = tree.parallel(tree.leaf("T1"), tree.leaf("T2"));
        int repeated = tree.repetition(4, tree.sequence(parallel, tree.leaf("T3")));
        tree.setRoot(tree.conditional(tree.leaf("L1"), repeated, tree.leaf("T5")));

        assertEquals("L1?**4T1&T2>T3:T5", synthesizer.synthesize(tree));
    }

    @Test
    @DisplayName("A conditional without false branch omits the colon")
    void shouldOmitMissingFalseBranch() {
        ExpressionTree tree = new ExpressionTree();
        tree.setRoot(tree.conditional(tree.leaf("L1"), tree.leaf("T1"), NONE));

        assertEquals("L1?T1", synthesizer.synthesize(tree));
    }
}
