package com.glyph.expression;

import com.glyph.relationship.Operator;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Linearizes an expression tree into its symbolic string.
 * <p>
 * No parentheses are ever emitted: grouping is carried by the tree shape alone.
 * <pre>
 * leaf         -> identifier
 * sequence     -> left>right
 * parallel     -> left&amp;right
 * conditional  -> cond?true[:false]
 * repetition   -> **count expression
 * </pre>
 */
public class ExpressionSynthesizer {

    /**
     * Synthesize the string for a whole tree. An empty tree yields the empty string.
     */
    public String synthesize(ExpressionTree tree) {
        if (tree == null || tree.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        Deque<ExpressionTree.Step> pending = new ArrayDeque<>();
        pending.push(ExpressionTree.Step.expand(tree.getRoot()));

        while (!pending.isEmpty()) {
            ExpressionTree.Step step = pending.pop();
            if (step.text() != null) {
                sb.append(step.text());
                continue;
            }
            ExpressionNode node = tree.node(step.index());
            // pushed in reverse, popped in reading order
            switch (node.type()) {
                case LEAF -> sb.append(node.value());
                case SEQUENCE -> pushInfix(pending, node.left(), Operator.SEQUENCE.symbol(), node.right());
                case PARALLEL -> pushInfix(pending, node.left(), Operator.PARALLEL.symbol(), node.right());
                case CONDITIONAL -> {
                    if (node.hasFalseBranch()) {
                        pending.push(ExpressionTree.Step.expand(node.falseBranch()));
                        pending.push(ExpressionTree.Step.literal(":"));
                    }
                    pushInfix(pending, node.condition(), "?", node.trueBranch());
                }
                case REPETITION -> {
                    pending.push(ExpressionTree.Step.expand(node.expression()));
                    pending.push(ExpressionTree.Step.literal(Operator.REPETITION.symbol() + node.count()));
                }
            }
        }
        return sb.toString();
    }

    private static void pushInfix(Deque<ExpressionTree.Step> pending, int left, String operator, int right) {
        pending.push(ExpressionTree.Step.expand(right));
        pending.push(ExpressionTree.Step.literal(operator));
        pending.push(ExpressionTree.Step.expand(left));
    }
}
