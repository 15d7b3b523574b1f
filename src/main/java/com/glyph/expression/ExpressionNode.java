package com.glyph.expression;

import java.util.ArrayList;
import java.util.List;

import static com.glyph.expression.ExpressionTree.NONE;

/**
 * One node of an {@link ExpressionTree}. Children are arena indices;
 * unused slots hold {@link ExpressionTree#NONE}.
 *
 * @param type        Node kind
 * @param value       Token identifier (LEAF only)
 * @param count       Repetition count (REPETITION only)
 * @param left        Left operand (SEQUENCE, PARALLEL)
 * @param right       Right operand (SEQUENCE, PARALLEL)
 * @param condition   Condition (CONDITIONAL)
 * @param trueBranch  Branch taken when the condition holds (CONDITIONAL)
 * @param falseBranch Optional other branch (CONDITIONAL)
 * @param expression  Repeated expression (REPETITION)
 */
public record ExpressionNode(
        NodeType type,
        String value,
        int count,
        int left,
        int right,
        int condition,
        int trueBranch,
        int falseBranch,
        int expression
) {
    public static ExpressionNode leaf(String value) {
        return new ExpressionNode(NodeType.LEAF, value, 0, NONE, NONE, NONE, NONE, NONE, NONE);
    }

    public static ExpressionNode sequence(int left, int right) {
        return new ExpressionNode(NodeType.SEQUENCE, null, 0, left, right, NONE, NONE, NONE, NONE);
    }

    public static ExpressionNode parallel(int left, int right) {
        return new ExpressionNode(NodeType.PARALLEL, null, 0, left, right, NONE, NONE, NONE, NONE);
    }

    public static ExpressionNode conditional(int condition, int trueBranch, int falseBranch) {
        return new ExpressionNode(NodeType.CONDITIONAL, null, 0, NONE, NONE, condition, trueBranch, falseBranch, NONE);
    }

    public static ExpressionNode repetition(int count, int expression) {
        return new ExpressionNode(NodeType.REPETITION, null, count, NONE, NONE, NONE, NONE, NONE, expression);
    }

    public boolean isLeaf() {
        return type == NodeType.LEAF;
    }

    public boolean hasFalseBranch() {
        return falseBranch != NONE;
    }

    /**
     * Child indices in search order: left, right, condition, trueBranch, falseBranch, expression.
     */
    public List<Integer> children() {
        List<Integer> children = new ArrayList<>(3);
        for (int child : new int[]{left, right, condition, trueBranch, falseBranch, expression}) {
            if (child != NONE) {
                children.add(child);
            }
        }
        return children;
    }

    /**
     * Copy of this node with every child slot equal to {@code target} pointing at {@code replacement}.
     */
    public ExpressionNode withChildReplaced(int target, int replacement) {
        return new ExpressionNode(type, value, count,
                swap(left, target, replacement),
                swap(right, target, replacement),
                swap(condition, target, replacement),
                swap(trueBranch, target, replacement),
                swap(falseBranch, target, replacement),
                swap(expression, target, replacement));
    }

    private static int swap(int slot, int target, int replacement) {
        return slot == target ? replacement : slot;
    }
}
