package com.glyph.expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Arena holding every node of one expression tree. Nodes are addressed by index and
 * links between them are indices, so replacing a subtree never depends on object
 * identity and two leaves with the same value stay distinct.
 * <p>
 * Nodes that a replacement detaches stay in the arena but are no longer reachable
 * from the root. A tree is built for one compilation and then discarded.
 * <p>
 * All walks use an explicit stack, so depth is bounded by heap rather than by the
 * thread stack.
 */
public final class ExpressionTree {

    /**
     * Index meaning "no node".
     */
    public static final int NONE = -1;

    private final List<ExpressionNode> nodes = new ArrayList<>();
    private int root = NONE;

    public int leaf(String value) {
        return add(ExpressionNode.leaf(value));
    }

    public int sequence(int left, int right) {
        return add(ExpressionNode.sequence(left, right));
    }

    public int parallel(int left, int right) {
        return add(ExpressionNode.parallel(left, right));
    }

    public int conditional(int condition, int trueBranch, int falseBranch) {
        return add(ExpressionNode.conditional(condition, trueBranch, falseBranch));
    }

    public int repetition(int count, int expression) {
        return add(ExpressionNode.repetition(count, expression));
    }

    public ExpressionNode node(int index) {
        return nodes.get(index);
    }

    public int getRoot() {
        return root;
    }

    public void setRoot(int root) {
        this.root = root;
    }

    public boolean isEmpty() {
        return root == NONE;
    }

    /**
     * Number of nodes in the arena, reachable or not.
     */
    public int arenaSize() {
        return nodes.size();
    }

    /**
     * Number of nodes reachable from the root.
     */
    public int size() {
        return root == NONE ? 0 : count(root);
    }

    /**
     * Depth-first search for the first leaf whose value equals {@code value}.
     *
     * @param from  Subtree to search
     * @param value Leaf value to look for
     * @return Index of the leaf, or {@link #NONE} if there is none
     */
    public int findLeaf(int from, String value) {
        if (from == NONE) {
            return NONE;
        }
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(from);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            ExpressionNode node = nodes.get(current);
            if (node.isLeaf()) {
                if (value.equals(node.value())) {
                    return current;
                }
                continue;
            }
            pushChildren(node, pending);
        }
        return NONE;
    }

    /**
     * Substitute every occurrence of {@code target} reachable from {@code subtree}
     * with {@code replacement}. The replacement itself is not searched.
     *
     * @return New root of the subtree ({@code replacement} if the subtree was the target)
     */
    public int replace(int subtree, int target, int replacement) {
        if (subtree == NONE) {
            return NONE;
        }
        if (subtree == target) {
            return replacement;
        }
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(subtree);
        while (!pending.isEmpty()) {
            int current = pending.pop();
            ExpressionNode node = nodes.get(current);
            boolean holdsTarget = false;
            for (int child : node.children()) {
                if (child == target) {
                    holdsTarget = true;
                } else {
                    pending.push(child);
                }
            }
            if (holdsTarget) {
                nodes.set(current, node.withChildReplaced(target, replacement));
            }
        }
        return subtree;
    }

    /**
     * Last leaf in reading order, following right, falseBranch (or trueBranch when there
     * is no false branch) and expression links.
     */
    public int rightmostLeaf(int from) {
        int current = from;
        while (current != NONE) {
            ExpressionNode node = nodes.get(current);
            switch (node.type()) {
                case LEAF -> {
                    return current;
                }
                case SEQUENCE, PARALLEL -> current = node.right();
                case CONDITIONAL -> current = node.hasFalseBranch() ? node.falseBranch() : node.trueBranch();
                case REPETITION -> current = node.expression();
            }
        }
        return NONE;
    }

    /**
     * First leaf in reading order, following left, condition and expression links.
     */
    public int leftmostLeaf(int from) {
        int current = from;
        while (current != NONE) {
            ExpressionNode node = nodes.get(current);
            switch (node.type()) {
                case LEAF -> {
                    return current;
                }
                case SEQUENCE, PARALLEL -> current = node.left();
                case CONDITIONAL -> current = node.condition();
                case REPETITION -> current = node.expression();
            }
        }
        return NONE;
    }

    /**
     * Parenthesized prefix rendering of the reachable tree, e.g. {@code (> T1 (> T2 T3))}.
     * Shows grouping that the synthesized string leaves implicit.
     */
    public String toDebugString() {
        if (root == NONE) {
            return "()";
        }
        StringBuilder sb = new StringBuilder();
        Deque<Step> pending = new ArrayDeque<>();
        pending.push(Step.expand(root));
        while (!pending.isEmpty()) {
            Step step = pending.pop();
            if (step.text() != null) {
                sb.append(step.text());
                continue;
            }
            ExpressionNode node = nodes.get(step.index());
            switch (node.type()) {
                case LEAF -> sb.append(node.value());
                case SEQUENCE -> pushOperands(">", pending, node.left(), node.right());
                case PARALLEL -> pushOperands("&", pending, node.left(), node.right());
                case CONDITIONAL -> {
                    if (node.hasFalseBranch()) {
                        pushOperands("?:", pending, node.condition(), node.trueBranch(), node.falseBranch());
                    } else {
                        pushOperands("?", pending, node.condition(), node.trueBranch());
                    }
                }
                case REPETITION -> pushOperands("**" + node.count(), pending, node.expression());
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toDebugString();
    }

    private int add(ExpressionNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    private int count(int index) {
        int total = 0;
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(index);
        while (!pending.isEmpty()) {
            total++;
            for (int child : nodes.get(pending.pop()).children()) {
                pending.push(child);
            }
        }
        return total;
    }

    /**
     * Push children so that they pop in search order.
     */
    private static void pushChildren(ExpressionNode node, Deque<Integer> pending) {
        List<Integer> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    /**
     * Schedule {@code (op a b ...)}; pushed in reverse so it pops in reading order.
     */
    private static void pushOperands(String operator, Deque<Step> pending, int... operands) {
        pending.push(Step.literal(")"));
        for (int i = operands.length - 1; i >= 0; i--) {
            pending.push(Step.expand(operands[i]));
            pending.push(Step.literal(" "));
        }
        pending.push(Step.literal("(" + operator));
    }

    /**
     * Pending work for a rendering walk: either a node to expand or literal text.
     */
    record Step(int index, String text) {
        static Step expand(int index) {
            return new Step(index, null);
        }

        static Step literal(String text) {
            return new Step(NONE, text);
        }
    }
}
