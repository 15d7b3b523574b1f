package com.glyph.expression;

import com.glyph.relationship.ConditionalRelationship;
import com.glyph.relationship.ParallelRelationship;
import com.glyph.relationship.Relationship;
import com.glyph.relationship.RepetitionRelationship;
import com.glyph.relationship.SequenceRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.glyph.expression.ExpressionTree.NONE;

/**
 * Merges an unordered bag of relationships into one expression tree.
 * <p>
 * Rules:
 * - Relationships are applied in descending operator precedence; ties keep input order
 * - Sequence and repetition attach in place to an existing leaf with a matching value
 * - Anything that cannot attach is merged onto the rightmost (or leftmost) frontier
 * - When two relationships rewrite the same leaf the later one wins; cycles are not
 *   detected and resolve the same way
 */
public class ExpressionTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTreeBuilder.class);

    /**
     * Build a tree from the given relationships.
     *
     * @param relationships Relationships in input order
     * @return Tree whose root is {@link ExpressionTree#NONE} when there are no relationships
     */
    public ExpressionTree build(List<? extends Relationship> relationships) {
        ExpressionTree tree = new ExpressionTree();
        if (relationships == null || relationships.isEmpty()) {
            return tree;
        }

        List<Relationship> sorted = new ArrayList<>(relationships);
        sorted.sort(Comparator.comparingInt(Relationship::getPrecedence).reversed());

        int root = NONE;
        for (Relationship relationship : sorted) {
            root = switch (relationship.getType()) {
                case SEQUENCE -> addSequence(tree, root, (SequenceRelationship) relationship);
                case PARALLEL -> addParallel(tree, root, (ParallelRelationship) relationship);
                case CONDITIONAL -> addConditional(tree, root, (ConditionalRelationship) relationship);
                case REPETITION -> addRepetition(tree, root, (RepetitionRelationship) relationship);
            };
            tree.setRoot(root);
            if (log.isTraceEnabled()) {
                log.trace("Applied {} -> {}", relationship.toExpression(), tree.toDebugString());
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Built expression tree from {} relationships: {}", sorted.size(), tree.toDebugString());
        }
        return tree;
    }

    private int addSequence(ExpressionTree tree, int root, SequenceRelationship relationship) {
        String source = relationship.source();
        String target = relationship.target();

        if (isExactSequence(tree, root, source, target)) {
            return root;
        }

        int sourceLeaf = tree.findLeaf(root, source);
        if (sourceLeaf != NONE) {
            int sequence = tree.sequence(sourceLeaf, tree.leaf(target));
            return tree.replace(root, sourceLeaf, sequence);
        }

        int targetLeaf = tree.findLeaf(root, target);
        if (targetLeaf != NONE) {
            int sequence = tree.sequence(tree.leaf(source), targetLeaf);
            return tree.replace(root, targetLeaf, sequence);
        }

        return merge(tree, root, tree.sequence(tree.leaf(source), tree.leaf(target)));
    }

    private int addParallel(ExpressionTree tree, int root, ParallelRelationship relationship) {
        List<String> tokens = relationship.tokens();
        int chain = tree.leaf(tokens.get(0));
        for (int i = 1; i < tokens.size(); i++) {
            chain = tree.parallel(chain, tree.leaf(tokens.get(i)));
        }
        return merge(tree, root, chain);
    }

    private int addConditional(ExpressionTree tree, int root, ConditionalRelationship relationship) {
        int falseBranch = relationship.getFalseBranch()
                .map(tree::leaf)
                .orElse(NONE);
        int conditional = tree.conditional(
                tree.leaf(relationship.condition()),
                tree.leaf(relationship.trueBranch()),
                falseBranch);
        return merge(tree, root, conditional);
    }

    private int addRepetition(ExpressionTree tree, int root, RepetitionRelationship relationship) {
        int leaf = tree.findLeaf(root, relationship.token());
        if (leaf != NONE) {
            int repetition = tree.repetition(relationship.count(), leaf);
            return tree.replace(root, leaf, repetition);
        }
        return merge(tree, root, tree.repetition(relationship.count(), tree.leaf(relationship.token())));
    }

    /**
     * Merge two subtrees of the same arena.
     * <p>
     * If {@code a} is a sequence, its rightmost leaf becomes {@code leaf > b}. Otherwise,
     * if {@code b} is a sequence, its leftmost leaf becomes {@code a > leaf}. Otherwise
     * the result is {@code a > b}.
     *
     * @return Root of the merged tree
     */
    int merge(ExpressionTree tree, int a, int b) {
        if (a == NONE) {
            return b;
        }
        if (b == NONE) {
            return a;
        }

        if (tree.node(a).type() == NodeType.SEQUENCE) {
            int rightmost = tree.rightmostLeaf(a);
            return tree.replace(a, rightmost, tree.sequence(rightmost, b));
        }

        if (tree.node(b).type() == NodeType.SEQUENCE) {
            int leftmost = tree.leftmostLeaf(b);
            return tree.replace(b, leftmost, tree.sequence(a, leftmost));
        }

        return tree.sequence(a, b);
    }

    private boolean isExactSequence(ExpressionTree tree, int root, String source, String target) {
        if (root == NONE) {
            return false;
        }
        ExpressionNode node = tree.node(root);
        if (node.type() != NodeType.SEQUENCE) {
            return false;
        }
        ExpressionNode left = tree.node(node.left());
        ExpressionNode right = tree.node(node.right());
        return left.isLeaf() && right.isLeaf()
                && source.equals(left.value())
                && target.equals(right.value());
    }
}
