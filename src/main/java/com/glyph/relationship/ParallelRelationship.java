package com.glyph.relationship;

import java.util.List;

/**
 * Tokens that run side by side, in declaration order.
 */
public record ParallelRelationship(List<String> tokens) implements Relationship {

    public ParallelRelationship {
        if (tokens == null || tokens.isEmpty()) {
            throw new IllegalArgumentException("Parallel relationship needs at least one token");
        }
        tokens = List.copyOf(tokens);
    }

    public static ParallelRelationship of(String... tokens) {
        return new ParallelRelationship(List.of(tokens));
    }

    @Override
    public RelationshipType getType() {
        return RelationshipType.PARALLEL;
    }

    @Override
    public String toExpression() {
        return String.join(Operator.PARALLEL.symbol(), tokens);
    }
}
