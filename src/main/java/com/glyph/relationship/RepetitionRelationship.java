package com.glyph.relationship;

import java.util.Objects;

/**
 * {@code token} runs {@code count} times.
 */
public record RepetitionRelationship(String token, int count) implements Relationship {

    public RepetitionRelationship {
        Objects.requireNonNull(token, "token");
        if (count < 1) {
            throw new IllegalArgumentException("Repetition count must be positive, got " + count);
        }
    }

    @Override
    public RelationshipType getType() {
        return RelationshipType.REPETITION;
    }

    @Override
    public String toExpression() {
        return Operator.REPETITION.symbol() + count + token;
    }
}
