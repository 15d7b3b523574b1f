package com.glyph.relationship;

import java.util.Objects;

/**
 * {@code source} runs before {@code target}.
 */
public record SequenceRelationship(String source, String target) implements Relationship {

    public SequenceRelationship {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    @Override
    public RelationshipType getType() {
        return RelationshipType.SEQUENCE;
    }

    @Override
    public String toExpression() {
        return source + Operator.SEQUENCE.symbol() + target;
    }
}
