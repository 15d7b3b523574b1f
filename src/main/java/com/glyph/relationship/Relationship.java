package com.glyph.relationship;

/**
 * A typed semantic link between token values; the raw input to tree synthesis.
 */
public interface Relationship {

    /**
     * Get the relationship kind.
     */
    RelationshipType getType();

    /**
     * Binding precedence of this relationship's operator.
     */
    default int getPrecedence() {
        return getType().precedence();
    }

    /**
     * Standalone rendering of this relationship alone, for logging.
     */
    String toExpression();
}
