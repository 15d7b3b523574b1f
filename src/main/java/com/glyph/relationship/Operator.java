package com.glyph.relationship;

/**
 * Operators of the symbolic grammar with their binding precedence
 * (higher binds tighter and is applied first).
 * <p>
 * Only SEQUENCE, PARALLEL, CONDITIONAL and REPETITION are synthesized by the
 * tree builder; the others are produced by other stages and only take part
 * in ordering.
 */
public enum Operator {
    CONTEXT_ACTIVATION("!", 7),
    REPETITION("**", 6),
    PIPING("|", 5),
    AGGREGATION("#", 4),
    ASSIGNMENT("=", 3),
    PARALLEL("&", 2),
    SEQUENCE(">", 1),
    CONDITIONAL("?:", 0);

    private final String symbol;
    private final int precedence;

    Operator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }
}
