package com.glyph.expression;

/**
 * Kinds of expression tree node.
 */
public enum NodeType {
    LEAF,
    SEQUENCE,
    PARALLEL,
    CONDITIONAL,
    REPETITION
}
