package com.glyph.relationship;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of relationship the tree builder understands, each tied to one operator.
 */
public enum RelationshipType {
    SEQUENCE("sequence", Operator.SEQUENCE),
    PARALLEL("parallel", Operator.PARALLEL),
    CONDITIONAL("conditional", Operator.CONDITIONAL),
    REPETITION("repetition", Operator.REPETITION);

    private final String tag;
    private final Operator operator;

    RelationshipType(String tag, Operator operator) {
        this.tag = tag;
        this.operator = operator;
    }

    /**
     * Type tag used in relationship records.
     */
    public String tag() {
        return tag;
    }

    public Operator operator() {
        return operator;
    }

    public int precedence() {
        return operator.precedence();
    }

    /**
     * Look up a kind by its type tag, case-insensitively.
     */
    public static Optional<RelationshipType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (RelationshipType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
