package com.glyph.relationship;

import java.util.Objects;
import java.util.Optional;

/**
 * {@code trueBranch} runs when {@code condition} holds, otherwise the optional {@code falseBranch}.
 *
 * @param condition   Condition token
 * @param trueBranch  Token taken when the condition holds
 * @param falseBranch Token taken otherwise, or {@code null}
 */
public record ConditionalRelationship(String condition, String trueBranch, String falseBranch)
        implements Relationship {

    public ConditionalRelationship {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(trueBranch, "trueBranch");
        if (falseBranch != null && falseBranch.isEmpty()) {
            falseBranch = null;
        }
    }

    public ConditionalRelationship(String condition, String trueBranch) {
        this(condition, trueBranch, null);
    }

    public Optional<String> getFalseBranch() {
        return Optional.ofNullable(falseBranch);
    }

    @Override
    public RelationshipType getType() {
        return RelationshipType.CONDITIONAL;
    }

    @Override
    public String toExpression() {
        String expression = condition + "?" + trueBranch;
        return falseBranch == null ? expression : expression + ":" + falseBranch;
    }
}
