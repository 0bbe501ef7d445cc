package com.loglens.query.ast;

import java.util.Objects;

/**
 * A term with no field: a case-insensitive full-text match on the raw event.
 */
public final class BareTermExpression implements Expression {

    private final Value term;

    public BareTermExpression(Value term) {
        this.term = Objects.requireNonNull(term, "term");
    }

    public Value getTerm() {
        return term;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.BARE_TERM;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BareTermExpression)) return false;
        return term.equals(((BareTermExpression) o).term);
    }

    @Override
    public int hashCode() {
        return term.hashCode();
    }

    @Override
    public String toString() {
        return term.toString();
    }
}
