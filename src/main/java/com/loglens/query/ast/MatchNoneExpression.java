package com.loglens.query.ast;

import java.util.Objects;

/**
 * Never matches. Stands in for a comparison on a field that does not exist,
 * keeping the field name for diagnostics.
 */
public final class MatchNoneExpression implements Expression {

    private final String field;

    public MatchNoneExpression(String field) {
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.MATCH_NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatchNoneExpression)) return false;
        return Objects.equals(field, ((MatchNoneExpression) o).field);
    }

    @Override
    public int hashCode() {
        return Objects.hash("NONE", field);
    }

    @Override
    public String toString() {
        return "NONE(" + field + ")";
    }
}
