package com.loglens.query.ast;

/**
 * Matches every row: {@code search *}, or a clause removed by an all-values
 * variable selection.
 */
public final class MatchAllExpression implements Expression {

    public static final MatchAllExpression INSTANCE = new MatchAllExpression();

    private MatchAllExpression() {
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.MATCH_ALL;
    }

    @Override
    public String toString() {
        return "*";
    }
}
