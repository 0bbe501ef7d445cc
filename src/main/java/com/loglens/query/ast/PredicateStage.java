package com.loglens.query.ast;

import java.util.Objects;

/**
 * Base for stages that only filter rows.
 */
public abstract class PredicateStage extends Stage {

    private final Expression expression;

    protected PredicateStage(int index, Expression expression) {
        super(index);
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public Expression getExpression() {
        return expression;
    }

    /**
     * Same stage with a different predicate.
     */
    public abstract PredicateStage withExpression(Expression expression);
}
