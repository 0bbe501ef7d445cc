package com.loglens.query.ast;

import java.util.Objects;

public final class NotExpression implements Expression {

    private final Expression operand;

    public NotExpression(Expression operand) {
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.NOT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NotExpression)) return false;
        return operand.equals(((NotExpression) o).operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash("NOT", operand);
    }

    @Override
    public String toString() {
        return "NOT " + operand;
    }
}
