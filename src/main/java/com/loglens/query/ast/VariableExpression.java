package com.loglens.query.ast;

import java.util.Objects;

/**
 * Placeholder for {@code field op $name$}, or a bare {@code $name$} term when
 * the field is null. Replaced with concrete predicates when variables are
 * bound; never reaches SQL generation.
 */
public final class VariableExpression implements Expression {

    private final String field;
    private final ComparisonOperator operator;
    private final String variable;

    public VariableExpression(String field, ComparisonOperator operator, String variable) {
        this.field = field;
        this.operator = operator;
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public String getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getVariable() {
        return variable;
    }

    public boolean isBareTerm() {
        return field == null;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.VARIABLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableExpression)) return false;
        VariableExpression that = (VariableExpression) o;
        return Objects.equals(field, that.field) && operator == that.operator && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, variable);
    }

    @Override
    public String toString() {
        return (field == null ? "" : field + operator.getSymbol()) + "$" + variable + "$";
    }
}
