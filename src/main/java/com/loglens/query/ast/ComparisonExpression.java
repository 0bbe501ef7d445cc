package com.loglens.query.ast;

import java.util.Objects;

/**
 * Represents a comparison expression (field op value)
 */
public final class ComparisonExpression implements Expression {

    private final String field;
    private final ComparisonOperator operator;
    private final Value value;

    public ComparisonExpression(String field, ComparisonOperator operator, Value value) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getField() {
        return field;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public Value getValue() {
        return value;
    }

    public ComparisonExpression withField(String resolvedField) {
        return new ComparisonExpression(resolvedField, operator, value);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.COMPARISON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonExpression)) return false;
        ComparisonExpression that = (ComparisonExpression) o;
        return field.equals(that.field) && operator == that.operator && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value);
    }

    @Override
    public String toString() {
        return field + operator.getSymbol() + value;
    }
}
