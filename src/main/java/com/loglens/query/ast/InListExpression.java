package com.loglens.query.ast;

import java.util.List;
import java.util.Objects;

/**
 * {@code field IN (v1, v2, ...)}
 */
public final class InListExpression implements Expression {

    private final String field;
    private final List<Value> values;

    public InListExpression(String field, List<Value> values) {
        this.field = Objects.requireNonNull(field, "field");
        this.values = List.copyOf(values);
    }

    public String getField() {
        return field;
    }

    public List<Value> getValues() {
        return values;
    }

    public InListExpression withField(String resolvedField) {
        return new InListExpression(resolvedField, values);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.IN_LIST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InListExpression)) return false;
        InListExpression that = (InListExpression) o;
        return field.equals(that.field) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, values);
    }

    @Override
    public String toString() {
        return field + " IN " + values;
    }
}
