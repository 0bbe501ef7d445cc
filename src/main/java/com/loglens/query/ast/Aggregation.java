package com.loglens.query.ast;

import java.util.Objects;

/**
 * One aggregation of a {@code stats} stage: a function, an optional input
 * field and the name of the output column.
 */
public final class Aggregation {

    private final AggregationFunction function;
    private final String field;
    private final String alias;

    public Aggregation(AggregationFunction function, String field, String alias) {
        this.function = Objects.requireNonNull(function, "function");
        this.field = field;
        this.alias = alias != null ? alias : defaultAlias(function, field);
    }

    public static String defaultAlias(AggregationFunction function, String field) {
        return field == null ? function.getKeyword() : function.getKeyword() + "_" + field;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    /**
     * Input field, or null for a bare {@code count}.
     */
    public String getField() {
        return field;
    }

    public String getAlias() {
        return alias;
    }

    public Aggregation withField(String resolvedField) {
        return new Aggregation(function, resolvedField, alias);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Aggregation)) return false;
        Aggregation that = (Aggregation) o;
        return function == that.function && Objects.equals(field, that.field) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, field, alias);
    }

    @Override
    public String toString() {
        return function.getKeyword() + "(" + (field == null ? "" : field) + ") as " + alias;
    }
}
