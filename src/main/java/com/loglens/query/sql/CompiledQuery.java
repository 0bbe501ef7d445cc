package com.loglens.query.sql;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.query.schema.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generated SQL, the values for its placeholders in order, and the columns
 * the statement returns.
 */
public final class CompiledQuery {

    @JsonProperty("sql")
    private final String sql;

    @JsonProperty("parameters")
    private final List<Object> parameters;

    @JsonProperty("output_schema")
    private final Schema outputSchema;

    public CompiledQuery(String sql, List<Object> parameters, Schema outputSchema) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.outputSchema = Objects.requireNonNull(outputSchema, "outputSchema");
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public Schema getOutputSchema() {
        return outputSchema;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompiledQuery)) return false;
        CompiledQuery that = (CompiledQuery) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters) && outputSchema.equals(that.outputSchema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters, outputSchema);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
