package com.loglens.query.ast;

import com.loglens.query.CompileWarning;
import com.loglens.query.schema.Schema;

import java.util.List;

/**
 * A parsed, validated pipeline.
 *
 * Field references in the stages are already resolved to column names of
 * the schema each stage receives. The output schema and the warnings found
 * while validating travel with the stages so a cached query is complete.
 */
public final class Query {

    private final List<Stage> stages;
    private final Schema outputSchema;
    private final List<CompileWarning> warnings;

    public Query(List<Stage> stages, Schema outputSchema, List<CompileWarning> warnings) {
        this.stages = List.copyOf(stages);
        this.outputSchema = outputSchema;
        this.warnings = List.copyOf(warnings);
    }

    public List<Stage> getStages() {
        return stages;
    }

    public Schema getOutputSchema() {
        return outputSchema;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }

    public int size() {
        return stages.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Stage stage : stages) {
            if (sb.length() > 0) {
                sb.append(" | ");
            }
            sb.append(stage);
        }
        return sb.toString();
    }
}
