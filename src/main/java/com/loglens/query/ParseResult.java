package com.loglens.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.query.ast.Query;
import com.loglens.query.sql.CompiledQuery;

import java.util.List;

/**
 * A successfully compiled search: the validated pipeline, its SQL and any
 * soft warnings found on the way.
 */
public class ParseResult {

    @JsonProperty("query")
    private final Query query;

    @JsonProperty("compiled")
    private final CompiledQuery compiled;

    @JsonProperty("warnings")
    private final List<CompileWarning> warnings;

    public ParseResult(Query query, CompiledQuery compiled, List<CompileWarning> warnings) {
        this.query = query;
        this.compiled = compiled;
        this.warnings = List.copyOf(warnings);
    }

    public Query getQuery() {
        return query;
    }

    public CompiledQuery getCompiled() {
        return compiled;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }
}
