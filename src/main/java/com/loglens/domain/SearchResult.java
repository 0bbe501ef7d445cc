package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.query.CompileWarning;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rows returned by an executed search, with the SQL and parameters that
 * produced them.
 */
public class SearchResult {

    @JsonProperty("results")
    private List<Map<String, Object>> results;

    @JsonProperty("count")
    private long count;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    @JsonProperty("sql")
    private String sql;

    @JsonProperty("parameters")
    private List<Object> parameters;

    @JsonProperty("warnings")
    private List<CompileWarning> warnings;

    public SearchResult() {
        this.results = new ArrayList<>();
        this.parameters = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public SearchResult(List<Map<String, Object>> results, long executionTimeMs, String sql,
                        List<Object> parameters, List<CompileWarning> warnings) {
        this.results = results != null ? results : new ArrayList<>();
        this.count = this.results.size();
        this.executionTimeMs = executionTimeMs;
        this.sql = sql;
        this.parameters = parameters;
        this.warnings = warnings;
    }

    public List<Map<String, Object>> getResults() {
        return results;
    }

    public void setResults(List<Map<String, Object>> results) {
        this.results = results;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public void setParameters(List<Object> parameters) {
        this.parameters = parameters;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }

    public void setWarnings(List<CompileWarning> warnings) {
        this.warnings = warnings;
    }
}
