package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.query.TimeRange;
import com.loglens.query.variable.Variable;
import com.loglens.query.variable.VariableBindings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A search as submitted by a client: query text, optional time bounds,
 * variable definitions and selected values, and an optional timeout.
 */
public class SearchRequest {

    @JsonProperty("query")
    private String query;

    @JsonProperty("earliest")
    private String earliest;

    @JsonProperty("latest")
    private String latest;

    @JsonProperty("variables")
    private Map<String, Object> variables = new LinkedHashMap<>();

    @JsonProperty("variable_definitions")
    private List<Variable> variableDefinitions = new ArrayList<>();

    @JsonProperty("timeout_ms")
    private Long timeoutMs;

    public SearchRequest() {
    }

    public SearchRequest(String query) {
        this.query = query;
    }

    public SearchRequest(String query, String earliest, String latest) {
        this.query = query;
        this.earliest = earliest;
        this.latest = latest;
    }

    public VariableBindings toBindings() {
        return new VariableBindings(
            variableDefinitions == null ? List.of() : variableDefinitions,
            variables == null ? Map.of() : variables);
    }

    public TimeRange toTimeRange() {
        return new TimeRange(earliest, latest);
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getEarliest() {
        return earliest;
    }

    public void setEarliest(String earliest) {
        this.earliest = earliest;
    }

    public String getLatest() {
        return latest;
    }

    public void setLatest(String latest) {
        this.latest = latest;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables;
    }

    public List<Variable> getVariableDefinitions() {
        return variableDefinitions;
    }

    public void setVariableDefinitions(List<Variable> variableDefinitions) {
        this.variableDefinitions = variableDefinitions;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(Long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }
}
