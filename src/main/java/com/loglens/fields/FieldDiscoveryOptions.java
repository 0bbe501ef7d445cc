package com.loglens.fields;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Filters applied when listing fields: an optional name prefix and a cap on
 * the number of discovered fields returned.
 */
public class FieldDiscoveryOptions {

    @JsonProperty("limit")
    private Integer limit;

    @JsonProperty("prefix")
    private String prefix;

    public FieldDiscoveryOptions() {
    }

    public FieldDiscoveryOptions(Integer limit, String prefix) {
        this.limit = limit;
        this.prefix = prefix;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public String getPrefix() {
        return prefix;
    }

    public void setPrefix(String prefix) {
        this.prefix = prefix;
    }
}
