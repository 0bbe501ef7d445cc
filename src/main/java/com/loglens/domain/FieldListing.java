package com.loglens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.fields.FieldDefinition;

import java.util.List;

/**
 * Snapshot of the fields available to queries, split by origin.
 */
public class FieldListing {

    @JsonProperty("core")
    private final List<FieldDefinition> core;

    @JsonProperty("discovered")
    private final List<FieldDefinition> discovered;

    @JsonProperty("catalog_version")
    private final long catalogVersion;

    public FieldListing(List<FieldDefinition> core, List<FieldDefinition> discovered, long catalogVersion) {
        this.core = List.copyOf(core);
        this.discovered = List.copyOf(discovered);
        this.catalogVersion = catalogVersion;
    }

    public List<FieldDefinition> getCore() {
        return core;
    }

    public List<FieldDefinition> getDiscovered() {
        return discovered;
    }

    public long getCatalogVersion() {
        return catalogVersion;
    }
}
