package com.loglens.fields;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One key found in the structured_data column by a discovery scan.
 */
public final class DiscoveredField {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("type")
    private final FieldType type;

    @JsonProperty("occurrences")
    private final long occurrences;

    @JsonProperty("sample_values")
    private final List<String> sampleValues;

    public DiscoveredField(String name, FieldType type, long occurrences, List<String> sampleValues) {
        this.name = name;
        this.type = type == null ? FieldType.STRING : type;
        this.occurrences = occurrences;
        this.sampleValues = sampleValues == null ? List.of() : List.copyOf(sampleValues);
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public long getOccurrences() {
        return occurrences;
    }

    public List<String> getSampleValues() {
        return sampleValues;
    }
}
