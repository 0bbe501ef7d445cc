package com.loglens.fields;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A canonical field: the name queries resolve to, the surface aliases that
 * resolve to it, the SQL expression that reads it from the event table and
 * its inferred type.
 */
public final class FieldDefinition {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("aliases")
    private final List<String> aliases;

    @JsonIgnore
    private final String storageExpression;

    @JsonProperty("type")
    private final FieldType type;

    @JsonProperty("origin")
    private final FieldOrigin origin;

    public FieldDefinition(String name, List<String> aliases, String storageExpression,
                           FieldType type, FieldOrigin origin) {
        this.name = Objects.requireNonNull(name, "name");
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
        this.storageExpression = Objects.requireNonNull(storageExpression, "storageExpression");
        this.type = Objects.requireNonNull(type, "type");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    /**
     * A core column read directly by its own name.
     */
    public static FieldDefinition core(String name, FieldType type, String... aliases) {
        return new FieldDefinition(name, List.of(aliases), name, type, FieldOrigin.CORE);
    }

    /**
     * A key of the structured_data JSON column. The key must already be
     * validated as a safe identifier; it is embedded as a quoted literal.
     */
    public static FieldDefinition discovered(String key, FieldType type) {
        String extractor = type.isNumeric() ? "JSONExtractFloat" : "JSONExtractString";
        String expression = extractor + "(structured_data, '" + key + "')";
        return new FieldDefinition(key, List.of(), expression, type, FieldOrigin.DISCOVERED);
    }

    public String getName() {
        return name;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public String getStorageExpression() {
        return storageExpression;
    }

    public FieldType getType() {
        return type;
    }

    public FieldOrigin getOrigin() {
        return origin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldDefinition)) return false;
        FieldDefinition that = (FieldDefinition) o;
        return name.equals(that.name)
            && aliases.equals(that.aliases)
            && storageExpression.equals(that.storageExpression)
            && type == that.type
            && origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, aliases, storageExpression, type, origin);
    }

    @Override
    public String toString() {
        return name + ":" + type.getLabel();
    }
}
