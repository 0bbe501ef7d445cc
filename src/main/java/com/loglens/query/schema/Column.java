package com.loglens.query.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.fields.FieldType;

import java.util.Objects;

public final class Column {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("type")
    private final FieldType type;

    public Column(String name, FieldType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    public Column renamed(String newName) {
        return new Column(newName, type);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Column)) return false;
        Column that = (Column) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type.getLabel();
    }
}
