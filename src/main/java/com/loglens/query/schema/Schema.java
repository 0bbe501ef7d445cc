package com.loglens.query.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.loglens.fields.FieldCatalog;
import com.loglens.fields.FieldDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered result columns at one point of the pipeline.
 *
 * {@code eventRows} stays true until a stage aggregates; while it holds,
 * predicates may still reach event fields that are no longer projected.
 */
public final class Schema {

    @JsonProperty("columns")
    private final List<Column> columns;

    @JsonProperty("event_rows")
    private final boolean eventRows;

    public Schema(List<Column> columns, boolean eventRows) {
        this.columns = List.copyOf(columns);
        this.eventRows = eventRows;
    }

    /**
     * Every field of the catalog, core fields first.
     */
    public static Schema fromCatalog(FieldCatalog catalog) {
        List<Column> columns = new ArrayList<>();
        for (FieldDefinition field : catalog.allFields()) {
            columns.add(new Column(field.getName(), field.getType()));
        }
        return new Schema(columns, true);
    }

    public List<Column> getColumns() {
        return columns;
    }

    public boolean isEventRows() {
        return eventRows;
    }

    @JsonIgnore
    public List<String> getNames() {
        return columns.stream().map(Column::getName).collect(Collectors.toList());
    }

    /**
     * Exact name match first, then a case-insensitive match if it is unique.
     */
    public Optional<Column> find(String name) {
        for (Column column : columns) {
            if (column.getName().equals(name)) {
                return Optional.of(column);
            }
        }
        Column match = null;
        for (Column column : columns) {
            if (column.getName().equalsIgnoreCase(name)) {
                if (match != null) {
                    return Optional.empty();
                }
                match = column;
            }
        }
        return Optional.ofNullable(match);
    }

    public boolean contains(String name) {
        return columns.stream().anyMatch(column -> column.getName().equals(name));
    }

    public int size() {
        return columns.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        Schema that = (Schema) o;
        return eventRows == that.eventRows && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, eventRows);
    }

    @Override
    public String toString() {
        return columns + (eventRows ? " (events)" : "");
    }
}
