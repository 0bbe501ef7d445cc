package com.loglens.query.ast;

import java.util.Objects;

public final class SortKey {

    private final String field;
    private final SortDirection direction;

    public SortKey(String field, SortDirection direction) {
        this.field = Objects.requireNonNull(field, "field");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public String getField() {
        return field;
    }

    public SortDirection getDirection() {
        return direction;
    }

    public boolean isAscending() {
        return direction == SortDirection.ASC;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SortKey)) return false;
        SortKey that = (SortKey) o;
        return field.equals(that.field) && direction == that.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, direction);
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
