package com.loglens.query.ast;

import java.util.List;

/**
 * Projection: keeps the listed columns in the listed order, or with
 * {@code fields -} removes them.
 */
public final class TableStage extends Stage {

    private final List<String> columns;
    private final boolean exclude;

    public TableStage(int index, List<String> columns, boolean exclude) {
        super(index);
        this.columns = List.copyOf(columns);
        this.exclude = exclude;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isExclude() {
        return exclude;
    }

    @Override
    public StageKind getKind() {
        return StageKind.TABLE;
    }

    @Override
    public String toString() {
        return (exclude ? "fields - " : "table ") + columns;
    }
}
