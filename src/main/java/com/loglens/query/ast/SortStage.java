package com.loglens.query.ast;

import java.util.List;

/**
 * Ordered sort keys; the first key has the highest priority.
 */
public final class SortStage extends Stage {

    private final List<SortKey> keys;

    public SortStage(int index, List<SortKey> keys) {
        super(index);
        this.keys = List.copyOf(keys);
    }

    public List<SortKey> getKeys() {
        return keys;
    }

    @Override
    public StageKind getKind() {
        return StageKind.SORT;
    }

    @Override
    public String toString() {
        return "sort " + keys;
    }
}
