package com.loglens.query.ast;

import java.util.List;

/**
 * Keeps the most recent row for every distinct combination of key values.
 */
public final class DedupStage extends Stage {

    private final List<String> keys;

    public DedupStage(int index, List<String> keys) {
        super(index);
        this.keys = List.copyOf(keys);
    }

    public List<String> getKeys() {
        return keys;
    }

    @Override
    public StageKind getKind() {
        return StageKind.DEDUP;
    }

    @Override
    public String toString() {
        return "dedup " + keys;
    }
}
