package com.loglens.query.ast;

import java.util.List;

public final class RenameStage extends Stage {

    private final List<RenamePair> pairs;

    public RenameStage(int index, List<RenamePair> pairs) {
        super(index);
        this.pairs = List.copyOf(pairs);
    }

    public List<RenamePair> getPairs() {
        return pairs;
    }

    @Override
    public StageKind getKind() {
        return StageKind.RENAME;
    }

    @Override
    public String toString() {
        return "rename " + pairs;
    }
}
