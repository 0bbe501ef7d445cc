package com.loglens.query.ast;

/**
 * {@code tail}: the last rows of the current ordering, last row first.
 */
public final class TailStage extends Stage {

    public static final int DEFAULT_LIMIT = 10;

    private final long limit;

    public TailStage(int index, long limit) {
        super(index);
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }

    @Override
    public StageKind getKind() {
        return StageKind.TAIL;
    }

    @Override
    public String toString() {
        return "tail " + limit;
    }
}
