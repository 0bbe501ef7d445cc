package com.loglens.query.ast;

public final class LimitStage extends Stage {

    private final long limit;

    public LimitStage(int index, long limit) {
        super(index);
        this.limit = limit;
    }

    public long getLimit() {
        return limit;
    }

    @Override
    public StageKind getKind() {
        return StageKind.LIMIT;
    }

    @Override
    public String toString() {
        return "limit " + limit;
    }
}
