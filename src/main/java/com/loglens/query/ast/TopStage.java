package com.loglens.query.ast;

/**
 * {@code top} (most frequent values first) or {@code rare} (least frequent
 * first) over a single field. Produces the columns {@code [field, count]}.
 */
public final class TopStage extends Stage {

    public static final int DEFAULT_LIMIT = 10;
    public static final String COUNT_COLUMN = "count";

    private final String field;
    private final long limit;
    private final boolean rare;

    public TopStage(int index, String field, long limit, boolean rare) {
        super(index);
        this.field = field;
        this.limit = limit;
        this.rare = rare;
    }

    public String getField() {
        return field;
    }

    public long getLimit() {
        return limit;
    }

    public boolean isRare() {
        return rare;
    }

    @Override
    public StageKind getKind() {
        return StageKind.TOP;
    }

    @Override
    public String toString() {
        return (rare ? "rare" : "top") + " limit=" + limit + " " + field;
    }
}
