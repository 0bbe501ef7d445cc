package com.loglens.query.ast;

/**
 * {@code bin}: rounds a timestamp or numeric column down to the start of its
 * bucket. Without an alias the column is replaced in place; with one the
 * bucket is added as a new column.
 */
public final class BinStage extends Stage {

    private final String field;
    private final Span span;
    private final String alias;

    public BinStage(int index, String field, Span span, String alias) {
        super(index);
        this.field = field;
        this.span = span;
        this.alias = alias;
    }

    public String getField() {
        return field;
    }

    public Span getSpan() {
        return span;
    }

    /**
     * Name of the new column, or null when binning in place.
     */
    public String getAlias() {
        return alias;
    }

    /**
     * Name of the column holding the bucket after this stage.
     */
    public String getTargetName() {
        return alias == null ? field : alias;
    }

    @Override
    public StageKind getKind() {
        return StageKind.BIN;
    }

    @Override
    public String toString() {
        return "bin span=" + span + " " + field + (alias == null ? "" : " as " + alias);
    }
}
