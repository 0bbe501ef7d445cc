package com.loglens.query.ast;

import java.util.List;

/**
 * {@code timechart}: aggregations per time bucket, optionally split by one
 * field. Produces {@code [_time, split field?, aggregations...]} ordered by
 * bucket.
 */
public final class TimechartStage extends Stage {

    public static final String TIME_COLUMN = "_time";
    public static final Span DEFAULT_SPAN = Span.ofTime(1, Span.Unit.HOUR);

    private final Span span;
    private final List<Aggregation> aggregations;
    private final String splitBy;

    public TimechartStage(int index, Span span, List<Aggregation> aggregations, String splitBy) {
        super(index);
        this.span = span;
        this.aggregations = List.copyOf(aggregations);
        this.splitBy = splitBy;
    }

    public Span getSpan() {
        return span;
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    /**
     * Split field, or null for one series.
     */
    public String getSplitBy() {
        return splitBy;
    }

    @Override
    public StageKind getKind() {
        return StageKind.TIMECHART;
    }

    @Override
    public String toString() {
        return "timechart span=" + span + " " + aggregations + (splitBy == null ? "" : " by " + splitBy);
    }
}
