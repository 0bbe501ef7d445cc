package com.loglens.query.ast;

import java.util.List;

public final class StatsStage extends Stage {

    private final List<Aggregation> aggregations;
    private final List<String> groupBy;

    public StatsStage(int index, List<Aggregation> aggregations, List<String> groupBy) {
        super(index);
        this.aggregations = List.copyOf(aggregations);
        this.groupBy = List.copyOf(groupBy);
    }

    public List<Aggregation> getAggregations() {
        return aggregations;
    }

    /**
     * Group-by fields; empty means a single result row.
     */
    public List<String> getGroupBy() {
        return groupBy;
    }

    @Override
    public StageKind getKind() {
        return StageKind.STATS;
    }

    @Override
    public String toString() {
        return "stats " + aggregations + (groupBy.isEmpty() ? "" : " by " + groupBy);
    }
}
