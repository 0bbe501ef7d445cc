package com.loglens.query.ast;

/**
 * {@code filter} or {@code where}; same semantics as search, applied to the
 * rows produced so far.
 */
public final class FilterStage extends PredicateStage {

    private final String command;

    public FilterStage(int index, String command, Expression expression) {
        super(index, expression);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }

    @Override
    public StageKind getKind() {
        return StageKind.FILTER;
    }

    @Override
    public FilterStage withExpression(Expression expression) {
        return new FilterStage(getIndex(), command, expression);
    }

    @Override
    public String toString() {
        return command + " " + getExpression();
    }
}
