package com.loglens.query.ast;

public final class SearchStage extends PredicateStage {

    public SearchStage(int index, Expression expression) {
        super(index, expression);
    }

    @Override
    public StageKind getKind() {
        return StageKind.SEARCH;
    }

    @Override
    public SearchStage withExpression(Expression expression) {
        return new SearchStage(getIndex(), expression);
    }

    @Override
    public String toString() {
        return "search " + getExpression();
    }
}
