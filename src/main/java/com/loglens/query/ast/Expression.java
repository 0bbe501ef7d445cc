package com.loglens.query.ast;

/**
 * Node of a search predicate tree.
 */
public interface Expression {

    ExpressionKind getKind();
}
