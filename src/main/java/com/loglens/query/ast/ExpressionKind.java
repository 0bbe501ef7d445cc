package com.loglens.query.ast;

public enum ExpressionKind {
    COMPARISON,
    IN_LIST,
    BARE_TERM,
    BINARY,
    NOT,
    MATCH_ALL,
    MATCH_NONE,
    VARIABLE
}
