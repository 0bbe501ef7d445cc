package com.loglens.query.ast;

public enum ValueType {
    /** Quoted literal. */
    STRING,
    /** Unquoted word. */
    WORD,
    NUMBER,
    /** A bare {@code *}: any non-empty value. */
    WILDCARD,
    REGEX
}
