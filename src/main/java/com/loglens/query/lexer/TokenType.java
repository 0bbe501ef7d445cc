package com.loglens.query.lexer;

public enum TokenType {
    IDENTIFIER,
    KEYWORD,
    OPERATOR,
    STRING,
    NUMBER,
    /** A bare {@code *}. Embedded wildcards such as {@code web*} stay identifiers. */
    WILDCARD,
    REGEX,
    VARIABLE,
    COMMA,
    LPAREN,
    RPAREN
}
