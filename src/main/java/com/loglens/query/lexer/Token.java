package com.loglens.query.lexer;

import java.util.Locale;

/**
 * One lexical token of a pipeline stage.
 *
 * For {@link TokenType#STRING} and {@link TokenType#REGEX} the text is the
 * unescaped content without delimiters; for {@link TokenType#VARIABLE} it is
 * the variable name without the surrounding dollar signs. Keywords are stored
 * lower-cased.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int offset;

    public Token(TokenType type, String text, int offset) {
        this.type = type;
        this.text = text;
        this.offset = offset;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /**
     * Offset of the first character of the token in the full query text.
     */
    public int getOffset() {
        return offset;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && text.equals(symbol);
    }

    /**
     * Lower-cased text, for matching command and function names.
     */
    public String lowerText() {
        return text.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + offset;
    }
}
