package com.loglens.query.parser;

import com.loglens.query.MalformedStageException;
import com.loglens.query.lexer.Token;
import com.loglens.query.lexer.TokenType;

import java.util.List;

/**
 * Read position over the tokens of one stage.
 */
final class TokenCursor {

    private final List<Token> tokens;
    private final int stageIndex;
    private final String command;
    private int pos;

    TokenCursor(List<Token> tokens, int start, int stageIndex, String command) {
        this.tokens = tokens;
        this.pos = start;
        this.stageIndex = stageIndex;
        this.command = command;
    }

    int getStageIndex() {
        return stageIndex;
    }

    String getCommand() {
        return command;
    }

    boolean atEnd() {
        return pos >= tokens.size();
    }

    Token peek() {
        return atEnd() ? null : tokens.get(pos);
    }

    Token peek(int ahead) {
        int index = pos + ahead;
        return index < tokens.size() ? tokens.get(index) : null;
    }

    boolean peekIs(TokenType type) {
        Token token = peek();
        return token != null && token.is(type);
    }

    boolean peekKeyword(String keyword) {
        Token token = peek();
        return token != null && token.isKeyword(keyword);
    }

    Token next() {
        if (atEnd()) {
            throw malformed("unexpected end of stage");
        }
        return tokens.get(pos++);
    }

    boolean accept(TokenType type) {
        if (peekIs(type)) {
            pos++;
            return true;
        }
        return false;
    }

    boolean acceptKeyword(String keyword) {
        if (peekKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    Token expect(TokenType type, String detail) {
        if (!peekIs(type)) {
            throw malformed(detail);
        }
        return tokens.get(pos++);
    }

    /**
     * Fails if any token is left.
     */
    void expectEnd() {
        if (!atEnd()) {
            throw malformed("unexpected '" + peek().getText() + "'");
        }
    }

    MalformedStageException malformed(String detail) {
        return new MalformedStageException(stageIndex, command, detail);
    }
}
