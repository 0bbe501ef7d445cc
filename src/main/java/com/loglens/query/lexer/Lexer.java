package com.loglens.query.lexer;

import com.loglens.query.LexException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the text of one pipeline stage into tokens.
 *
 * Words may embed wildcards and the punctuation found in host names, IPs,
 * paths and relative times, so {@code web*}, {@code 10.0.0.1} and
 * {@code -24h} are single tokens. Command words are ordinary identifiers;
 * recognizing them is the parser's job.
 */
public final class Lexer {

    static final Set<String> KEYWORDS = Set.of("by", "as", "and", "or", "not", "in", "asc", "desc");

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final StageText stage;
    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    private Lexer(StageText stage) {
        this.stage = stage;
        this.text = stage.getText();
    }

    public static List<Token> tokenize(StageText stage) {
        return new Lexer(stage).run();
    }

    static boolean isWordChar(char c) {
        if (Character.isLetterOrDigit(c)) {
            return true;
        }
        switch (c) {
            case '_': case '.': case '-': case ':': case '*': case '?':
            case '@': case '/': case '%': case '+': case '#':
                return true;
            default:
                return false;
        }
    }

    private List<Token> run() {
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"' || c == '\'') {
                readString(c);
            } else if (c == '/') {
                readRegex();
            } else if (c == '$') {
                readVariable();
            } else if (c == '(') {
                emit(TokenType.LPAREN, "(", pos++);
            } else if (c == ')') {
                emit(TokenType.RPAREN, ")", pos++);
            } else if (c == ',') {
                emit(TokenType.COMMA, ",", pos++);
            } else if (c == '=' || c == '!' || c == '<' || c == '>' || c == '~') {
                readOperator(c);
            } else if (isWordChar(c)) {
                readWord();
            } else {
                throw error(pos, "Unexpected character '" + c + "'");
            }
        }
        return tokens;
    }

    private void readString(char quote) {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                char next = text.charAt(pos + 1);
                // only the quote and the backslash are escapes; anything else is kept for regex use
                if (next != quote && next != '\\') {
                    sb.append(c);
                }
                sb.append(next);
                pos += 2;
            } else if (c == quote) {
                pos++;
                emit(TokenType.STRING, sb.toString(), start);
                return;
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw error(start, "Unterminated string literal");
    }

    private void readRegex() {
        int start = pos;
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                char next = text.charAt(pos + 1);
                if (next != '/') {
                    sb.append(c);
                }
                sb.append(next);
                pos += 2;
            } else if (c == '/') {
                pos++;
                if (sb.length() == 0) {
                    throw error(start, "Empty regex literal");
                }
                emit(TokenType.REGEX, sb.toString(), start);
                return;
            } else {
                sb.append(c);
                pos++;
            }
        }
        throw error(start, "Unterminated regex literal");
    }

    private void readVariable() {
        int start = pos;
        int close = text.indexOf('$', pos + 1);
        if (close < 0) {
            throw error(start, "Unterminated variable reference");
        }
        String name = text.substring(pos + 1, close);
        if (!VARIABLE_NAME.matcher(name).matches()) {
            throw error(start, "Invalid variable name '" + name + "'");
        }
        pos = close + 1;
        emit(TokenType.VARIABLE, name, start);
    }

    private void readOperator(char c) {
        int start = pos;
        char next = pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
        String symbol;
        switch (c) {
            case '=':
                symbol = next == '=' ? "==" : "=";
                break;
            case '!':
                if (next == '=') {
                    symbol = "!=";
                } else if (next == '~') {
                    symbol = "!~";
                } else {
                    throw error(start, "Unexpected character '!'");
                }
                break;
            case '<':
                symbol = next == '=' ? "<=" : "<";
                break;
            case '>':
                symbol = next == '=' ? ">=" : ">";
                break;
            default:
                symbol = "~";
        }
        pos += symbol.length();
        emit(TokenType.OPERATOR, "==".equals(symbol) ? "=" : symbol, start);
    }

    private void readWord() {
        int start = pos;
        while (pos < text.length() && isWordChar(text.charAt(pos))) {
            pos++;
        }
        String word = text.substring(start, pos);
        String lower = word.toLowerCase(Locale.ROOT);
        if ("*".equals(word)) {
            emit(TokenType.WILDCARD, word, start);
        } else if (NUMBER.matcher(word).matches()) {
            emit(TokenType.NUMBER, word, start);
        } else if (KEYWORDS.contains(lower)) {
            emit(TokenType.KEYWORD, lower, start);
        } else {
            emit(TokenType.IDENTIFIER, word, start);
        }
    }

    private void emit(TokenType type, String value, int localOffset) {
        tokens.add(new Token(type, value, stage.getOffset() + localOffset));
    }

    private LexException error(int localOffset, String reason) {
        return new LexException(stage.getIndex(), stage.getOffset() + localOffset, reason);
    }
}
