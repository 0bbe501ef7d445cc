package com.loglens.query.lexer;

/**
 * Canonical form of query text for cache keys: runs of whitespace outside
 * quoted strings and regex literals collapse to one space, and the ends are
 * trimmed. Two texts with the same normal form lex to the same tokens.
 */
public final class QueryNormalizer {

    private QueryNormalizer() {
    }

    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(query.length());
        int i = 0;
        int length = query.length();
        boolean pendingSpace = false;
        while (i < length) {
            char c = query.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
                i++;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            if (c == '"' || c == '\'') {
                i = copyDelimited(query, i, c, sb);
            } else if (c == '/' && (i == 0 || !Lexer.isWordChar(query.charAt(i - 1)))) {
                i = copyDelimited(query, i, '/', sb);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static int copyDelimited(String text, int open, char delimiter, StringBuilder out) {
        out.append(delimiter);
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(c).append(text.charAt(i + 1));
                i += 2;
            } else if (c == delimiter) {
                out.append(c);
                return i + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return text.length();
    }
}
