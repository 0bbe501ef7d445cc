package com.loglens.query.sql;

/**
 * Translation of search wildcards into LIKE patterns.
 * {@code *} becomes {@code %}, {@code ?} becomes {@code _}; literal
 * {@code %}, {@code _} and {@code \} are escaped with a backslash.
 */
public final class LikePatterns {

    private LikePatterns() {
    }

    public static String toLike(String wildcard) {
        StringBuilder sb = new StringBuilder(wildcard.length() + 8);
        for (int i = 0; i < wildcard.length(); i++) {
            char c = wildcard.charAt(i);
            switch (c) {
                case '*' -> sb.append('%');
                case '?' -> sb.append('_');
                case '%', '_', '\\' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Pattern matching the wildcard anywhere in the text.
     */
    public static String containing(String wildcard) {
        return "%" + toLike(wildcard) + "%";
    }
}
