package com.loglens.query.sql;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Quoting of identifiers and literals embedded in generated SQL.
 *
 * Only names produced by the compiler itself go through here; user values are
 * always bound as parameters.
 */
public final class SqlQuoting {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> RESERVED = Set.of(
        "all", "and", "any", "array", "as", "asc", "between", "by", "case", "cast", "desc", "distinct",
        "else", "end", "from", "global", "group", "having", "in", "interval", "is", "join", "like",
        "limit", "not", "null", "offset", "on", "or", "order", "over", "prewhere", "select",
        "settings", "then", "union", "when", "where", "with");

    private SqlQuoting() {
    }

    /**
     * Plain identifiers are left as they are; anything else is wrapped in
     * double quotes with embedded quotes doubled.
     *
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (PLAIN_IDENTIFIER.matcher(identifier).matches()
                && !RESERVED.contains(identifier.toLowerCase(Locale.ROOT))) {
            return identifier;
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Single-quoted string literal with backslashes and quotes escaped.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Table names may be qualified with a database ({@code db.table}); each
     * part must be a plain identifier.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static String checkTableName(String tableName) {
        if (tableName == null || tableName.isEmpty()) {
            throw new IllegalArgumentException("Table name cannot be null or empty");
        }
        for (String part : tableName.split("\\.", -1)) {
            if (!PLAIN_IDENTIFIER.matcher(part).matches()) {
                throw new IllegalArgumentException("Table name contains invalid characters: " + tableName);
            }
        }
        return tableName;
    }
}
