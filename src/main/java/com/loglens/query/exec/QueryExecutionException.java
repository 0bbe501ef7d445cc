package com.loglens.query.exec;

/**
 * Exception thrown when a compiled query fails in the store.
 * Carries the SQL that failed; its parameters are not included.
 */
public class QueryExecutionException extends RuntimeException {

    private final String sql;

    public QueryExecutionException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (sql != null) {
            sb.append(" [Query: ").append(sql).append("]");
        }
        return sb.toString();
    }
}
