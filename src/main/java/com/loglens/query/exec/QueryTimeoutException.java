package com.loglens.query.exec;

import java.time.Duration;

/**
 * The store did not answer within the execution timeout.
 */
public class QueryTimeoutException extends QueryExecutionException {

    private final Duration timeout;

    public QueryTimeoutException(Duration timeout, String sql, Throwable cause) {
        super("Query timed out after " + timeout.toMillis() + "ms", sql, cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
