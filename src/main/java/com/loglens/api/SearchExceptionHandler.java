package com.loglens.api;

import com.loglens.query.QueryCompilationException;
import com.loglens.query.exec.QueryExecutionException;
import com.loglens.query.exec.QueryTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps search failures onto HTTP responses.
 *
 * Status Code Mapping:
 * - QueryCompilationException -> 400, with error code and stage index
 * - IllegalArgumentException -> 400
 * - QueryTimeoutException -> 504
 * - QueryExecutionException -> 502
 */
@RestControllerAdvice(assignableTypes = SearchController.class)
public class SearchExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SearchExceptionHandler.class);

    static final String COMPILE_ERROR = "QUERY_COMPILE_FAILED";
    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String TIMEOUT = "QUERY_TIMEOUT";
    static final String EXECUTION_FAILED = "QUERY_EXECUTION_FAILED";

    @ExceptionHandler(QueryCompilationException.class)
    public ResponseEntity<ApiErrorResponse> handleCompilation(QueryCompilationException e) {
        log.debug("Rejected query: {}", e.getMessage());
        Integer stage = e.getStageIndex() >= 0 ? e.getStageIndex() : null;
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiErrorResponse(COMPILE_ERROR, e.getCode().name(), stage, e.getDetail()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ApiErrorResponse(BAD_REQUEST, null, null, e.getMessage()));
    }

    @ExceptionHandler(QueryTimeoutException.class)
    public ResponseEntity<ApiErrorResponse> handleTimeout(QueryTimeoutException e) {
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
            .body(new ApiErrorResponse(TIMEOUT, null, null,
                "Query timed out after " + e.getTimeout().toMillis() + "ms"));
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ApiErrorResponse> handleExecution(QueryExecutionException e) {
        // Clients get the store's message only; the SQL goes to the log.
        log.warn("Search execution failed: {}", e.getMessage());
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ApiErrorResponse(EXECUTION_FAILED, null, null, cause.getMessage()));
    }
}
