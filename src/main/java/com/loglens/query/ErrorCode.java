package com.loglens.query;

/**
 * Machine-readable codes for compile-time failures.
 */
public enum ErrorCode {
    LEX_ERROR,
    UNKNOWN_COMMAND,
    MALFORMED_STAGE,
    UNRESOLVED_FIELD,
    TYPE_MISMATCH,
    VARIABLE_RESOLUTION,
    TIME_RANGE_PARSE
}
