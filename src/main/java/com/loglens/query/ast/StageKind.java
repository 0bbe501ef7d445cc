package com.loglens.query.ast;

/**
 * The closed set of pipeline stage kinds.
 */
public enum StageKind {
    SEARCH,
    FILTER,
    STATS,
    SORT,
    LIMIT,
    TABLE,
    DEDUP,
    RENAME,
    TOP,
    TIMECHART,
    BIN,
    TAIL
}
