package com.loglens.query;

/**
 * A field reference that resolves neither against the current result schema
 * nor against the field catalog. Raised for stats, table, sort, dedup, rename
 * and group-by references; predicate references only produce a warning.
 */
public class UnresolvedFieldException extends QueryCompilationException {

    private final String field;

    public UnresolvedFieldException(int stageIndex, String field, String detail) {
        super(ErrorCode.UNRESOLVED_FIELD, stageIndex, "Unknown field '" + field + "': " + detail);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
