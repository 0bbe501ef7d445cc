package com.loglens.query;

/**
 * A numeric operation applied to a non-numeric field, e.g. {@code avg(hostname)}.
 */
public class TypeMismatchException extends QueryCompilationException {

    private final String field;

    public TypeMismatchException(int stageIndex, String field, String detail) {
        super(ErrorCode.TYPE_MISMATCH, stageIndex, detail);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
