package com.loglens.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Non-fatal finding collected during compilation, returned alongside a
 * successful result. The typical case is a predicate on a field that does not
 * exist, which compiles to a predicate that never matches.
 */
public final class CompileWarning {

    @JsonProperty("stage")
    private final int stageIndex;

    @JsonProperty("field")
    private final String field;

    @JsonProperty("message")
    private final String message;

    public CompileWarning(int stageIndex, String field, String message) {
        this.stageIndex = stageIndex;
        this.field = field;
        this.message = message;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompileWarning)) return false;
        CompileWarning that = (CompileWarning) o;
        return stageIndex == that.stageIndex
            && Objects.equals(field, that.field)
            && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stageIndex, field, message);
    }

    @Override
    public String toString() {
        return "stage " + stageIndex + ": " + message;
    }
}
