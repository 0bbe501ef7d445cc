package com.loglens.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of validating a search without running it. A valid result carries
 * the SQL exactly as {@code parse} would produce it; an invalid one carries
 * the first compile error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {

    @JsonProperty("valid")
    private final boolean valid;

    @JsonProperty("sql")
    private final String sql;

    @JsonProperty("parameters")
    private final List<Object> parameters;

    @JsonProperty("warnings")
    private final List<CompileWarning> warnings;

    @JsonProperty("error")
    private final Error error;

    private ValidationResult(boolean valid, String sql, List<Object> parameters,
                             List<CompileWarning> warnings, Error error) {
        this.valid = valid;
        this.sql = sql;
        this.parameters = parameters;
        this.warnings = warnings;
        this.error = error;
    }

    public static ValidationResult valid(ParseResult result) {
        return new ValidationResult(true, result.getCompiled().getSql(),
            result.getCompiled().getParameters(), result.getWarnings(), null);
    }

    public static ValidationResult invalid(QueryCompilationException e) {
        return new ValidationResult(false, null, null, Collections.emptyList(),
            new Error(e.getCode(), e.getStageIndex(), e.getDetail()));
    }

    public boolean isValid() {
        return valid;
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    public List<CompileWarning> getWarnings() {
        return warnings;
    }

    public Error getError() {
        return error;
    }

    /**
     * The compile error of an invalid query.
     */
    public static final class Error {

        @JsonProperty("code")
        private final ErrorCode code;

        @JsonProperty("stage")
        private final int stage;

        @JsonProperty("message")
        private final String message;

        public Error(ErrorCode code, int stage, String message) {
            this.code = code;
            this.stage = stage;
            this.message = message;
        }

        public ErrorCode getCode() {
            return code;
        }

        public int getStage() {
            return stage;
        }

        public String getMessage() {
            return message;
        }
    }
}
