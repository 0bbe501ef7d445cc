package com.loglens.query;

/**
 * Base class for every error raised while turning search text into SQL.
 *
 * Compile errors are deterministic: the same input always fails the same way.
 * They carry the index of the offending pipeline stage (or -1 when the failure
 * is not tied to a stage, e.g. a bad time range) so callers can point the user
 * at the right part of the query.
 */
public class QueryCompilationException extends RuntimeException {

    private final ErrorCode code;
    private final int stageIndex;

    public QueryCompilationException(ErrorCode code, int stageIndex, String message) {
        super(message);
        this.code = code;
        this.stageIndex = stageIndex;
    }

    public QueryCompilationException(ErrorCode code, int stageIndex, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.stageIndex = stageIndex;
    }

    public ErrorCode getCode() {
        return code;
    }

    public int getStageIndex() {
        return stageIndex;
    }

    /**
     * The message without the stage suffix, for API responses that report the
     * stage separately.
     */
    public String getDetail() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (stageIndex >= 0) {
            sb.append(" [Stage: ").append(stageIndex).append("]");
        }
        return sb.toString();
    }
}
