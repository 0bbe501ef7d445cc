package com.loglens.query;

/**
 * A recognized command whose arguments are structurally invalid, for example
 * {@code dedup} without fields or a {@code rename} pair missing {@code as}.
 */
public class MalformedStageException extends QueryCompilationException {

    private final String stage;

    public MalformedStageException(int stageIndex, String stage, String detail) {
        super(ErrorCode.MALFORMED_STAGE, stageIndex, "Malformed " + stage + " stage: " + detail);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
