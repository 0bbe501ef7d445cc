package com.loglens.query;

public class VariableResolutionException extends QueryCompilationException {

    private final String variable;

    public VariableResolutionException(int stageIndex, String variable, String detail) {
        super(ErrorCode.VARIABLE_RESOLUTION, stageIndex, "Variable $" + variable + "$: " + detail);
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
