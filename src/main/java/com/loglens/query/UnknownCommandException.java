package com.loglens.query;

public class UnknownCommandException extends QueryCompilationException {

    private final String command;

    public UnknownCommandException(int stageIndex, String command) {
        super(ErrorCode.UNKNOWN_COMMAND, stageIndex, "Unknown command '" + command + "'");
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
