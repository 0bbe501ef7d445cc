package com.loglens.query;

public class TimeRangeParseException extends QueryCompilationException {

    private final String expression;

    public TimeRangeParseException(String expression, String detail) {
        super(ErrorCode.TIME_RANGE_PARSE, -1, "Invalid time range '" + expression + "': " + detail);
        this.expression = expression;
    }

    public TimeRangeParseException(String expression, String detail, Throwable cause) {
        super(ErrorCode.TIME_RANGE_PARSE, -1, "Invalid time range '" + expression + "': " + detail, cause);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
