package com.loglens.query;

/**
 * Raised for malformed tokens: unterminated quotes, regex literals or variable
 * references, and characters the search language does not accept.
 */
public class LexException extends QueryCompilationException {

    private final int offset;
    private final String reason;

    public LexException(int stageIndex, int offset, String reason) {
        super(ErrorCode.LEX_ERROR, stageIndex, reason + " at offset " + offset);
        this.offset = offset;
        this.reason = reason;
    }

    /**
     * Offset of the offending character in the full query text.
     */
    public int getOffset() {
        return offset;
    }

    public String getReason() {
        return reason;
    }
}
