package com.loglens.query.lexer;

/**
 * The raw text of one pipeline stage and where it sits in the query.
 */
public final class StageText {

    private final int index;
    private final String text;
    private final int offset;

    public StageText(int index, String text, int offset) {
        this.index = index;
        this.text = text;
        this.offset = offset;
    }

    public int getIndex() {
        return index;
    }

    public String getText() {
        return text;
    }

    /**
     * Offset of the first character of this stage in the full query text.
     */
    public int getOffset() {
        return offset;
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    @Override
    public String toString() {
        return index + ":" + text;
    }
}
