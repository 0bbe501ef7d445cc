package com.loglens.query.ast;

import java.util.Objects;

/**
 * A literal on the right-hand side of a comparison, as written in the query.
 */
public final class Value {

    private final ValueType type;
    private final String text;

    public Value(ValueType type, String text) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * A value supplied through a variable. It is always a literal; a lone
     * {@code *} keeps its any-value meaning.
     */
    public static Value literal(String text) {
        return "*".equals(text) ? new Value(ValueType.WILDCARD, text) : new Value(ValueType.STRING, text);
    }

    public ValueType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    /**
     * True for words and strings with embedded {@code *} or {@code ?}.
     */
    public boolean isPattern() {
        return (type == ValueType.STRING || type == ValueType.WORD)
            && (text.indexOf('*') >= 0 || text.indexOf('?') >= 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value that = (Value) o;
        return type == that.type && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRING -> "\"" + text + "\"";
            case REGEX -> "/" + text + "/";
            default -> text;
        };
    }
}
