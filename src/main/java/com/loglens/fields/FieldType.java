package com.loglens.fields;

import java.util.Locale;

/**
 * Value types known to the search compiler. Storage types are coarser than
 * ClickHouse column types; they only need to drive validation and literal
 * binding.
 */
public enum FieldType {
    STRING,
    NUMBER,
    INTEGER,
    TIMESTAMP,
    IP,
    ARRAY;

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER;
    }

    /**
     * Types whose values can be matched with LIKE or a regex without a cast.
     * IP columns are stored as {@code IPv4} and need {@code toString} first.
     */
    public boolean isTextual() {
        return this == STRING;
    }

    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps the type names reported by ClickHouse {@code JSONType()} to a field type.
     */
    public static FieldType fromJsonType(String jsonType) {
        if (jsonType == null) {
            return STRING;
        }
        return switch (jsonType) {
            case "Int64", "UInt64" -> INTEGER;
            case "Double", "Float64" -> NUMBER;
            case "Array" -> ARRAY;
            default -> STRING;
        };
    }
}
