package com.loglens.query.ast;

import com.loglens.fields.FieldType;

import java.util.Locale;
import java.util.Optional;

/**
 * Aggregation functions accepted by {@code stats}.
 */
public enum AggregationFunction {
    COUNT("count", false),
    SUM("sum", true),
    AVG("avg", true),
    MIN("min", true),
    MAX("max", true),
    DC("dc", true),
    VALUES("values", true),
    EARLIEST("earliest", true),
    LATEST("latest", true);

    private final String keyword;
    private final boolean fieldRequired;

    AggregationFunction(String keyword, boolean fieldRequired) {
        this.keyword = keyword;
        this.fieldRequired = fieldRequired;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isFieldRequired() {
        return fieldRequired;
    }

    /**
     * Whether the function accepts input of the given type. {@code sum} and
     * {@code avg} need numbers; {@code min} and {@code max} also take
     * timestamps.
     */
    public boolean accepts(FieldType sourceType) {
        return switch (this) {
            case SUM, AVG -> sourceType.isNumeric();
            case MIN, MAX -> sourceType.isNumeric() || sourceType == FieldType.TIMESTAMP;
            default -> true;
        };
    }

    /**
     * Human readable description of {@link #accepts(FieldType)}.
     */
    public String expectedInput() {
        return this == MIN || this == MAX ? "a numeric or timestamp field" : "a numeric field";
    }

    /**
     * Type of the output column given the type of the input field
     * ({@code null} for a bare {@code count}).
     */
    public FieldType outputType(FieldType sourceType) {
        return switch (this) {
            case COUNT, DC -> FieldType.INTEGER;
            case SUM, AVG -> FieldType.NUMBER;
            case MIN, MAX -> sourceType == FieldType.TIMESTAMP ? FieldType.TIMESTAMP : FieldType.NUMBER;
            case EARLIEST, LATEST -> sourceType;
            case VALUES -> FieldType.ARRAY;
        };
    }

    public static Optional<AggregationFunction> fromKeyword(String keyword) {
        String lower = keyword.toLowerCase(Locale.ROOT);
        if ("distinct_count".equals(lower)) {
            return Optional.of(DC);
        }
        for (AggregationFunction function : values()) {
            if (function.keyword.equals(lower)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }
}
