package com.loglens.query.sql;

import com.loglens.fields.FieldType;

/**
 * A column visible in one SELECT layer: its name, the SQL expression that
 * computes it in that layer's scope, and the event field it carries (null
 * once rows are aggregated).
 */
final class OutputColumn {

    private final String name;
    private final String expression;
    private final FieldType type;
    private final String eventField;

    OutputColumn(String name, String expression, FieldType type, String eventField) {
        this.name = name;
        this.expression = expression;
        this.type = type;
        this.eventField = eventField;
    }

    String getName() {
        return name;
    }

    String getExpression() {
        return expression;
    }

    FieldType getType() {
        return type;
    }

    String getEventField() {
        return eventField;
    }

    OutputColumn renamed(String newName) {
        return new OutputColumn(newName, expression, type, eventField);
    }

    /**
     * Select-list item: the bare expression when it already reads the column
     * by this name, otherwise {@code expr AS name}.
     */
    String selectItem() {
        String quoted = SqlQuoting.quoteIdentifier(name);
        return expression.equals(quoted) ? quoted : expression + " AS " + quoted;
    }

    boolean isAliased() {
        return !expression.equals(SqlQuoting.quoteIdentifier(name));
    }
}
