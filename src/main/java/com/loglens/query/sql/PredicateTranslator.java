package com.loglens.query.sql;

import com.loglens.fields.FieldType;
import com.loglens.fields.SeverityLevels;
import com.loglens.query.TypeMismatchException;
import com.loglens.query.ast.BareTermExpression;
import com.loglens.query.ast.BinaryExpression;
import com.loglens.query.ast.ComparisonExpression;
import com.loglens.query.ast.ComparisonOperator;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.InListExpression;
import com.loglens.query.ast.LogicalOperator;
import com.loglens.query.ast.NotExpression;
import com.loglens.query.ast.Value;
import com.loglens.query.ast.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders a resolved predicate tree as a SQL condition over one layer.
 *
 * Every user value becomes a bound parameter. A result of
 * {@link Optional#empty()} means the predicate matches every row and adds no
 * condition.
 */
final class PredicateTranslator {

    static final String NEVER = "1 = 0";
    private static final String RAW_FIELD = "raw";
    private static final String UNSET_IP = "toIPv4('0.0.0.0')";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private final SelectLayer layer;
    private final int stageIndex;

    PredicateTranslator(SelectLayer layer, int stageIndex) {
        this.layer = layer;
        this.stageIndex = stageIndex;
    }

    Optional<SqlFragment> translate(Expression expression) {
        switch (expression.getKind()) {
            case MATCH_ALL:
                return Optional.empty();
            case MATCH_NONE:
                return Optional.of(SqlFragment.of(NEVER));
            case COMPARISON:
                return Optional.of(comparison((ComparisonExpression) expression));
            case IN_LIST:
                return Optional.of(inList((InListExpression) expression));
            case BARE_TERM:
                return bareTerm(((BareTermExpression) expression).getTerm());
            case NOT: {
                Optional<SqlFragment> operand = translate(((NotExpression) expression).getOperand());
                return Optional.of(operand.map(f -> f.wrap("NOT (", ")")).orElse(SqlFragment.of(NEVER)));
            }
            case BINARY:
                return binary((BinaryExpression) expression);
            default:
                throw new IllegalStateException("Cannot translate " + expression.getKind() + ": " + expression);
        }
    }

    private Optional<SqlFragment> binary(BinaryExpression binary) {
        Optional<SqlFragment> left = translate(binary.getLeft());
        Optional<SqlFragment> right = translate(binary.getRight());
        if (binary.getOperator() == LogicalOperator.AND) {
            if (left.isEmpty()) {
                return right;
            }
            if (right.isEmpty()) {
                return left;
            }
            return Optional.of(SqlFragment.join(List.of(left.get(), right.get()), " AND "));
        }
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(SqlFragment.join(List.of(left.get(), right.get()), " OR ").wrap("(", ")"));
    }

    private SqlFragment comparison(ComparisonExpression comparison) {
        OutputColumn column = column(comparison.getField());
        ComparisonOperator operator = comparison.getOperator();
        Value value = comparison.getValue();
        String expr = column.getExpression();
        FieldType type = column.getType();

        if (value.getType() == ValueType.WILDCARD) {
            boolean present = operator == ComparisonOperator.EQ;
            if (type == FieldType.ARRAY) {
                return SqlFragment.of((present ? "notEmpty(" : "empty(") + expr + ")");
            }
            if (type.isTextual()) {
                return SqlFragment.of(expr + (present ? " != ''" : " = ''"));
            }
            if (type == FieldType.IP) {
                return SqlFragment.of(expr + (present ? " != " : " = ") + UNSET_IP);
            }
            return SqlFragment.of((present ? "isNotNull(" : "isNull(") + expr + ")");
        }
        if (operator.isRegex()) {
            String prefix = operator == ComparisonOperator.NOT_REGEX ? "NOT match(" : "match(";
            return SqlFragment.of(prefix + textual(column) + ", ?)", value.getText());
        }
        if (value.isPattern() && operator.isEquality()) {
            String like = operator == ComparisonOperator.EQ ? " LIKE ?" : " NOT LIKE ?";
            return SqlFragment.of(textual(column) + like, LikePatterns.toLike(value.getText()));
        }
        if (type == FieldType.ARRAY) {
            if (!operator.isEquality()) {
                throw new TypeMismatchException(stageIndex, column.getName(),
                    "'" + column.getName() + "' holds a list of values and only supports = and !=");
            }
            String has = "has(" + expr + ", ?)";
            return SqlFragment.of(operator == ComparisonOperator.EQ ? has : "NOT " + has, value.getText());
        }
        return SqlFragment.of(expr + " " + operator.getSymbol() + " " + placeholder(type),
            literal(column, value));
    }

    private SqlFragment inList(InListExpression inList) {
        OutputColumn column = column(inList.getField());
        List<Value> values = inList.getValues();
        boolean patterns = values.stream().anyMatch(v -> v.isPattern() || v.getType() == ValueType.WILDCARD);
        if (patterns || column.getType() == FieldType.ARRAY) {
            List<SqlFragment> alternatives = new ArrayList<>();
            for (Value value : values) {
                alternatives.add(comparison(new ComparisonExpression(inList.getField(), ComparisonOperator.EQ, value)));
            }
            return SqlFragment.join(alternatives, " OR ").wrap("(", ")");
        }

        List<String> placeholders = new ArrayList<>();
        List<Object> parameters = new ArrayList<>();
        for (Value value : values) {
            placeholders.add(placeholder(column.getType()));
            parameters.add(literal(column, value));
        }
        return new SqlFragment(column.getExpression() + " IN (" + String.join(", ", placeholders) + ")", parameters);
    }

    private Optional<SqlFragment> bareTerm(Value term) {
        if (term.getType() == ValueType.WILDCARD) {
            return Optional.empty();
        }
        OutputColumn raw = layer.eventColumn(RAW_FIELD);
        if (raw == null) {
            return Optional.of(SqlFragment.of(NEVER));
        }
        if (term.isPattern()) {
            return Optional.of(SqlFragment.of(raw.getExpression() + " ILIKE ?", LikePatterns.containing(term.getText())));
        }
        return Optional.of(SqlFragment.of("positionCaseInsensitive(" + raw.getExpression() + ", ?) > 0", term.getText()));
    }

    private OutputColumn column(String name) {
        OutputColumn column = layer.resolve(name);
        if (column == null) {
            throw new IllegalStateException("Field '" + name + "' was resolved but is missing from the SQL layer");
        }
        return column;
    }

    private static String textual(OutputColumn column) {
        return column.getType().isTextual() ? column.getExpression() : "toString(" + column.getExpression() + ")";
    }

    private static String placeholder(FieldType type) {
        return type == FieldType.TIMESTAMP ? "parseDateTimeBestEffort(?)" : "?";
    }

    /**
     * Parameter value for a comparison against the column: numbers for
     * numeric columns, text otherwise.
     */
    private Object literal(OutputColumn column, Value value) {
        if (!column.getType().isNumeric()) {
            return value.getText();
        }
        String text = value.getText();
        if (SeverityLevels.FIELD.equals(column.getEventField()) || SeverityLevels.FIELD.equals(column.getName())) {
            Optional<Integer> level = SeverityLevels.toNumber(text);
            if (level.isPresent()) {
                return level.get().longValue();
            }
        }
        if (INTEGER.matcher(text).matches() && text.length() <= 18) {
            return Long.parseLong(text);
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.parseDouble(text);
        }
        throw new TypeMismatchException(stageIndex, column.getName(),
            "'" + column.getName() + "' is numeric but '" + text + "' is not a number");
    }
}
