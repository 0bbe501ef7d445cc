package com.loglens.query.variable;

import com.loglens.query.VariableResolutionException;
import com.loglens.query.ast.BareTermExpression;
import com.loglens.query.ast.BinaryExpression;
import com.loglens.query.ast.ComparisonExpression;
import com.loglens.query.ast.ComparisonOperator;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.ExpressionKind;
import com.loglens.query.ast.InListExpression;
import com.loglens.query.ast.MatchAllExpression;
import com.loglens.query.ast.NotExpression;
import com.loglens.query.ast.Value;
import com.loglens.query.ast.ValueType;
import com.loglens.query.ast.VariableExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Replaces variable placeholders in parsed predicates with concrete
 * conditions.
 *
 * Values are inserted as literals into already-parsed nodes, so a value can
 * never change the pipeline structure no matter which quotes or pipes it
 * contains.
 * <ul>
 *   <li>one value: a plain comparison</li>
 *   <li>several values with {@code =}: {@code field IN (...)}; with {@code !=}: its negation</li>
 *   <li>several values with other operators, or with wildcard values: one comparison per value, ORed</li>
 *   <li>include-all variable without a selection: the clause matches everything, negated or not</li>
 * </ul>
 */
public class VariableBinder {

    private final VariableBindings bindings;

    public VariableBinder(VariableBindings bindings) {
        this.bindings = bindings == null ? VariableBindings.empty() : bindings;
    }

    public Expression bind(Expression expression, int stageIndex) {
        switch (expression.getKind()) {
            case VARIABLE:
                return bindVariable((VariableExpression) expression, stageIndex);
            case BINARY: {
                BinaryExpression binary = (BinaryExpression) expression;
                return new BinaryExpression(binary.getOperator(),
                    bind(binary.getLeft(), stageIndex),
                    bind(binary.getRight(), stageIndex));
            }
            case NOT: {
                Expression operand = bind(((NotExpression) expression).getOperand(), stageIndex);
                // a removed clause stays removed under negation
                if (operand.getKind() == ExpressionKind.MATCH_ALL && containsVariable(expression)) {
                    return MatchAllExpression.INSTANCE;
                }
                return new NotExpression(operand);
            }
            default:
                return expression;
        }
    }

    private static boolean containsVariable(Expression expression) {
        switch (expression.getKind()) {
            case VARIABLE:
                return true;
            case BINARY: {
                BinaryExpression binary = (BinaryExpression) expression;
                return containsVariable(binary.getLeft()) || containsVariable(binary.getRight());
            }
            case NOT:
                return containsVariable(((NotExpression) expression).getOperand());
            default:
                return false;
        }
    }

    /**
     * Resolve a variable used where a single word is expected, such as a
     * limit or a group-by field.
     */
    public String resolveScalar(String name, int stageIndex) {
        List<String> values = selection(name);
        if (values == null) {
            values = defaults(name, stageIndex);
        }
        if (values.size() != 1) {
            throw new VariableResolutionException(stageIndex, name,
                "expected a single value here but got " + values.size());
        }
        return values.get(0);
    }

    private Expression bindVariable(VariableExpression placeholder, int stageIndex) {
        String name = placeholder.getVariable();
        List<String> values = selection(name);
        if (values == null) {
            boolean includeAll = bindings.definition(name).map(Variable::isIncludeAll).orElse(false);
            if (includeAll) {
                return MatchAllExpression.INSTANCE;
            }
            values = defaults(name, stageIndex);
        }
        checkMultiSelect(name, values, stageIndex);

        List<Value> literals = new ArrayList<>(values.size());
        for (String value : values) {
            literals.add(Value.literal(value));
        }
        if (placeholder.isBareTerm()) {
            return orChain(literals, BareTermExpression::new);
        }

        String field = placeholder.getField();
        ComparisonOperator operator = placeholder.getOperator();
        if (literals.size() == 1) {
            return new ComparisonExpression(field, operator, literals.get(0));
        }
        boolean patterns = literals.stream().anyMatch(v -> v.isPattern() || v.getType() == ValueType.WILDCARD);
        if (operator == ComparisonOperator.EQ && !patterns) {
            return new InListExpression(field, literals);
        }
        if (operator == ComparisonOperator.NE) {
            if (!patterns) {
                return new NotExpression(new InListExpression(field, literals));
            }
            return new NotExpression(orChain(literals, v -> new ComparisonExpression(field, ComparisonOperator.EQ, v)));
        }
        return orChain(literals, v -> new ComparisonExpression(field, operator, v));
    }

    /**
     * @return the explicit selection, or null when nothing was selected
     */
    private List<String> selection(String name) {
        Object value = bindings.value(name);
        if (value == null) {
            return null;
        }
        if (value instanceof List) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) value;
            return list.isEmpty() ? null : list;
        }
        return List.of((String) value);
    }

    private List<String> defaults(String name, int stageIndex) {
        Object defaultValue = bindings.definition(name).map(Variable::getDefaultValue).orElse(null);
        Object normalized = VariableBindings.normalize(defaultValue);
        if (normalized instanceof String) {
            return List.of((String) normalized);
        }
        if (normalized instanceof List && !((List<?>) normalized).isEmpty()) {
            @SuppressWarnings("unchecked")
            List<String> list = (List<String>) normalized;
            return list;
        }
        throw new VariableResolutionException(stageIndex, name, "no value supplied and no default");
    }

    private void checkMultiSelect(String name, List<String> values, int stageIndex) {
        boolean singleOnly = bindings.definition(name).map(v -> !v.isMultiSelect()).orElse(false);
        if (singleOnly && values.size() > 1) {
            throw new VariableResolutionException(stageIndex, name,
                "is not multi-select but " + values.size() + " values were supplied");
        }
    }

    private static Expression orChain(List<Value> values, Function<Value, Expression> leaf) {
        Expression result = leaf.apply(values.get(0));
        for (int i = 1; i < values.size(); i++) {
            result = BinaryExpression.or(result, leaf.apply(values.get(i)));
        }
        return result;
    }
}
