package com.loglens.query.variable;

import com.loglens.query.VariableResolutionException;
import com.loglens.query.ast.BareTermExpression;
import com.loglens.query.ast.BinaryExpression;
import com.loglens.query.ast.ComparisonExpression;
import com.loglens.query.ast.ComparisonOperator;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.InListExpression;
import com.loglens.query.ast.MatchAllExpression;
import com.loglens.query.ast.NotExpression;
import com.loglens.query.ast.Value;
import com.loglens.query.ast.ValueType;
import com.loglens.query.ast.VariableExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VariableBinder Tests")
class VariableBinderTest {

    private static final VariableExpression HOST_EQ = new VariableExpression("host", ComparisonOperator.EQ, "hosts");

    private static Value string(String text) {
        return new Value(ValueType.STRING, text);
    }

    // ========== Single and multiple values ==========

    @Test
    void shouldBindSingleValueAsLiteral() {
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("hosts", "web-01")));

        assertThat(binder.bind(HOST_EQ, 0))
            .isEqualTo(new ComparisonExpression("host", ComparisonOperator.EQ, string("web-01")));
    }

    @Test
    void shouldKeepMetacharactersInsideTheLiteral() {
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("hosts", "a\" | drop table x")));

        assertThat(binder.bind(HOST_EQ, 0))
            .isEqualTo(new ComparisonExpression("host", ComparisonOperator.EQ, string("a\" | drop table x")));
    }

    @Test
    void shouldBindMultipleValuesAsInList() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", null, true, false)),
            Map.of("hosts", List.of("web-01", "web-02")));

        assertThat(new VariableBinder(bindings).bind(HOST_EQ, 0))
            .isEqualTo(new InListExpression("host", List.of(string("web-01"), string("web-02"))));
    }

    @Test
    void shouldNegateInListForNotEquals() {
        VariableExpression placeholder = new VariableExpression("host", ComparisonOperator.NE, "hosts");
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("hosts", List.of("a", "b"))));

        assertThat(binder.bind(placeholder, 0))
            .isEqualTo(new NotExpression(new InListExpression("host", List.of(string("a"), string("b")))));
    }

    @Test
    void shouldOrPatternValues() {
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("hosts", List.of("web*", "db-01"))));

        assertThat(binder.bind(HOST_EQ, 0)).isEqualTo(BinaryExpression.or(
            new ComparisonExpression("host", ComparisonOperator.EQ, string("web*")),
            new ComparisonExpression("host", ComparisonOperator.EQ, string("db-01"))));
    }

    @Test
    void shouldOrOrderingComparisons() {
        VariableExpression placeholder = new VariableExpression("severity", ComparisonOperator.LE, "levels");
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("levels", List.of(3, 4))));

        assertThat(binder.bind(placeholder, 0)).isEqualTo(BinaryExpression.or(
            new ComparisonExpression("severity", ComparisonOperator.LE, string("3")),
            new ComparisonExpression("severity", ComparisonOperator.LE, string("4"))));
    }

    @Test
    void shouldBindBareTermVariable() {
        VariableExpression placeholder = new VariableExpression(null, null, "term");
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("term", List.of("error", "fatal"))));

        assertThat(binder.bind(placeholder, 0)).isEqualTo(BinaryExpression.or(
            new BareTermExpression(string("error")),
            new BareTermExpression(string("fatal"))));
    }

    @Test
    void shouldBindInsideBooleanStructure() {
        Expression expression = new NotExpression(BinaryExpression.and(
            HOST_EQ, new ComparisonExpression("app", ComparisonOperator.EQ, new Value(ValueType.WORD, "nginx"))));
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("hosts", "h1")));

        assertThat(binder.bind(expression, 0)).isEqualTo(new NotExpression(BinaryExpression.and(
            new ComparisonExpression("host", ComparisonOperator.EQ, string("h1")),
            new ComparisonExpression("app", ComparisonOperator.EQ, new Value(ValueType.WORD, "nginx")))));
    }

    // ========== Defaults and include-all ==========

    @Test
    void shouldUseDefaultWhenNothingSelected() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", "fallback", false, false)), Map.of());

        assertThat(new VariableBinder(bindings).bind(HOST_EQ, 0))
            .isEqualTo(new ComparisonExpression("host", ComparisonOperator.EQ, string("fallback")));
    }

    @Test
    void shouldTreatEmptySelectionAsNoSelection() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", List.of("x", "y"), true, false)),
            Map.of("hosts", List.of()));

        assertThat(new VariableBinder(bindings).bind(HOST_EQ, 0))
            .isEqualTo(new InListExpression("host", List.of(string("x"), string("y"))));
    }

    @Test
    @DisplayName("Include-all variable without a selection should match everything")
    void shouldMatchAllForIncludeAll() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", null, true, true)), Map.of());

        assertThat(new VariableBinder(bindings).bind(HOST_EQ, 0)).isSameAs(MatchAllExpression.INSTANCE);
    }

    @Test
    void shouldDropNegatedIncludeAllClause() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", null, true, true)), Map.of());

        assertThat(new VariableBinder(bindings).bind(new NotExpression(HOST_EQ), 0))
            .isSameAs(MatchAllExpression.INSTANCE);
    }

    @Test
    void shouldKeepNegatedIncludeAllInsideLargerClause() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", null, true, true)), Map.of());
        Expression appIsWeb = new ComparisonExpression("app", ComparisonOperator.EQ, string("web"));

        Expression bound = new VariableBinder(bindings)
            .bind(new NotExpression(BinaryExpression.or(HOST_EQ, appIsWeb)), 0);

        assertThat(bound).isEqualTo(new NotExpression(BinaryExpression.or(MatchAllExpression.INSTANCE, appIsWeb)));
    }

    @Test
    void shouldRejectMissingValueWithoutDefault() {
        VariableBinder binder = new VariableBinder(VariableBindings.empty());

        assertThatThrownBy(() -> binder.bind(HOST_EQ, 2))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("Variable $hosts$: no value supplied and no default")
            .satisfies(e -> assertThat(((VariableResolutionException) e).getStageIndex()).isEqualTo(2));
    }

    @Test
    void shouldRejectSeveralValuesForSingleSelectVariable() {
        VariableBindings bindings = new VariableBindings(
            List.of(new Variable("hosts", null, false, false)),
            Map.of("hosts", List.of("a", "b")));

        assertThatThrownBy(() -> new VariableBinder(bindings).bind(HOST_EQ, 0))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("is not multi-select");
    }

    // ========== Scalar positions ==========

    @Test
    void shouldResolveScalar() {
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("n", 25)));

        assertThat(binder.resolveScalar("n", 1)).isEqualTo("25");
    }

    @Test
    void shouldRejectListInScalarPosition() {
        VariableBinder binder = new VariableBinder(VariableBindings.ofValues(Map.of("n", List.of("1", "2"))));

        assertThatThrownBy(() -> binder.resolveScalar("n", 1))
            .isInstanceOf(VariableResolutionException.class)
            .hasMessageContaining("expected a single value");
    }

    @Test
    void shouldFingerprintIndependentOfInsertionOrder() {
        VariableBindings first = VariableBindings.ofValues(Map.of("a", "1", "b", List.of("x", "y")));
        VariableBindings second = VariableBindings.ofValues(Map.of("b", List.of("x", "y"), "a", "1"));

        assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        assertThat(first.fingerprint()).isNotEqualTo(VariableBindings.ofValues(Map.of("a", "2")).fingerprint());
        assertThat(VariableBindings.empty().fingerprint()).isEmpty();
    }

    @Test
    void shouldFingerprintListsAndScalarsDistinctly() {
        VariableBindings list = VariableBindings.ofValues(Map.of("host", List.of("a, b")));
        VariableBindings pair = VariableBindings.ofValues(Map.of("host", List.of("a", "b")));
        VariableBindings scalar = VariableBindings.ofValues(Map.of("host", "a, b"));
        VariableBindings merged = VariableBindings.ofValues(Map.of("host", "x, limit=5"));
        VariableBindings split = VariableBindings.ofValues(Map.of("host", "x", "limit", "5"));

        assertThat(List.of(list.fingerprint(), pair.fingerprint(), scalar.fingerprint())).doesNotHaveDuplicates();
        assertThat(merged.fingerprint()).isNotEqualTo(split.fingerprint());
    }
}
