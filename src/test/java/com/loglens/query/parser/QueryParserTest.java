package com.loglens.query.parser;

import com.loglens.fields.FieldCatalog;
import com.loglens.query.ErrorCode;
import com.loglens.query.MalformedStageException;
import com.loglens.query.QueryCompilationException;
import com.loglens.query.UnknownCommandException;
import com.loglens.query.ast.Aggregation;
import com.loglens.query.ast.AggregationFunction;
import com.loglens.query.ast.BareTermExpression;
import com.loglens.query.ast.BinStage;
import com.loglens.query.ast.BinaryExpression;
import com.loglens.query.ast.ComparisonExpression;
import com.loglens.query.ast.ComparisonOperator;
import com.loglens.query.ast.DedupStage;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.ExpressionKind;
import com.loglens.query.ast.FilterStage;
import com.loglens.query.ast.InListExpression;
import com.loglens.query.ast.LimitStage;
import com.loglens.query.ast.LogicalOperator;
import com.loglens.query.ast.MatchAllExpression;
import com.loglens.query.ast.NotExpression;
import com.loglens.query.ast.Query;
import com.loglens.query.ast.RenamePair;
import com.loglens.query.ast.RenameStage;
import com.loglens.query.ast.SearchStage;
import com.loglens.query.ast.SortDirection;
import com.loglens.query.ast.SortKey;
import com.loglens.query.ast.SortStage;
import com.loglens.query.ast.Span;
import com.loglens.query.ast.StageKind;
import com.loglens.query.ast.StatsStage;
import com.loglens.query.ast.TableStage;
import com.loglens.query.ast.TailStage;
import com.loglens.query.ast.TimechartStage;
import com.loglens.query.ast.TopStage;
import com.loglens.query.ast.Value;
import com.loglens.query.ast.ValueType;
import com.loglens.query.variable.VariableBindings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for QueryParser
 * Covers stage dispatch, the predicate grammar and per-stage error reporting
 */
@DisplayName("QueryParser Tests")
class QueryParserTest {

    private QueryParser parser;
    private FieldCatalog catalog;

    @BeforeEach
    void setUp() {
        parser = new QueryParser();
        catalog = FieldCatalog.builtIn();
    }

    private Query parse(String text) {
        return parser.parse(text, VariableBindings.empty(), catalog);
    }

    private Expression searchExpression(String text) {
        return ((SearchStage) parse(text).getStages().get(0)).getExpression();
    }

    // ========== Stage dispatch ==========

    @Test
    void testEmptyQuery_ShouldCompileAsSearchAll() {
        Query query = parse("   ");

        assertThat(query.getStages()).hasSize(1);
        SearchStage stage = (SearchStage) query.getStages().get(0);
        assertThat(stage.getExpression()).isSameAs(MatchAllExpression.INSTANCE);
    }

    @Test
    void testFirstStageWithoutCommand_ShouldBeImplicitSearch() {
        Query query = parse("error");

        assertThat(query.getStages().get(0).getKind()).isEqualTo(StageKind.SEARCH);
        assertThat(searchExpression("error"))
            .isEqualTo(new BareTermExpression(new Value(ValueType.WORD, "error")));
    }

    @Test
    void testCommandWordFollowedByOperator_ShouldBeCondition() {
        Expression expression = searchExpression("sort=asc");

        // no field called sort, so the condition is dropped to never-match
        assertThat(expression.getKind()).isEqualTo(ExpressionKind.MATCH_NONE);
    }

    @Test
    void testUnknownLaterCommand_ShouldFailWithStageIndex() {
        assertThatThrownBy(() -> parse("error | frobnicate x"))
            .isInstanceOf(UnknownCommandException.class)
            .satisfies(e -> assertThat(((QueryCompilationException) e).getStageIndex()).isEqualTo(1))
            .hasMessageContaining("[Stage: 1]");
    }

    @Test
    void testEmptyStage_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("error | | head 5"))
            .isInstanceOf(MalformedStageException.class)
            .satisfies(e -> assertThat(((QueryCompilationException) e).getStageIndex()).isEqualTo(1));
        assertThatThrownBy(() -> parse("error |"))
            .isInstanceOf(MalformedStageException.class)
            .satisfies(e -> assertThat(((QueryCompilationException) e).getStageIndex()).isEqualTo(1));
    }

    @Test
    void testWhereAndFilter_ShouldKeepCommandWord() {
        Query query = parse("* | where severity<=3 | filter host=web1");

        FilterStage where = (FilterStage) query.getStages().get(1);
        FilterStage filter = (FilterStage) query.getStages().get(2);
        assertThat(where.getCommand()).isEqualTo("where");
        assertThat(filter.getCommand()).isEqualTo("filter");
        assertThat(filter.getExpression())
            .isEqualTo(new ComparisonExpression("hostname", ComparisonOperator.EQ, new Value(ValueType.WORD, "web1")));
    }

    @Test
    void testFilterWithoutCondition_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("* | where"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("missing condition");
    }

    // ========== Predicate grammar ==========

    @Test
    @DisplayName("OR should bind tighter than the implicit AND")
    void testOrBindsTighterThanImplicitAnd() {
        Expression expression = searchExpression("error host=a OR host=b");

        assertThat(expression).isInstanceOf(BinaryExpression.class);
        BinaryExpression and = (BinaryExpression) expression;
        assertThat(and.getOperator()).isEqualTo(LogicalOperator.AND);
        assertThat(and.getLeft().getKind()).isEqualTo(ExpressionKind.BARE_TERM);
        BinaryExpression or = (BinaryExpression) and.getRight();
        assertThat(or.getOperator()).isEqualTo(LogicalOperator.OR);
    }

    @Test
    void testParenthesesAndNot() {
        Expression expression = searchExpression("NOT (host=a AND severity>3)");

        assertThat(expression).isInstanceOf(NotExpression.class);
        Expression operand = ((NotExpression) expression).getOperand();
        assertThat(((BinaryExpression) operand).getOperator()).isEqualTo(LogicalOperator.AND);
    }

    @Test
    void testInList() {
        Expression expression = searchExpression("host IN (web1, \"web 2\", 3)");

        assertThat(expression).isInstanceOf(InListExpression.class);
        InListExpression inList = (InListExpression) expression;
        assertThat(inList.getField()).isEqualTo("hostname");
        assertThat(inList.getValues()).containsExactly(
            new Value(ValueType.WORD, "web1"),
            new Value(ValueType.STRING, "web 2"),
            new Value(ValueType.NUMBER, "3"));
    }

    @Test
    void testEmptyInListAndVariablesInList_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("host IN ()"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("empty");
        assertThatThrownBy(() -> parse("host IN ($hosts$)"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("variables are not supported");
    }

    @Test
    void testRegexLiteral_ShouldImplyRegexOperator() {
        assertThat(searchExpression("message=/fail.*/"))
            .isEqualTo(new ComparisonExpression("message", ComparisonOperator.REGEX, new Value(ValueType.REGEX, "fail.*")));
        assertThat(searchExpression("message!=/fail.*/"))
            .isEqualTo(new ComparisonExpression("message", ComparisonOperator.NOT_REGEX, new Value(ValueType.REGEX, "fail.*")));
        assertThat(searchExpression("/timeout/"))
            .isEqualTo(new ComparisonExpression("raw", ComparisonOperator.REGEX, new Value(ValueType.REGEX, "timeout")));
    }

    @Test
    void testRegexWithOrderingOperator_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("message>/x/"))
            .isInstanceOf(MalformedStageException.class);
    }

    @Test
    void testWildcardValue_OnlyWithEquality() {
        assertThat(searchExpression("message=*"))
            .isEqualTo(new ComparisonExpression("message", ComparisonOperator.EQ, new Value(ValueType.WILDCARD, "*")));
        assertThatThrownBy(() -> parse("severity>*"))
            .isInstanceOf(MalformedStageException.class);
    }

    @Test
    void testQuotedStringBeforeOperator_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("\"host\"=a"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("expected a field name");
    }

    @Test
    void testDanglingOperators_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("host=a OR"))
            .isInstanceOf(MalformedStageException.class);
        assertThatThrownBy(() -> parse("(host=a"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("missing ')'");
        assertThatThrownBy(() -> parse("host="))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("missing value");
    }

    // ========== Commands ==========

    @Test
    void testStats_WithAliasesAndGroupBy() {
        StatsStage stats = (StatsStage) parse("* | stats count, avg(severity) as avg_sev, dc(host) by app, host")
            .getStages().get(1);

        assertThat(stats.getAggregations()).extracting(Aggregation::getFunction)
            .containsExactly(AggregationFunction.COUNT, AggregationFunction.AVG, AggregationFunction.DC);
        assertThat(stats.getAggregations()).extracting(Aggregation::getAlias)
            .containsExactly("count", "avg_sev", "dc_host");
        assertThat(stats.getAggregations().get(2).getField()).isEqualTo("hostname");
        assertThat(stats.getGroupBy()).containsExactly("app_name", "hostname");
    }

    @Test
    void testStats_CountStarAndEmptyParentheses() {
        StatsStage stats = (StatsStage) parse("* | stats count(*) as total count() as n").getStages().get(1);

        assertThat(stats.getAggregations()).extracting(Aggregation::getField).containsExactly(null, null);
        assertThat(stats.getAggregations()).extracting(Aggregation::getAlias).containsExactly("total", "n");
    }

    @Test
    void testStats_InvalidForms() {
        assertThatThrownBy(() -> parse("* | stats by host"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("at least one aggregation");
        assertThatThrownBy(() -> parse("* | stats median(severity)"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("unknown function");
        assertThatThrownBy(() -> parse("* | stats count, count"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("duplicate output column");
        assertThatThrownBy(() -> parse("* | stats sum"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("requires a field");
    }

    @Test
    void testSort_DirectionForms() {
        SortStage sort = (SortStage) parse("* | sort desc severity, host asc, -facility +priority app")
            .getStages().get(1);

        assertThat(sort.getKeys()).containsExactly(
            new SortKey("severity", SortDirection.DESC),
            new SortKey("hostname", SortDirection.ASC),
            new SortKey("facility", SortDirection.DESC),
            new SortKey("priority", SortDirection.ASC),
            new SortKey("app_name", SortDirection.ASC));
    }

    @Test
    void testSort_TrailingDirectionAppliesToPreviousField() {
        SortStage sort = (SortStage) parse("* | sort severity desc").getStages().get(1);

        assertThat(sort.getKeys()).containsExactly(new SortKey("severity", SortDirection.DESC));
    }

    @Test
    void testSort_WithoutField_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("* | sort desc"))
            .isInstanceOf(MalformedStageException.class);
        assertThatThrownBy(() -> parse("* | sort"))
            .isInstanceOf(MalformedStageException.class);
    }

    @Test
    void testLimitAndHead() {
        assertThat(((LimitStage) parse("* | limit 25").getStages().get(1)).getLimit()).isEqualTo(25);
        assertThat(((LimitStage) parse("* | head 0").getStages().get(1)).getLimit()).isZero();
    }

    @Test
    void testLimit_InvalidValues() {
        assertThatThrownBy(() -> parse("* | limit -1"))
            .isInstanceOf(MalformedStageException.class);
        assertThatThrownBy(() -> parse("* | limit 1.5"))
            .isInstanceOf(MalformedStageException.class);
        assertThatThrownBy(() -> parse("* | limit 5 10"))
            .isInstanceOf(MalformedStageException.class);
        assertThatThrownBy(() -> parse("* | limit"))
            .isInstanceOf(MalformedStageException.class);
        assertThatThrownBy(() -> parse("* | limit 99999999999999999999"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("out of range");
    }

    @Test
    void testTableAndFieldsExclusion() {
        TableStage include = (TableStage) parse("* | table host, message").getStages().get(1);
        TableStage exclude = (TableStage) parse("* | fields - raw").getStages().get(1);

        assertThat(include.getColumns()).containsExactly("hostname", "message");
        assertThat(include.isExclude()).isFalse();
        assertThat(exclude.getColumns()).containsExactly("raw");
        assertThat(exclude.isExclude()).isTrue();
    }

    @Test
    void testDedupAndRename() {
        Query query = parse("* | dedup host app | rename host as server, app as program_name");

        assertThat(((DedupStage) query.getStages().get(1)).getKeys()).containsExactly("hostname", "app_name");
        assertThat(((RenameStage) query.getStages().get(2)).getPairs()).containsExactly(
            new RenamePair("hostname", "server"), new RenamePair("app_name", "program_name"));
    }

    @Test
    void testRename_MissingAs_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("* | rename host server"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("missing 'as'");
    }

    @Test
    void testTopAndRare() {
        TopStage top = (TopStage) parse("* | top limit=5 host").getStages().get(1);
        TopStage rare = (TopStage) parse("* | rare app").getStages().get(1);

        assertThat(top.getField()).isEqualTo("hostname");
        assertThat(top.getLimit()).isEqualTo(5);
        assertThat(top.isRare()).isFalse();
        assertThat(rare.getLimit()).isEqualTo(TopStage.DEFAULT_LIMIT);
        assertThat(rare.isRare()).isTrue();
    }

    @Test
    void testTop_TwoFields_ShouldBeMalformed() {
        assertThatThrownBy(() -> parse("* | top host app"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("single field");
    }

    // ========== Time buckets ==========

    @Test
    void testTimechart_SpanAggregationsAndSplit() {
        TimechartStage before = (TimechartStage) parse("* | timechart span=5m count, avg(severity) by host")
            .getStages().get(1);
        TimechartStage after = (TimechartStage) parse("* | timechart count by host span=5M").getStages().get(1);

        assertThat(before.getSpan()).isEqualTo(Span.ofTime(5, Span.Unit.MINUTE));
        assertThat(before.getAggregations()).extracting(Aggregation::getAlias).containsExactly("count", "avg_severity");
        assertThat(before.getSplitBy()).isEqualTo("hostname");
        assertThat(after.getSpan()).isEqualTo(before.getSpan());
        assertThat(after.getSplitBy()).isEqualTo("hostname");
    }

    @Test
    void testTimechart_WithoutSpan_ShouldUseHourlyBuckets() {
        TimechartStage stage = (TimechartStage) parse("* | timechart count").getStages().get(1);

        assertThat(stage.getKind()).isEqualTo(StageKind.TIMECHART);
        assertThat(stage.getSpan()).isEqualTo(TimechartStage.DEFAULT_SPAN);
        assertThat(stage.getSpan().toString()).isEqualTo("1h");
        assertThat(stage.getSplitBy()).isNull();
    }

    @Test
    void testTimechart_InvalidForms() {
        assertThatThrownBy(() -> parse("* | timechart span=100 count"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("needs a time unit");
        assertThatThrownBy(() -> parse("* | timechart span=1h count span=5m"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("span is given twice");
        assertThatThrownBy(() -> parse("* | timechart span=0m count"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("invalid span '0m'");
        assertThatThrownBy(() -> parse("* | timechart count by host app"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("single field");
        assertThatThrownBy(() -> parse("* | timechart span=1h"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("at least one aggregation");
    }

    @Test
    void testBin_SpanAndFieldInEitherOrder() {
        BinStage first = (BinStage) parse("* | bin span=1h timestamp").getStages().get(1);
        BinStage second = (BinStage) parse("* | bin severity span=2.50 as sev_bucket").getStages().get(1);

        assertThat(first.getField()).isEqualTo("timestamp");
        assertThat(first.getSpan()).isEqualTo(Span.ofTime(1, Span.Unit.HOUR));
        assertThat(first.getAlias()).isNull();
        assertThat(first.getTargetName()).isEqualTo("timestamp");
        assertThat(second.getField()).isEqualTo("severity");
        assertThat(second.getSpan().isTime()).isFalse();
        assertThat(second.getSpan().getAmountText()).isEqualTo("2.5");
        assertThat(second.getTargetName()).isEqualTo("sev_bucket");
    }

    @Test
    void testBin_InvalidForms() {
        assertThatThrownBy(() -> parse("* | bin timestamp"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("span=<width> is required");
        assertThatThrownBy(() -> parse("* | bin span=1h"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("a field is required");
        assertThatThrownBy(() -> parse("* | bin span=1h timestamp severity"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("single field");
        assertThatThrownBy(() -> parse("* | bin span=wide severity"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("invalid span");
    }

    @Test
    void testTail_DefaultAndExplicitLimit() {
        assertThat(((TailStage) parse("* | tail").getStages().get(1)).getLimit()).isEqualTo(TailStage.DEFAULT_LIMIT);
        assertThat(((TailStage) parse("* | tail 3").getStages().get(1)).getLimit()).isEqualTo(3);
        assertThatThrownBy(() -> parse("* | tail 3 4"))
            .isInstanceOf(MalformedStageException.class);
    }

    // ========== Variables in non-predicate positions ==========

    @Test
    void testVariableLimitAndGroupBy() {
        VariableBindings bindings = VariableBindings.ofValues(Map.of("n", "7", "group", "host"));

        Query query = parser.parse("* | stats count by $group$ | head $n$", bindings, catalog);

        assertThat(((StatsStage) query.getStages().get(1)).getGroupBy()).containsExactly("hostname");
        assertThat(((LimitStage) query.getStages().get(2)).getLimit()).isEqualTo(7);
    }

    @Test
    void testVariableLimit_NotANumber_ShouldFail() {
        VariableBindings bindings = VariableBindings.ofValues(Map.of("n", "ten"));

        assertThatThrownBy(() -> parser.parse("* | head $n$", bindings, catalog))
            .isInstanceOf(QueryCompilationException.class)
            .satisfies(e -> assertThat(((QueryCompilationException) e).getCode()).isEqualTo(ErrorCode.VARIABLE_RESOLUTION));
    }

    @Test
    void testVariableField_WithPipe_ShouldNotChangeStructure() {
        VariableBindings bindings = VariableBindings.ofValues(Map.of("group", "host | delete"));

        assertThatThrownBy(() -> parser.parse("* | stats count by $group$", bindings, catalog))
            .isInstanceOf(QueryCompilationException.class)
            .satisfies(e -> assertThat(((QueryCompilationException) e).getCode()).isEqualTo(ErrorCode.VARIABLE_RESOLUTION));
    }
}
