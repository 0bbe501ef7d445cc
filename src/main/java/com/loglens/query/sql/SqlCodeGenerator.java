package com.loglens.query.sql;

import com.loglens.fields.FieldCatalog;
import com.loglens.fields.FieldType;
import com.loglens.query.MalformedStageException;
import com.loglens.query.TimeBounds;
import com.loglens.query.ast.Aggregation;
import com.loglens.query.ast.AggregationFunction;
import com.loglens.query.ast.BinStage;
import com.loglens.query.ast.DedupStage;
import com.loglens.query.ast.LimitStage;
import com.loglens.query.ast.PredicateStage;
import com.loglens.query.ast.Query;
import com.loglens.query.ast.RenamePair;
import com.loglens.query.ast.RenameStage;
import com.loglens.query.ast.SortDirection;
import com.loglens.query.ast.SortKey;
import com.loglens.query.ast.SortStage;
import com.loglens.query.ast.Span;
import com.loglens.query.ast.Stage;
import com.loglens.query.ast.StatsStage;
import com.loglens.query.ast.TableStage;
import com.loglens.query.ast.TailStage;
import com.loglens.query.ast.TimechartStage;
import com.loglens.query.ast.TopStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generates one parameterized ClickHouse statement for a validated query.
 *
 * Stages are folded into the current {@link SelectLayer} while the SQL
 * semantics allow it, and the layer is wrapped as a subquery when they do
 * not: conditions cannot follow an aggregation or a limit in the same
 * SELECT, aggregations cannot follow a limit, and deduplication needs its
 * window computed one level below the filter on it. Sorting and limiting
 * always end up on the outermost SELECT.
 */
public class SqlCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SqlCodeGenerator.class);

    static final String DEDUP_RANK = "_dedup_rank";
    static final String TIMESTAMP_FIELD = "timestamp";
    private static final String SHADOWING_SETTINGS = " SETTINGS prefer_column_name_to_alias = 1";

    private final String table;
    private final long defaultLimit;

    public SqlCodeGenerator(String table, long defaultLimit) {
        this.table = SqlQuoting.checkTableName(table);
        this.defaultLimit = defaultLimit;
    }

    public CompiledQuery generate(Query query, FieldCatalog catalog, TimeBounds bounds) {
        SelectLayer layer = SelectLayer.base(table, catalog);
        addTimeBounds(layer, bounds);

        for (Stage stage : query.getStages()) {
            layer = switch (stage.getKind()) {
                case SEARCH, FILTER -> filter(layer, (PredicateStage) stage);
                case STATS -> stats(layer, (StatsStage) stage);
                case TOP -> top(layer, (TopStage) stage);
                case SORT -> sort(layer, (SortStage) stage);
                case LIMIT -> limit(layer, (LimitStage) stage);
                case TABLE -> table(layer, (TableStage) stage);
                case DEDUP -> dedup(layer, (DedupStage) stage);
                case RENAME -> rename(layer, (RenameStage) stage);
                case TIMECHART -> timechart(layer, (TimechartStage) stage);
                case BIN -> bin(layer, (BinStage) stage);
                case TAIL -> tail(layer, (TailStage) stage);
            };
        }

        if (layer.isEventRows()) {
            orderNewestFirst(layer);
            if (!layer.isLimited()) {
                layer.applyLimit(defaultLimit);
            }
        }

        SqlFragment statement = layer.render(true);
        String sql = statement.getSql();
        if (layer.hasShadowingAlias(true)) {
            sql += SHADOWING_SETTINGS;
        }
        log.debug("Generated SQL for '{}': {} with {} parameters", query, sql, statement.getParameters().size());
        return new CompiledQuery(sql, statement.getParameters(), query.getOutputSchema());
    }

    private void addTimeBounds(SelectLayer layer, TimeBounds bounds) {
        if (bounds == null) {
            return;
        }
        String timestamp = layer.eventColumn(TIMESTAMP_FIELD).getExpression();
        if (bounds.getEarliest() != null) {
            layer.addWhere(SqlFragment.of(timestamp + " >= ?", Timestamp.from(bounds.getEarliest())));
        }
        if (bounds.getLatest() != null) {
            layer.addWhere(SqlFragment.of(timestamp + " <= ?", Timestamp.from(bounds.getLatest())));
        }
    }

    private SelectLayer filter(SelectLayer layer, PredicateStage stage) {
        SelectLayer target = layer.isAggregated() || layer.isLimited() ? layer.wrap() : layer;
        new PredicateTranslator(target, stage.getIndex())
            .translate(stage.getExpression())
            .ifPresent(target::addWhere);
        return target;
    }

    private SelectLayer stats(SelectLayer layer, StatsStage stage) {
        SelectLayer target = layer.isAggregated() || layer.isLimited() ? layer.wrap() : layer;

        List<String> groupExpressions = new ArrayList<>();
        List<OutputColumn> columns = new ArrayList<>();
        for (String field : stage.getGroupBy()) {
            OutputColumn column = target.resolve(field);
            groupExpressions.add(column.getExpression());
            columns.add(new OutputColumn(field, column.getExpression(), column.getType(), null));
        }
        addAggregations(target, stage.getAggregations(), stage.getIndex(), columns);
        target.aggregate(groupExpressions, columns);
        return target;
    }

    private void addAggregations(SelectLayer layer, List<Aggregation> aggregations, int stageIndex,
                                 List<OutputColumn> columns) {
        for (Aggregation aggregation : aggregations) {
            OutputColumn source = aggregation.getField() == null ? null : layer.resolve(aggregation.getField());
            FieldType sourceType = source == null ? null : source.getType();
            columns.add(new OutputColumn(aggregation.getAlias(),
                aggregateExpression(layer, aggregation, source, stageIndex),
                aggregation.getFunction().outputType(sourceType), null));
        }
    }

    private SelectLayer timechart(SelectLayer layer, TimechartStage stage) {
        SelectLayer target = layer.isAggregated() || layer.isLimited() ? layer.wrap() : layer;
        String timestamp = timestampExpression(target).orElseThrow(() ->
            new MalformedStageException(stage.getIndex(), "timechart", "needs a timestamp column"));
        String bucket = timeBucket(timestamp, stage.getSpan());

        List<String> groupExpressions = new ArrayList<>();
        List<OutputColumn> columns = new ArrayList<>();
        List<OrderItem> order = new ArrayList<>();
        groupExpressions.add(bucket);
        columns.add(new OutputColumn(TimechartStage.TIME_COLUMN, bucket, FieldType.TIMESTAMP, null));
        order.add(new OrderItem(TimechartStage.TIME_COLUMN, bucket, SortDirection.ASC));
        if (stage.getSplitBy() != null) {
            OutputColumn column = target.resolve(stage.getSplitBy());
            groupExpressions.add(column.getExpression());
            columns.add(new OutputColumn(stage.getSplitBy(), column.getExpression(), column.getType(), null));
            order.add(new OrderItem(stage.getSplitBy(), column.getExpression(), SortDirection.ASC));
        }
        addAggregations(target, stage.getAggregations(), stage.getIndex(), columns);
        target.aggregate(groupExpressions, columns);
        target.setOrderBy(order);
        return target;
    }

    private SelectLayer bin(SelectLayer layer, BinStage stage) {
        OutputColumn source = layer.resolve(stage.getField());
        Span span = stage.getSpan();
        String expression = span.isTime()
            ? timeBucket(source.getExpression(), span)
            : "floor(" + source.getExpression() + " / " + span.getAmountText() + ") * " + span.getAmountText();
        FieldType type = span.isTime() ? FieldType.TIMESTAMP : FieldType.NUMBER;
        if (stage.getAlias() == null) {
            layer.replaceColumn(stage.getField(), expression, type);
        } else {
            layer.addColumn(stage.getAlias(), expression, type);
        }
        return layer;
    }

    /**
     * Reverses the current ordering and keeps the first rows of that. Event
     * rows without an explicit sort count as ordered newest first.
     */
    private SelectLayer tail(SelectLayer layer, TailStage stage) {
        SelectLayer target = layer.isLimited() ? layer.wrap() : layer;
        if (target.isEventRows()) {
            orderNewestFirst(target);
        }
        if (target.getOrderBy().isEmpty()) {
            throw new MalformedStageException(stage.getIndex(), "tail",
                "needs an earlier sort to know which rows come last");
        }
        List<OrderItem> reversed = new ArrayList<>();
        for (OrderItem item : target.getOrderBy()) {
            reversed.add(item.reversed());
        }
        target.setOrderBy(reversed);
        target.applyLimit(stage.getLimit());
        return target;
    }

    private static String timeBucket(String expression, Span span) {
        return "toStartOfInterval(" + expression + ", INTERVAL " + span.getAmountText() + " "
            + span.getUnit().name() + ")";
    }

    private String aggregateExpression(SelectLayer layer, Aggregation aggregation, OutputColumn source, int stageIndex) {
        String expr = source == null ? null : source.getExpression();
        return switch (aggregation.getFunction()) {
            case COUNT -> expr == null ? "count()" : "count(" + expr + ")";
            case SUM -> "sum(" + expr + ")";
            case AVG -> "avg(" + expr + ")";
            case MIN -> "min(" + expr + ")";
            case MAX -> "max(" + expr + ")";
            case DC -> "uniqExact(" + expr + ")";
            case VALUES -> "groupUniqArray(" + expr + ")";
            case EARLIEST, LATEST -> {
                String timestamp = timestampExpression(layer).orElseThrow(() ->
                    new MalformedStageException(stageIndex, "stats",
                        aggregation.getFunction().getKeyword() + "() needs a timestamp column"));
                String function = aggregation.getFunction() == AggregationFunction.EARLIEST
                    ? "argMin" : "argMax";
                yield function + "(" + expr + ", " + timestamp + ")";
            }
        };
    }

    private SelectLayer top(SelectLayer layer, TopStage stage) {
        SelectLayer target = layer.isAggregated() || layer.isLimited() ? layer.wrap() : layer;
        OutputColumn column = target.resolve(stage.getField());
        String count = "count()";
        target.aggregate(List.of(column.getExpression()), List.of(
            new OutputColumn(stage.getField(), column.getExpression(), column.getType(), null),
            new OutputColumn(TopStage.COUNT_COLUMN, count, FieldType.INTEGER, null)));
        SortDirection direction = stage.isRare() ? SortDirection.ASC : SortDirection.DESC;
        target.setOrderBy(List.of(
            new OrderItem(TopStage.COUNT_COLUMN, count, direction),
            new OrderItem(stage.getField(), column.getExpression(), SortDirection.ASC)));
        target.applyLimit(stage.getLimit());
        return target;
    }

    private SelectLayer sort(SelectLayer layer, SortStage stage) {
        SelectLayer target = layer.isLimited() ? layer.wrap() : layer;
        List<OrderItem> order = new ArrayList<>();
        for (SortKey key : stage.getKeys()) {
            order.add(new OrderItem(key.getField(), target.resolve(key.getField()).getExpression(), key.getDirection()));
        }
        target.setOrderBy(order);
        return target;
    }

    private SelectLayer limit(SelectLayer layer, LimitStage stage) {
        if (layer.isEventRows()) {
            orderNewestFirst(layer);
        }
        layer.applyLimit(stage.getLimit());
        return layer;
    }

    /**
     * Event rows without an explicit sort are ordered newest first.
     */
    private static void orderNewestFirst(SelectLayer layer) {
        if (layer.getOrderBy().isEmpty()) {
            OutputColumn timestamp = layer.eventColumn(TIMESTAMP_FIELD);
            if (timestamp != null) {
                layer.setOrderBy(List.of(new OrderItem(TIMESTAMP_FIELD, timestamp.getExpression(), SortDirection.DESC)));
            }
        }
    }

    private SelectLayer table(SelectLayer layer, TableStage stage) {
        List<OutputColumn> view = new ArrayList<>();
        if (stage.isExclude()) {
            Set<String> excluded = new HashSet<>(stage.getColumns());
            for (OutputColumn column : layer.getView()) {
                if (!excluded.contains(column.getName())) {
                    view.add(column);
                }
            }
        } else {
            for (String name : stage.getColumns()) {
                for (OutputColumn column : layer.getView()) {
                    if (column.getName().equals(name)) {
                        view.add(column);
                    }
                }
            }
        }
        layer.setView(view);
        return layer;
    }

    private SelectLayer dedup(SelectLayer layer, DedupStage stage) {
        SelectLayer windowed = layer.isLimited() ? layer.wrap() : layer;
        List<String> partition = new ArrayList<>();
        for (String key : stage.getKeys()) {
            partition.add(windowed.resolve(key).getExpression());
        }
        StringBuilder window = new StringBuilder("ROW_NUMBER() OVER (PARTITION BY ")
            .append(String.join(", ", partition));
        timestampExpression(windowed).ifPresent(ts -> window.append(" ORDER BY ").append(ts).append(" DESC"));
        window.append(") AS ").append(DEDUP_RANK);
        windowed.addExtraSelect(window.toString());

        SelectLayer outer = windowed.wrap();
        outer.addWhere(SqlFragment.of(DEDUP_RANK + " = 1"));
        return outer;
    }

    private SelectLayer rename(SelectLayer layer, RenameStage stage) {
        Map<String, String> renames = new HashMap<>();
        for (RenamePair pair : stage.getPairs()) {
            renames.put(pair.getFrom(), pair.getTo());
        }
        List<OutputColumn> view = new ArrayList<>();
        for (OutputColumn column : layer.getView()) {
            String target = renames.get(column.getName());
            view.add(target == null ? column : column.renamed(target));
        }
        List<OrderItem> order = new ArrayList<>();
        for (OrderItem item : layer.getOrderBy()) {
            String target = renames.get(item.getName());
            order.add(target == null ? item : item.renamed(target));
        }
        layer.setView(view);
        layer.setOrderBy(order);
        return layer;
    }

    /**
     * The event time in this layer: the event field while rows are events,
     * otherwise a result column named timestamp if one survived.
     */
    private static Optional<String> timestampExpression(SelectLayer layer) {
        if (layer.isEventRows()) {
            OutputColumn column = layer.eventColumn(TIMESTAMP_FIELD);
            return Optional.ofNullable(column).map(OutputColumn::getExpression);
        }
        return Optional.ofNullable(layer.resolve(TIMESTAMP_FIELD))
            .filter(column -> column.getType() == FieldType.TIMESTAMP)
            .map(OutputColumn::getExpression);
    }
}
