package com.loglens.query.schema;

import com.loglens.fields.FieldCatalog;
import com.loglens.fields.FieldDefinition;
import com.loglens.fields.FieldType;
import com.loglens.query.CompileWarning;
import com.loglens.query.MalformedStageException;
import com.loglens.query.TypeMismatchException;
import com.loglens.query.UnresolvedFieldException;
import com.loglens.query.ast.Aggregation;
import com.loglens.query.ast.BareTermExpression;
import com.loglens.query.ast.BinStage;
import com.loglens.query.ast.BinaryExpression;
import com.loglens.query.ast.ComparisonExpression;
import com.loglens.query.ast.DedupStage;
import com.loglens.query.ast.Expression;
import com.loglens.query.ast.InListExpression;
import com.loglens.query.ast.LimitStage;
import com.loglens.query.ast.MatchNoneExpression;
import com.loglens.query.ast.NotExpression;
import com.loglens.query.ast.PredicateStage;
import com.loglens.query.ast.RenamePair;
import com.loglens.query.ast.RenameStage;
import com.loglens.query.ast.SortKey;
import com.loglens.query.ast.SortStage;
import com.loglens.query.ast.Stage;
import com.loglens.query.ast.StatsStage;
import com.loglens.query.ast.TableStage;
import com.loglens.query.ast.TailStage;
import com.loglens.query.ast.TimechartStage;
import com.loglens.query.ast.TopStage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Propagates the result schema through the pipeline one stage at a time.
 *
 * {@link #apply(Stage)} validates a freshly parsed stage against the schema
 * it receives, returns the stage with every field reference rewritten to the
 * resolved column name, and advances the schema. Field references outside
 * predicates must name a current column; predicate references may also reach
 * event fields while rows are still events, and anything unresolvable there
 * becomes a never-matching condition plus a warning.
 */
public class SchemaTracker {

    private static final String TIMESTAMP_FIELD = "timestamp";

    private final FieldCatalog catalog;
    private final List<CompileWarning> warnings = new ArrayList<>();
    private Schema schema;

    public SchemaTracker(FieldCatalog catalog) {
        this.catalog = catalog;
        this.schema = Schema.fromCatalog(catalog);
    }

    public Schema getSchema() {
        return schema;
    }

    public List<CompileWarning> getWarnings() {
        return List.copyOf(warnings);
    }

    public Stage apply(Stage stage) {
        return switch (stage.getKind()) {
            case SEARCH, FILTER -> applyPredicate((PredicateStage) stage);
            case STATS -> applyStats((StatsStage) stage);
            case SORT -> applySort((SortStage) stage);
            case LIMIT -> (LimitStage) stage;
            case TABLE -> applyTable((TableStage) stage);
            case DEDUP -> applyDedup((DedupStage) stage);
            case RENAME -> applyRename((RenameStage) stage);
            case TOP -> applyTop((TopStage) stage);
            case TIMECHART -> applyTimechart((TimechartStage) stage);
            case BIN -> applyBin((BinStage) stage);
            case TAIL -> (TailStage) stage;
        };
    }

    private Stage applyPredicate(PredicateStage stage) {
        return stage.withExpression(resolveExpression(stage.getExpression(), stage.getIndex()));
    }

    private Expression resolveExpression(Expression expression, int stageIndex) {
        switch (expression.getKind()) {
            case COMPARISON: {
                ComparisonExpression comparison = (ComparisonExpression) expression;
                Optional<String> column = resolveSoft(comparison.getField());
                if (column.isPresent()) {
                    return comparison.withField(column.get());
                }
                return unresolved(comparison.getField(), stageIndex);
            }
            case IN_LIST: {
                InListExpression inList = (InListExpression) expression;
                Optional<String> column = resolveSoft(inList.getField());
                if (column.isPresent()) {
                    return inList.withField(column.get());
                }
                return unresolved(inList.getField(), stageIndex);
            }
            case BARE_TERM: {
                if (schema.isEventRows()) {
                    return expression;
                }
                warnings.add(new CompileWarning(stageIndex, null,
                    "Full-text term " + ((BareTermExpression) expression).getTerm()
                        + " needs event rows and never matches after aggregation"));
                return new MatchNoneExpression(null);
            }
            case BINARY: {
                BinaryExpression binary = (BinaryExpression) expression;
                return new BinaryExpression(binary.getOperator(),
                    resolveExpression(binary.getLeft(), stageIndex),
                    resolveExpression(binary.getRight(), stageIndex));
            }
            case NOT:
                return new NotExpression(resolveExpression(((NotExpression) expression).getOperand(), stageIndex));
            case MATCH_ALL:
            case MATCH_NONE:
                return expression;
            default:
                throw new IllegalStateException("Unbound variable reached schema validation: " + expression);
        }
    }

    private Expression unresolved(String field, int stageIndex) {
        warnings.add(new CompileWarning(stageIndex, field,
            "Unknown field '" + field + "'; the condition never matches"));
        return new MatchNoneExpression(field);
    }

    private Stage applyStats(StatsStage stage) {
        int index = stage.getIndex();
        List<Column> output = new ArrayList<>();
        Set<String> names = new HashSet<>();

        List<String> groupBy = new ArrayList<>();
        for (String field : stage.getGroupBy()) {
            Column column = resolveHard(field, index);
            if (!names.add(column.getName())) {
                throw new MalformedStageException(index, "stats", "duplicate group-by field '" + field + "'");
            }
            groupBy.add(column.getName());
            output.add(column);
        }

        List<Aggregation> aggregations = resolveAggregations(stage.getAggregations(), index, "stats", names, output);
        schema = new Schema(output, false);
        return new StatsStage(index, aggregations, groupBy);
    }

    private List<Aggregation> resolveAggregations(List<Aggregation> requested, int index, String command,
                                                  Set<String> names, List<Column> output) {
        List<Aggregation> aggregations = new ArrayList<>();
        for (Aggregation aggregation : requested) {
            FieldType sourceType = null;
            Aggregation resolved = aggregation;
            if (aggregation.getField() != null) {
                Column source = resolveHard(aggregation.getField(), index);
                sourceType = source.getType();
                if (!aggregation.getFunction().accepts(sourceType)) {
                    throw new TypeMismatchException(index, source.getName(),
                        aggregation.getFunction().getKeyword() + "(" + aggregation.getField()
                            + ") needs " + aggregation.getFunction().expectedInput() + " but '"
                            + source.getName() + "' is " + sourceType.getLabel());
                }
                resolved = aggregation.withField(source.getName());
            }
            if (!names.add(resolved.getAlias())) {
                throw new MalformedStageException(index, command,
                    "duplicate output column '" + resolved.getAlias() + "'");
            }
            aggregations.add(resolved);
            output.add(new Column(resolved.getAlias(), resolved.getFunction().outputType(sourceType)));
        }
        return aggregations;
    }

    private Stage applyTimechart(TimechartStage stage) {
        int index = stage.getIndex();
        if (!hasEventTime()) {
            throw new MalformedStageException(index, "timechart",
                "needs event rows or a '" + TIMESTAMP_FIELD + "' column");
        }
        List<Column> output = new ArrayList<>();
        Set<String> names = new HashSet<>();
        output.add(new Column(TimechartStage.TIME_COLUMN, FieldType.TIMESTAMP));
        names.add(TimechartStage.TIME_COLUMN);

        String splitBy = null;
        if (stage.getSplitBy() != null) {
            Column column = resolveHard(stage.getSplitBy(), index);
            if (!names.add(column.getName())) {
                throw new MalformedStageException(index, "timechart", "cannot split by '" + column.getName() + "'");
            }
            splitBy = column.getName();
            output.add(column);
        }

        List<Aggregation> aggregations = resolveAggregations(stage.getAggregations(), index, "timechart", names, output);
        schema = new Schema(output, false);
        return new TimechartStage(index, stage.getSpan(), aggregations, splitBy);
    }

    private boolean hasEventTime() {
        if (schema.isEventRows()) {
            return catalog.find(TIMESTAMP_FIELD).isPresent();
        }
        return schema.find(TIMESTAMP_FIELD).filter(c -> c.getType() == FieldType.TIMESTAMP).isPresent();
    }

    private Stage applyBin(BinStage stage) {
        int index = stage.getIndex();
        Column source = resolveHard(stage.getField(), index);
        FieldType type;
        if (stage.getSpan().isTime()) {
            if (source.getType() != FieldType.TIMESTAMP) {
                throw new TypeMismatchException(index, source.getName(),
                    "time span " + stage.getSpan() + " needs a timestamp field but '" + source.getName()
                        + "' is " + source.getType().getLabel());
            }
            type = FieldType.TIMESTAMP;
        } else {
            if (!source.getType().isNumeric()) {
                throw new TypeMismatchException(index, source.getName(),
                    "numeric span " + stage.getSpan() + " needs a numeric field but '" + source.getName()
                        + "' is " + source.getType().getLabel());
            }
            type = FieldType.NUMBER;
        }

        String alias = stage.getAlias();
        if (alias != null && alias.equals(source.getName())) {
            alias = null;
        }
        List<Column> columns = new ArrayList<>();
        for (Column column : schema.getColumns()) {
            columns.add(alias == null && column.getName().equals(source.getName())
                ? new Column(column.getName(), type) : column);
        }
        if (alias != null) {
            if (schema.contains(alias)) {
                throw new MalformedStageException(index, "bin", "target '" + alias + "' collides with an existing column");
            }
            columns.add(new Column(alias, type));
        }
        schema = new Schema(columns, schema.isEventRows());
        return new BinStage(index, source.getName(), stage.getSpan(), alias);
    }

    private Stage applySort(SortStage stage) {
        List<SortKey> keys = new ArrayList<>();
        for (SortKey key : stage.getKeys()) {
            keys.add(new SortKey(resolveHard(key.getField(), stage.getIndex()).getName(), key.getDirection()));
        }
        return new SortStage(stage.getIndex(), keys);
    }

    private Stage applyTable(TableStage stage) {
        int index = stage.getIndex();
        Set<String> requested = new LinkedHashSet<>();
        for (String field : stage.getColumns()) {
            requested.add(resolveHard(field, index).getName());
        }

        List<Column> columns = new ArrayList<>();
        if (stage.isExclude()) {
            for (Column column : schema.getColumns()) {
                if (!requested.contains(column.getName())) {
                    columns.add(column);
                }
            }
            if (columns.isEmpty()) {
                throw new MalformedStageException(index, "fields", "every column would be removed");
            }
        } else {
            for (String name : requested) {
                columns.add(schema.find(name).orElseThrow());
            }
        }
        schema = new Schema(columns, schema.isEventRows());
        return new TableStage(index, new ArrayList<>(requested), stage.isExclude());
    }

    private Stage applyDedup(DedupStage stage) {
        List<String> keys = new ArrayList<>();
        for (String key : stage.getKeys()) {
            String name = resolveHard(key, stage.getIndex()).getName();
            if (!keys.contains(name)) {
                keys.add(name);
            }
        }
        return new DedupStage(stage.getIndex(), keys);
    }

    private Stage applyRename(RenameStage stage) {
        int index = stage.getIndex();
        Map<String, String> renames = new HashMap<>();
        Set<String> targets = new HashSet<>();
        List<RenamePair> resolved = new ArrayList<>();
        for (RenamePair pair : stage.getPairs()) {
            String from = resolveHard(pair.getFrom(), index).getName();
            if (renames.containsKey(from)) {
                throw new MalformedStageException(index, "rename", "'" + from + "' is renamed twice");
            }
            if (!targets.add(pair.getTo())) {
                throw new MalformedStageException(index, "rename", "two columns renamed to '" + pair.getTo() + "'");
            }
            renames.put(from, pair.getTo());
            resolved.add(new RenamePair(from, pair.getTo()));
        }
        for (RenamePair pair : resolved) {
            String target = pair.getTo();
            if (!target.equals(pair.getFrom()) && schema.contains(target) && !renames.containsKey(target)) {
                throw new MalformedStageException(index, "rename",
                    "target '" + target + "' collides with an existing column");
            }
        }

        List<Column> columns = new ArrayList<>();
        for (Column column : schema.getColumns()) {
            String target = renames.get(column.getName());
            columns.add(target == null ? column : column.renamed(target));
        }
        schema = new Schema(columns, schema.isEventRows());
        return new RenameStage(index, resolved);
    }

    private Stage applyTop(TopStage stage) {
        Column column = resolveHard(stage.getField(), stage.getIndex());
        if (TopStage.COUNT_COLUMN.equals(column.getName())) {
            throw new MalformedStageException(stage.getIndex(), stage.isRare() ? "rare" : "top",
                "cannot rank a column named '" + TopStage.COUNT_COLUMN + "'");
        }
        schema = new Schema(List.of(column, new Column(TopStage.COUNT_COLUMN, FieldType.INTEGER)), false);
        return new TopStage(stage.getIndex(), column.getName(), stage.getLimit(), stage.isRare());
    }

    /**
     * Resolve a reference that must name a current column.
     */
    private Column resolveHard(String name, int stageIndex) {
        Optional<Column> column = lookup(name);
        if (column.isPresent()) {
            return column.get();
        }
        String detail = catalog.find(name).isPresent()
            ? "not available after earlier stages"
            : "no such field";
        throw new UnresolvedFieldException(stageIndex, name, detail);
    }

    /**
     * Resolve a predicate reference; event fields stay reachable until rows
     * are aggregated.
     */
    private Optional<String> resolveSoft(String name) {
        Optional<Column> column = lookup(name);
        if (column.isPresent()) {
            return Optional.of(column.get().getName());
        }
        if (schema.isEventRows()) {
            return catalog.find(name).map(FieldDefinition::getName);
        }
        return Optional.empty();
    }

    private Optional<Column> lookup(String name) {
        Optional<Column> direct = schema.find(name);
        if (direct.isPresent()) {
            return direct;
        }
        return catalog.find(name)
            .map(FieldDefinition::getName)
            .filter(schema::contains)
            .flatMap(schema::find);
    }
}
