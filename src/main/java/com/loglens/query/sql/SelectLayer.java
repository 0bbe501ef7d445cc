package com.loglens.query.sql;

import com.loglens.fields.FieldCatalog;
import com.loglens.fields.FieldDefinition;
import com.loglens.fields.FieldType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One SELECT level of the statement being generated.
 *
 * A layer reads either the event table or the layer it wraps. While rows are
 * still events the layer keeps every event field reachable through
 * {@link #getEventColumns()}, even fields the current projection has dropped,
 * so later conditions can still use them. The projection itself
 * ({@link #getView()}) is only rendered by the outermost layer.
 */
final class SelectLayer {

    private final String table;
    private final SelectLayer inner;
    private final Set<String> sourceNames;

    private List<OutputColumn> view;
    private Map<String, OutputColumn> eventColumns;
    private final List<SqlFragment> where = new ArrayList<>();
    private final List<String> groupBy = new ArrayList<>();
    private final List<String> extraSelect = new ArrayList<>();
    private List<OrderItem> orderBy = new ArrayList<>();
    private Long limit;
    private boolean aggregated;

    private SelectLayer(String table, SelectLayer inner, Set<String> sourceNames,
                        List<OutputColumn> view, Map<String, OutputColumn> eventColumns) {
        this.table = table;
        this.inner = inner;
        this.sourceNames = sourceNames;
        this.view = view;
        this.eventColumns = eventColumns;
    }

    /**
     * Innermost layer reading the event table, projecting every catalog field.
     */
    static SelectLayer base(String table, FieldCatalog catalog) {
        Map<String, OutputColumn> events = new LinkedHashMap<>();
        Set<String> sourceNames = new LinkedHashSet<>();
        sourceNames.add("structured_data");
        for (FieldDefinition field : catalog.allFields()) {
            events.put(field.getName(), new OutputColumn(
                field.getName(), field.getStorageExpression(), field.getType(), field.getName()));
            if (field.getStorageExpression().equals(field.getName())) {
                sourceNames.add(field.getName());
            }
        }
        return new SelectLayer(table, null, sourceNames, new ArrayList<>(events.values()), events);
    }

    /**
     * New layer selecting from this one. Ordering moves outward; the inner
     * layer keeps its ORDER BY only when a LIMIT depends on it.
     */
    SelectLayer wrap() {
        Set<String> names = new LinkedHashSet<>();
        List<OutputColumn> outerView = new ArrayList<>();
        Map<String, OutputColumn> outerEvents = new LinkedHashMap<>();
        if (isEventRows()) {
            for (OutputColumn column : eventColumns.values()) {
                String name = column.getName();
                names.add(name);
                outerEvents.put(name, new OutputColumn(name, SqlQuoting.quoteIdentifier(name), column.getType(), name));
            }
            for (OutputColumn column : view) {
                outerView.add(new OutputColumn(column.getName(),
                    SqlQuoting.quoteIdentifier(column.getEventField()), column.getType(), column.getEventField()));
            }
        } else {
            for (OutputColumn column : view) {
                names.add(column.getName());
                outerView.add(new OutputColumn(column.getName(),
                    SqlQuoting.quoteIdentifier(column.getName()), column.getType(), null));
            }
        }
        for (String item : extraSelect) {
            names.add(item.substring(item.lastIndexOf(' ') + 1));
        }

        SelectLayer outer = new SelectLayer(null, this, names, outerView, outerEvents);
        for (OrderItem item : orderBy) {
            OutputColumn column = outer.resolve(item.getName());
            if (column != null) {
                outer.orderBy.add(new OrderItem(item.getName(), column.getExpression(), item.getDirection()));
            }
        }
        if (limit == null) {
            orderBy = new ArrayList<>();
        }
        return outer;
    }

    /**
     * Column by result name, falling back to a hidden event field.
     */
    OutputColumn resolve(String name) {
        for (OutputColumn column : view) {
            if (column.getName().equals(name)) {
                return column;
            }
        }
        return eventColumns.get(name);
    }

    OutputColumn eventColumn(String name) {
        return eventColumns.get(name);
    }

    boolean isEventRows() {
        return !aggregated && !eventColumns.isEmpty();
    }

    boolean isAggregated() {
        return aggregated;
    }

    boolean isLimited() {
        return limit != null;
    }

    List<OutputColumn> getView() {
        return view;
    }

    Map<String, OutputColumn> getEventColumns() {
        return eventColumns;
    }

    List<OrderItem> getOrderBy() {
        return orderBy;
    }

    Long getLimit() {
        return limit;
    }

    void setView(List<OutputColumn> view) {
        this.view = new ArrayList<>(view);
    }

    void setOrderBy(List<OrderItem> orderBy) {
        this.orderBy = new ArrayList<>(orderBy);
    }

    /**
     * Recompute a column in place. While rows are events the event field it
     * carries is recomputed too, so the new value survives wrapping.
     */
    void replaceColumn(String name, String expression, FieldType type) {
        String eventField = null;
        List<OutputColumn> replaced = new ArrayList<>();
        for (OutputColumn column : view) {
            if (column.getName().equals(name)) {
                eventField = column.getEventField();
                replaced.add(new OutputColumn(name, expression, type, eventField));
            } else {
                replaced.add(column);
            }
        }
        view = replaced;
        if (isEventRows() && eventField != null) {
            eventColumns.put(eventField, new OutputColumn(eventField, expression, type, eventField));
        }
    }

    /**
     * Append a computed column. While rows are events it also becomes an
     * event field of this layer.
     */
    void addColumn(String name, String expression, FieldType type) {
        if (isEventRows()) {
            OutputColumn column = new OutputColumn(name, expression, type, name);
            eventColumns.put(name, column);
            view.add(column);
        } else {
            view.add(new OutputColumn(name, expression, type, null));
        }
    }

    void addWhere(SqlFragment condition) {
        where.add(condition);
    }

    void addExtraSelect(String item) {
        extraSelect.add(item);
    }

    void applyLimit(long n) {
        limit = limit == null ? n : Math.min(limit, n);
    }

    /**
     * Turn this layer into a GROUP BY layer producing the given columns.
     */
    void aggregate(List<String> groupExpressions, List<OutputColumn> columns) {
        groupBy.clear();
        groupBy.addAll(groupExpressions);
        view = new ArrayList<>(columns);
        eventColumns = new LinkedHashMap<>();
        orderBy = new ArrayList<>();
        aggregated = true;
    }

    SqlFragment render(boolean outermost) {
        List<String> items = new ArrayList<>();
        if (outermost || !isEventRows()) {
            for (OutputColumn column : view) {
                items.add(column.selectItem());
            }
        } else {
            for (OutputColumn column : eventColumns.values()) {
                items.add(column.selectItem());
            }
        }
        if (!outermost) {
            items.addAll(extraSelect);
        }

        List<SqlFragment> parts = new ArrayList<>();
        parts.add(SqlFragment.of("SELECT " + String.join(", ", items) + " FROM"));
        parts.add(inner == null ? SqlFragment.of(table) : inner.render(false).wrap("(", ")"));
        if (!where.isEmpty()) {
            parts.add(SqlFragment.join(where, " AND ").wrap("WHERE ", ""));
        }
        if (!groupBy.isEmpty()) {
            parts.add(SqlFragment.of("GROUP BY " + String.join(", ", groupBy)));
        }
        if (!orderBy.isEmpty()) {
            List<String> order = new ArrayList<>();
            for (OrderItem item : orderBy) {
                order.add(item.render());
            }
            parts.add(SqlFragment.of("ORDER BY " + String.join(", ", order)));
        }
        if (limit != null) {
            parts.add(SqlFragment.of("LIMIT " + limit));
        }
        return SqlFragment.join(parts, " ");
    }

    /**
     * True if some layer selects an alias that hides a column of its source
     * under the same name; ClickHouse would otherwise resolve WHERE and
     * ORDER BY references to the alias.
     */
    boolean hasShadowingAlias(boolean outermost) {
        List<OutputColumn> selected = outermost || !isEventRows()
            ? view : new ArrayList<>(eventColumns.values());
        for (OutputColumn column : selected) {
            if (column.isAliased() && sourceNames.contains(column.getName())) {
                return true;
            }
        }
        return inner != null && inner.hasShadowingAlias(false);
    }
}
