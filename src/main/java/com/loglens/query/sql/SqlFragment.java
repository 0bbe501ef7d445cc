package com.loglens.query.sql;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A piece of SQL together with the values of its {@code ?} placeholders, in
 * the order the placeholders appear in the text.
 */
public final class SqlFragment {

    private final String sql;
    private final List<Object> parameters;

    public SqlFragment(String sql, List<Object> parameters) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlFragment of(String sql, Object... parameters) {
        return new SqlFragment(sql, Arrays.asList(parameters));
    }

    /**
     * Concatenate fragments with a separator, keeping parameter order.
     */
    public static SqlFragment join(List<SqlFragment> fragments, String separator) {
        StringBuilder sb = new StringBuilder();
        List<Object> parameters = new ArrayList<>();
        for (SqlFragment fragment : fragments) {
            if (sb.length() > 0) {
                sb.append(separator);
            }
            sb.append(fragment.sql);
            parameters.addAll(fragment.parameters);
        }
        return new SqlFragment(sb.toString(), parameters);
    }

    public SqlFragment wrap(String prefix, String suffix) {
        return new SqlFragment(prefix + sql + suffix, parameters);
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParameters() {
        return parameters;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SqlFragment)) return false;
        SqlFragment that = (SqlFragment) o;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
