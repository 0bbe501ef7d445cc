package com.loglens.query.exec;

import com.loglens.query.sql.CompiledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes compiled queries through the ClickHouse JDBC driver.
 *
 * The statement timeout is set from the execution timeout, so a query
 * abandoned by the caller is also stopped on the server.
 */
@Component
public class ClickHouseExecutionAdapter implements ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseExecutionAdapter.class);

    private final JdbcTemplate clickHouseTemplate;

    public ClickHouseExecutionAdapter(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate clickHouseTemplate) {
        this.clickHouseTemplate = clickHouseTemplate;
    }

    @Override
    public Mono<List<Map<String, Object>>> execute(CompiledQuery query, Duration timeout) {
        return Mono.fromCallable(() -> run(query, timeout))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private List<Map<String, Object>> run(CompiledQuery query, Duration timeout) {
        log.debug("Executing ClickHouse query: {} with {} parameters", query.getSql(), query.getParameters().size());
        List<String> columnOrder = query.getOutputSchema().getNames();
        ResultSetExtractor<List<Map<String, Object>>> extractor = rs -> extractRows(rs, columnOrder);

        List<Map<String, Object>> rows = clickHouseTemplate.query(connection -> {
            PreparedStatement statement = connection.prepareStatement(query.getSql());
            statement.setQueryTimeout(timeoutSeconds(timeout));
            List<Object> parameters = query.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                statement.setObject(i + 1, parameters.get(i));
            }
            return statement;
        }, extractor);

        return rows == null ? new ArrayList<>() : rows;
    }

    /**
     * Whole seconds for {@link java.sql.Statement#setQueryTimeout}, rounded up,
     * at least 1 and at most {@link Integer#MAX_VALUE}.
     */
    static int timeoutSeconds(Duration timeout) {
        long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private static List<Map<String, Object>> extractRows(ResultSet rs, List<String> columnOrder) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();

        while (rs.next()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                values.put(metaData.getColumnLabel(i), convert(rs.getObject(i)));
            }
            rows.add(inSchemaOrder(values, columnOrder));
        }
        return rows;
    }

    /**
     * Output schema columns first, in order; anything else the store returned after them.
     */
    static Map<String, Object> inSchemaOrder(Map<String, Object> values, List<String> columnOrder) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String name : columnOrder) {
            if (values.containsKey(name)) {
                row.put(name, values.get(name));
            }
        }
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            row.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return row;
    }

    static Object convert(Object value) throws SQLException {
        if (value instanceof java.sql.Timestamp) {
            // ISO 8601
            return ((java.sql.Timestamp) value).toInstant().toString();
        } else if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        } else if (value instanceof LocalDateTime) {
            // DateTime columns are stored in UTC
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toString();
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant().toString();
        } else if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant().toString();
        } else if (value instanceof java.sql.Array) {
            return toList(((java.sql.Array) value).getArray());
        } else if (value instanceof Object[]) {
            return toList(value);
        }
        return value;
    }

    private static Object toList(Object array) throws SQLException {
        if (array instanceof Object[]) {
            List<Object> values = new ArrayList<>();
            for (Object element : Arrays.asList((Object[]) array)) {
                values.add(convert(element));
            }
            return values;
        }
        return array;
    }
}
