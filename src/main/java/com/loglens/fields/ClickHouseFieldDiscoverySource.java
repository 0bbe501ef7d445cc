package com.loglens.fields;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Array;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Discovers structured-data keys by scanning recent events in ClickHouse.
 */
@Component
public class ClickHouseFieldDiscoverySource implements FieldDiscoverySource {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseFieldDiscoverySource.class);

    private static final String KEY_SCAN_SQL =
        "SELECT arrayJoin(JSONExtractKeys(structured_data)) AS name, count() AS occurrences "
            + "FROM %s "
            + "WHERE structured_data != '{}' AND length(structured_data) > 2 "
            + "AND timestamp >= now() - INTERVAL ? SECOND "
            + "GROUP BY name ORDER BY occurrences DESC LIMIT ?";

    private static final String KEY_DETAIL_SQL =
        "SELECT any(JSONType(structured_data, ?)) AS json_type, "
            + "groupUniqArray(5)(JSONExtractString(structured_data, ?)) AS samples "
            + "FROM %s "
            + "WHERE JSONHas(structured_data, ?) AND timestamp >= now() - INTERVAL ? SECOND";

    private final JdbcTemplate jdbcTemplate;
    private final String table;

    public ClickHouseFieldDiscoverySource(
            @Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate,
            @Value("${loglens.query.table:loglens.logs}") String table) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
    }

    @Override
    public List<DiscoveredField> discover(Duration lookback, int limit) {
        long seconds = lookback.getSeconds();
        List<Map<String, Object>> keys = jdbcTemplate.queryForList(
            String.format(KEY_SCAN_SQL, table), seconds, limit);

        List<DiscoveredField> fields = new ArrayList<>(keys.size());
        for (Map<String, Object> row : keys) {
            String name = String.valueOf(row.get("name"));
            long occurrences = ((Number) row.get("occurrences")).longValue();
            fields.add(describe(name, occurrences, seconds));
        }
        log.debug("Discovered {} structured-data keys over the last {}s", fields.size(), seconds);
        return fields;
    }

    private DiscoveredField describe(String name, long occurrences, long seconds) {
        Map<String, Object> detail = jdbcTemplate.queryForMap(
            String.format(KEY_DETAIL_SQL, table), name, name, name, seconds);
        FieldType type = FieldType.fromJsonType((String) detail.get("json_type"));
        return new DiscoveredField(name, type, occurrences, toStrings(detail.get("samples")));
    }

    private static List<String> toStrings(Object samples) {
        List<String> values = new ArrayList<>();
        if (samples instanceof Array) {
            try {
                Object[] array = (Object[]) ((Array) samples).getArray();
                for (Object value : array) {
                    values.add(String.valueOf(value));
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Failed to read sample values", e);
            }
        } else if (samples instanceof Object[]) {
            for (Object value : (Object[]) samples) {
                values.add(String.valueOf(value));
            }
        } else if (samples instanceof List) {
            for (Object value : (List<?>) samples) {
                values.add(String.valueOf(value));
            }
        }
        return values;
    }
}
