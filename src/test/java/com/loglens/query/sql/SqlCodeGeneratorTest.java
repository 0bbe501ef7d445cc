package com.loglens.query.sql;

import com.loglens.fields.DiscoveredField;
import com.loglens.fields.FieldCatalog;
import com.loglens.fields.FieldType;
import com.loglens.query.MalformedStageException;
import com.loglens.query.TimeBounds;
import com.loglens.query.TypeMismatchException;
import com.loglens.query.ast.Query;
import com.loglens.query.parser.QueryParser;
import com.loglens.query.variable.VariableBindings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SqlCodeGenerator Tests")
class SqlCodeGeneratorTest {

    private static final String COLUMNS = "timestamp, hostname, app_name, severity, facility, priority, "
        + "message, raw, index_name, protocol, source_ip, source_port";
    private static final String TABLE = "loglens.logs";

    private QueryParser parser;
    private SqlCodeGenerator generator;
    private FieldCatalog catalog;

    @BeforeEach
    void setUp() {
        parser = new QueryParser();
        generator = new SqlCodeGenerator(TABLE, 1000);
        catalog = FieldCatalog.builtIn();
    }

    private CompiledQuery compile(String text) {
        return compile(text, VariableBindings.empty(), null);
    }

    private CompiledQuery compile(String text, VariableBindings bindings, TimeBounds bounds) {
        Query query = parser.parse(text, bindings, catalog);
        return generator.generate(query, catalog, bounds);
    }

    // ========== Event searches ==========

    @Test
    @DisplayName("Wildcard value should become a LIKE pattern with default ordering and limit")
    void shouldGenerateLikeForWildcardValue() {
        CompiledQuery compiled = compile("hostname=web*");

        assertThat(compiled.getSql()).isEqualTo(
            "SELECT " + COLUMNS + " FROM loglens.logs WHERE hostname LIKE ? ORDER BY timestamp DESC LIMIT 1000");
        assertThat(compiled.getParameters()).containsExactly("web%");
    }

    @Test
    void shouldCompileAliasesToTheSameStatement() {
        assertThat(compile("host=web*")).isEqualTo(compile("hostname=web*"));
        assertThat(compile("* | stats count by host")).isEqualTo(compile("* | stats count by hostname"));
    }

    @Test
    void shouldBeDeterministic() {
        String text = "error host=web* | where severity<=3 | stats count, avg(severity) by app | sort -count";

        assertThat(compile(text)).isEqualTo(compile(text));
    }

    @Test
    void shouldBindBareTermsAgainstRaw() {
        CompiledQuery compiled = compile("error");

        assertThat(compiled.getSql()).contains("WHERE positionCaseInsensitive(raw, ?) > 0");
        assertThat(compiled.getParameters()).containsExactly("error");
    }

    @Test
    void shouldTranslateSeverityNamesToNumbers() {
        CompiledQuery compiled = compile("severity<=error");

        assertThat(compiled.getSql()).contains("WHERE severity <= ?");
        assertThat(compiled.getParameters()).containsExactly(3L);
    }

    @Test
    void shouldRejectTextAgainstNumericField() {
        assertThatThrownBy(() -> compile("facility=abc"))
            .isInstanceOf(TypeMismatchException.class)
            .hasMessageContaining("is not a number");
    }

    // ========== IP columns ==========

    @Test
    void shouldCastIpColumnForPatternMatches() {
        CompiledQuery like = compile("src_ip=10.0.*");
        CompiledQuery regex = compile("src_ip=/^10\\.0\\./");

        assertThat(like.getSql()).contains("WHERE toString(source_ip) LIKE ?");
        assertThat(like.getParameters()).containsExactly("10.0.%");
        assertThat(regex.getSql()).contains("WHERE match(toString(source_ip), ?)");
    }

    @Test
    void shouldCheckIpPresenceAgainstUnsetAddress() {
        assertThat(compile("src_ip=*").getSql()).contains("WHERE source_ip != toIPv4('0.0.0.0')");
        assertThat(compile("src_ip!=*").getSql()).contains("WHERE source_ip = toIPv4('0.0.0.0')");
    }

    @Test
    void shouldCompareIpColumnDirectlyForExactValues() {
        CompiledQuery compiled = compile("src_ip=10.0.0.1");

        assertThat(compiled.getSql()).contains("WHERE source_ip = ?");
        assertThat(compiled.getParameters()).containsExactly("10.0.0.1");
    }

    @Test
    void shouldCompileUnknownFieldToFalseCondition() {
        CompiledQuery compiled = compile("nosuchfield=1");

        assertThat(compiled.getSql()).contains("WHERE 1 = 0");
        assertThat(compiled.getParameters()).isEmpty();
    }

    @Test
    void shouldReadDiscoveredFieldsFromStructuredData() {
        catalog = FieldCatalog.withDiscovered(3L, List.of(
            new DiscoveredField("user", FieldType.STRING, 4, List.of())));

        CompiledQuery compiled = compile("user=alice");

        assertThat(compiled.getSql())
            .contains("JSONExtractString(structured_data, 'user') AS user FROM loglens.logs")
            .contains("WHERE JSONExtractString(structured_data, 'user') = ?");
        assertThat(compiled.getParameters()).containsExactly("alice");
    }

    @Test
    @DisplayName("Multi-value variable should become an IN list with one placeholder per value")
    void shouldExpandMultiValueVariable() {
        VariableBindings bindings = VariableBindings.ofValues(Map.of("hosts", List.of("web-01", "web-02")));

        CompiledQuery compiled = compile("hostname=$hosts$", bindings, null);

        assertThat(compiled.getSql()).contains("WHERE hostname IN (?, ?)");
        assertThat(compiled.getParameters()).containsExactly("web-01", "web-02");
    }

    @Test
    void shouldPutTimeBoundsFirst() {
        Instant earliest = Instant.parse("2024-03-01T00:00:00Z");
        Instant latest = Instant.parse("2024-03-02T00:00:00Z");

        CompiledQuery compiled = compile("hostname=db", VariableBindings.empty(), new TimeBounds(earliest, latest));

        assertThat(compiled.getSql()).contains("WHERE timestamp >= ? AND timestamp <= ? AND hostname = ?");
        assertThat(compiled.getParameters())
            .containsExactly(Timestamp.from(earliest), Timestamp.from(latest), "db");
    }

    @Test
    void shouldKeepTheSmallestLimit() {
        assertThat(compile("* | limit 10 | head 5").getSql()).endsWith("LIMIT 5");
        assertThat(compile("* | head 5 | limit 10").getSql()).endsWith("LIMIT 5");
    }

    @Test
    @DisplayName("head before a filter should keep the newest events, not arbitrary ones")
    void shouldOrderLimitedEventsBeforeWrapping() {
        CompiledQuery compiled = compile("* | head 5 | where host=a");

        assertThat(compiled.getSql()).isEqualTo("SELECT " + COLUMNS + " FROM (SELECT " + COLUMNS
            + " FROM loglens.logs ORDER BY timestamp DESC LIMIT 5) WHERE hostname = ? ORDER BY timestamp DESC LIMIT 1000");
    }

    // ========== Aggregations ==========

    @Test
    void shouldGenerateStatsWithSortAndLimit() {
        CompiledQuery compiled = compile("* | stats count by hostname | sort desc count | limit 10");

        assertThat(compiled.getSql()).isEqualTo(
            "SELECT hostname, count() AS count FROM loglens.logs GROUP BY hostname ORDER BY count() DESC LIMIT 10");
        assertThat(compiled.getParameters()).isEmpty();
    }

    @Test
    void shouldNotLimitAggregatedRowsByDefault() {
        CompiledQuery compiled = compile("* | stats dc(host) as hosts, values(app) by severity");

        assertThat(compiled.getSql()).isEqualTo("SELECT severity, uniqExact(hostname) AS hosts, "
            + "groupUniqArray(app_name) AS values_app FROM loglens.logs GROUP BY severity");
    }

    @Test
    void shouldWrapFilterAfterStats() {
        CompiledQuery compiled = compile("* | stats count by host | where count>5");

        assertThat(compiled.getSql()).isEqualTo("SELECT hostname, count FROM "
            + "(SELECT hostname, count() AS count FROM loglens.logs GROUP BY hostname) WHERE count > ?");
        assertThat(compiled.getParameters()).containsExactly(5L);
    }

    @Test
    void shouldUseArgMinForEarliest() {
        CompiledQuery compiled = compile("* | stats earliest(message) as first by host");

        assertThat(compiled.getSql())
            .isEqualTo("SELECT hostname, argMin(message, timestamp) AS first FROM loglens.logs GROUP BY hostname");
    }

    @Test
    void shouldRankTopValues() {
        CompiledQuery compiled = compile("* | top 5 app");

        assertThat(compiled.getSql()).isEqualTo("SELECT app_name, count() AS count FROM loglens.logs "
            + "GROUP BY app_name ORDER BY count() DESC, app_name ASC LIMIT 5");
    }

    @Test
    void shouldRankRareValuesAscending() {
        assertThat(compile("* | rare app").getSql()).contains("ORDER BY count() ASC, app_name ASC");
    }

    // ========== Projection and windowing ==========

    @Test
    void shouldDeduplicateWithRowNumber() {
        CompiledQuery compiled = compile("* | dedup hostname");

        assertThat(compiled.getSql()).isEqualTo("SELECT " + COLUMNS + " FROM (SELECT " + COLUMNS
            + ", ROW_NUMBER() OVER (PARTITION BY hostname ORDER BY timestamp DESC) AS _dedup_rank"
            + " FROM loglens.logs) WHERE _dedup_rank = 1 ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    void shouldProjectTableColumns() {
        CompiledQuery compiled = compile("* | table host message");

        assertThat(compiled.getSql())
            .isEqualTo("SELECT hostname, message FROM loglens.logs ORDER BY timestamp DESC LIMIT 1000");
        assertThat(compiled.getOutputSchema().getNames()).containsExactly("hostname", "message");
    }

    @Test
    void shouldFilterOnDroppedFieldAfterTable() {
        CompiledQuery compiled = compile("* | table host | where severity<3");

        assertThat(compiled.getSql())
            .isEqualTo("SELECT hostname FROM loglens.logs WHERE severity < ? ORDER BY timestamp DESC LIMIT 1000");
    }

    @Test
    @DisplayName("Swapping column names should keep conditions on the source columns")
    void shouldGuardAgainstAliasShadowing() {
        CompiledQuery compiled = compile("* | table host message | rename host as message, message as host");

        assertThat(compiled.getSql()).isEqualTo("SELECT hostname AS message, message AS host FROM loglens.logs "
            + "ORDER BY timestamp DESC LIMIT 1000 SETTINGS prefer_column_name_to_alias = 1");
        assertThat(compiled.getOutputSchema().getNames()).containsExactly("message", "host");
    }

    @Test
    void shouldRejectInvalidTableName() {
        assertThatThrownBy(() -> new SqlCodeGenerator("logs; drop", 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Time buckets and tail ==========

    @Test
    void shouldBucketTimechartBySpanAndSplitField() {
        CompiledQuery compiled = compile("* | timechart span=5m count by host");
        String bucket = "toStartOfInterval(timestamp, INTERVAL 5 MINUTE)";

        assertThat(compiled.getSql()).isEqualTo("SELECT " + bucket + " AS _time, hostname, count() AS count"
            + " FROM loglens.logs GROUP BY " + bucket + ", hostname ORDER BY " + bucket + " ASC, hostname ASC");
        assertThat(compiled.getOutputSchema().getNames()).containsExactly("_time", "hostname", "count");
    }

    @Test
    void shouldUseHourlyBucketsByDefault() {
        String bucket = "toStartOfInterval(timestamp, INTERVAL 1 HOUR)";

        assertThat(compile("* | timechart count").getSql()).isEqualTo("SELECT " + bucket
            + " AS _time, count() AS count FROM loglens.logs GROUP BY " + bucket + " ORDER BY " + bucket + " ASC");
    }

    @Test
    void shouldWrapTimechartAfterHead() {
        CompiledQuery compiled = compile("* | head 100 | timechart span=1m count");

        assertThat(compiled.getSql()).startsWith("SELECT toStartOfInterval(timestamp, INTERVAL 1 MINUTE) AS _time")
            .contains("FROM (SELECT " + COLUMNS + " FROM loglens.logs ORDER BY timestamp DESC LIMIT 100)")
            .endsWith("ORDER BY toStartOfInterval(timestamp, INTERVAL 1 MINUTE) ASC");
    }

    @Test
    void shouldBinNumericFieldIntoNewColumn() {
        CompiledQuery compiled = compile("* | bin span=10 severity as sev_bucket | stats count by sev_bucket");

        assertThat(compiled.getSql()).isEqualTo("SELECT floor(severity / 10) * 10 AS sev_bucket, count() AS count"
            + " FROM loglens.logs GROUP BY floor(severity / 10) * 10");
    }

    @Test
    @DisplayName("Binning timestamp in place should also change the default ordering")
    void shouldBinTimestampInPlace() {
        CompiledQuery compiled = compile("* | bin span=1h timestamp");
        String bucket = "toStartOfInterval(timestamp, INTERVAL 1 HOUR)";

        assertThat(compiled.getSql()).isEqualTo("SELECT " + bucket + " AS timestamp, "
            + COLUMNS.substring("timestamp, ".length()) + " FROM loglens.logs ORDER BY " + bucket
            + " DESC LIMIT 1000 SETTINGS prefer_column_name_to_alias = 1");
    }

    @Test
    void shouldTailEventsOldestFirst() {
        assertThat(compile("* | tail 5").getSql())
            .isEqualTo("SELECT " + COLUMNS + " FROM loglens.logs ORDER BY timestamp ASC LIMIT 5");
    }

    @Test
    void shouldTailTheLastRowsOfAnEarlierHead() {
        assertThat(compile("* | head 20 | tail 5").getSql()).isEqualTo("SELECT " + COLUMNS + " FROM (SELECT "
            + COLUMNS + " FROM loglens.logs ORDER BY timestamp DESC LIMIT 20) ORDER BY timestamp ASC LIMIT 5");
    }

    @Test
    void shouldReverseExplicitSortForTail() {
        assertThat(compile("* | stats count by host | sort -count | tail 3").getSql()).isEqualTo(
            "SELECT hostname, count() AS count FROM loglens.logs GROUP BY hostname ORDER BY count() ASC LIMIT 3");
    }

    @Test
    void shouldRejectTailOfUnsortedAggregation() {
        assertThatThrownBy(() -> compile("* | stats count by host | tail 3"))
            .isInstanceOf(MalformedStageException.class)
            .hasMessageContaining("needs an earlier sort");
    }
}
