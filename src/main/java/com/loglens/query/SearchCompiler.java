package com.loglens.query;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.loglens.fields.FieldAliasTable;
import com.loglens.fields.FieldCatalog;
import com.loglens.query.ast.Query;
import com.loglens.query.lexer.QueryNormalizer;
import com.loglens.query.parser.QueryParser;
import com.loglens.query.sql.CompiledQuery;
import com.loglens.query.sql.SqlCodeGenerator;
import com.loglens.query.variable.VariableBindings;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Entry point of the search compiler.
 *
 * {@link #parse} and {@link #validate} share one code path, so a query that
 * validates is exactly a query that parses, with the same SQL.
 *
 * Parsed pipelines are cached by normalized text, variable bindings and
 * catalog version. SQL is generated on every call because the time range
 * is resolved against the clock each time.
 */
@Service
public class SearchCompiler {

    private static final Logger log = LoggerFactory.getLogger(SearchCompiler.class);

    private final FieldAliasTable aliasTable;
    private final QueryMetrics metrics;
    private final Clock clock;
    private final QueryParser parser;
    private final SqlCodeGenerator generator;

    /**
     * Caffeine cache of validated pipelines
     * - Key: normalized text, binding fingerprint, catalog version
     * - Records cache statistics for monitoring
     */
    private final Cache<String, Query> queryCache;

    public SearchCompiler(
            FieldAliasTable aliasTable,
            QueryMetrics metrics,
            Clock clock,
            @Value("${loglens.query.table:loglens.logs}") String table,
            @Value("${loglens.query.default-limit:1000}") long defaultLimit,
            @Value("${loglens.query.cache.max-size:1000}") long cacheMaxSize,
            @Value("${loglens.query.cache.ttl:PT5M}") Duration cacheTtl) {
        this.aliasTable = aliasTable;
        this.metrics = metrics;
        this.clock = clock;
        this.parser = new QueryParser();
        this.generator = new SqlCodeGenerator(table, defaultLimit);

        this.queryCache = Caffeine.newBuilder()
            .maximumSize(cacheMaxSize)
            .expireAfterWrite(cacheTtl)
            .recordStats()
            .build();

        log.info("SearchCompiler initialized for table {} (defaultLimit={}, cache maxSize={}, ttl={})",
            table, defaultLimit, cacheMaxSize, cacheTtl);
    }

    public ParseResult parse(String query, VariableBindings bindings) {
        return parse(query, bindings, TimeRange.unbounded());
    }

    /**
     * Compile a search into SQL.
     *
     * @throws QueryCompilationException on the first faulty stage or time bound
     */
    public ParseResult parse(String query, VariableBindings bindings, TimeRange timeRange) {
        VariableBindings effective = bindings == null ? VariableBindings.empty() : bindings;
        Timer.Sample sample = metrics.startCompileTimer();
        try {
            FieldCatalog catalog = aliasTable.snapshot();
            TimeBounds bounds = TimeRangeResolver.resolve(timeRange, clock.instant());
            Query parsed = parseCached(query, effective, catalog);
            CompiledQuery compiled = generator.generate(parsed, catalog, bounds);
            metrics.recordQueryCompiled();
            return new ParseResult(parsed, compiled, parsed.getWarnings());
        } catch (QueryCompilationException e) {
            log.debug("Query compilation failed ({}): {}", e.getCode(), e.getMessage());
            metrics.recordCompileError(e.getCode());
            throw e;
        } finally {
            metrics.recordCompileLatency(sample);
        }
    }

    public ValidationResult validate(String query, VariableBindings bindings) {
        return validate(query, bindings, TimeRange.unbounded());
    }

    /**
     * Run the compile path without executing anything. Never throws for
     * compile errors; they are reported in the result.
     */
    public ValidationResult validate(String query, VariableBindings bindings, TimeRange timeRange) {
        try {
            return ValidationResult.valid(parse(query, bindings, timeRange));
        } catch (QueryCompilationException e) {
            return ValidationResult.invalid(e);
        }
    }

    private Query parseCached(String query, VariableBindings bindings, FieldCatalog catalog) {
        String normalized = QueryNormalizer.normalize(query);
        String cacheKey = normalized.length() + ":" + normalized
            + '\u0000' + bindings.fingerprint()
            + '\u0000' + catalog.getVersion();

        Query cached = queryCache.getIfPresent(cacheKey);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        Query parsed = parser.parse(query, bindings, catalog);
        queryCache.put(cacheKey, parsed);
        log.debug("Parsed query into {} stages: {}", parsed.size(), parsed);
        return parsed;
    }

    /**
     * Drop all cached pipelines.
     */
    public void invalidateCache() {
        queryCache.invalidateAll();
        log.info("Compiled query cache invalidated");
    }

    long cacheSize() {
        queryCache.cleanUp();
        return queryCache.estimatedSize();
    }
}
