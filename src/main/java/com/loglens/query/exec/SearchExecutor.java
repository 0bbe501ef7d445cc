package com.loglens.query.exec;

import com.loglens.domain.SearchRequest;
import com.loglens.domain.SearchResult;
import com.loglens.query.ParseResult;
import com.loglens.query.QueryMetrics;
import com.loglens.query.SearchCompiler;
import com.loglens.query.sql.CompiledQuery;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Compiles a search and runs it through the {@link ExecutionAdapter}.
 *
 * Compile errors surface unchanged as {@code QueryCompilationException}s.
 * Store failures become {@link QueryExecutionException}, and a query that
 * exceeds its timeout becomes {@link QueryTimeoutException}.
 */
@Service
public class SearchExecutor {

    private static final Logger log = LoggerFactory.getLogger(SearchExecutor.class);

    private final SearchCompiler compiler;
    private final ExecutionAdapter adapter;
    private final QueryMetrics metrics;
    private final Duration defaultTimeout;

    public SearchExecutor(
            SearchCompiler compiler,
            ExecutionAdapter adapter,
            QueryMetrics metrics,
            @Value("${loglens.query.execution-timeout:30s}") Duration defaultTimeout) {
        this.compiler = compiler;
        this.adapter = adapter;
        this.metrics = metrics;
        this.defaultTimeout = defaultTimeout;
    }

    public Mono<SearchResult> compileAndRun(SearchRequest request) {
        return Mono.defer(() -> {
            ParseResult parsed = compiler.parse(request.getQuery(), request.toBindings(), request.toTimeRange());
            return run(parsed, timeoutFor(request));
        });
    }

    private Mono<SearchResult> run(ParseResult parsed, Duration timeout) {
        CompiledQuery compiled = parsed.getCompiled();
        Timer.Sample sample = metrics.startQueryTimer();
        long startTime = System.currentTimeMillis();

        return adapter.execute(compiled, timeout)
            .timeout(timeout)
            .map(rows -> {
                long executionTime = System.currentTimeMillis() - startTime;
                metrics.recordQueryExecuted();
                metrics.recordResultSize(rows.size());
                log.debug("Search returned {} rows in {}ms", rows.size(), executionTime);
                return new SearchResult(rows, executionTime, compiled.getSql(),
                    compiled.getParameters(), parsed.getWarnings());
            })
            .onErrorMap(TimeoutException.class,
                e -> new QueryTimeoutException(timeout, compiled.getSql(), e))
            .onErrorMap(e -> !(e instanceof QueryExecutionException),
                e -> new QueryExecutionException("Search execution failed: " + e.getMessage(), compiled.getSql(), e))
            .doOnError(QueryTimeoutException.class, e -> {
                log.warn("Search timed out after {}ms", timeout.toMillis());
                metrics.recordQueryTimedOut();
            })
            .doOnError(e -> !(e instanceof QueryTimeoutException), e -> {
                log.error("Search execution failed: {}", e.getMessage(), e);
                metrics.recordQueryFailed();
            })
            .doFinally(signal -> metrics.recordQueryLatency(sample));
    }

    private Duration timeoutFor(SearchRequest request) {
        Long timeoutMs = request.getTimeoutMs();
        if (timeoutMs == null || timeoutMs <= 0) {
            return defaultTimeout;
        }
        return Duration.ofMillis(timeoutMs);
    }
}
