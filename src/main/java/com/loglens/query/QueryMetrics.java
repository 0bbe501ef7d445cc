package com.loglens.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for search compilation and execution.
 * Tracks compiles, compile errors by code, cache hit rates, execution
 * latency, result sizes and field catalog refreshes.
 */
@Component
public class QueryMetrics {

    static final String COMPILE_ERRORS = "loglens.query.compile.errors";

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesCompiled;
    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter queriesTimedOut;
    private Timer compileLatency;
    private Timer queryExecutionLatency;
    private DistributionSummary resultSize;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter fieldRefreshes;
    private Counter fieldRefreshFailures;

    @PostConstruct
    public void init() {
        queriesCompiled = Counter.builder("loglens.query.compiled")
            .description("Total number of queries compiled")
            .register(meterRegistry);

        queriesExecuted = Counter.builder("loglens.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("loglens.query.failed")
            .description("Total number of queries that failed in storage")
            .register(meterRegistry);

        queriesTimedOut = Counter.builder("loglens.query.timedout")
            .description("Total number of queries that timed out")
            .register(meterRegistry);

        compileLatency = Timer.builder("loglens.query.compile.latency")
            .description("Latency of query compilation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        // Timers with histogram support for percentile calculation
        queryExecutionLatency = Timer.builder("loglens.query.execution.latency")
            .description("Latency of compile and execute")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("loglens.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(1.0)
            .maximumExpectedValue(100000.0)
            .register(meterRegistry);

        cacheHits = Counter.builder("loglens.query.cache.hits")
            .description("Total number of compiled query cache hits")
            .register(meterRegistry);

        cacheMisses = Counter.builder("loglens.query.cache.misses")
            .description("Total number of compiled query cache misses")
            .register(meterRegistry);

        fieldRefreshes = Counter.builder("loglens.fields.refreshed")
            .description("Total number of field catalog refreshes")
            .register(meterRegistry);

        fieldRefreshFailures = Counter.builder("loglens.fields.refresh.failed")
            .description("Total number of failed field catalog refreshes")
            .register(meterRegistry);
    }

    public void recordQueryCompiled() {
        queriesCompiled.increment();
    }

    public void recordCompileError(ErrorCode code) {
        Counter.builder(COMPILE_ERRORS)
            .description("Query compilation errors by error code")
            .tag("code", code.name())
            .register(meterRegistry)
            .increment();
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public void recordQueryTimedOut() {
        queriesTimedOut.increment();
    }

    public Timer.Sample startCompileTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCompileLatency(Timer.Sample sample) {
        sample.stop(compileLatency);
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordFieldRefresh() {
        fieldRefreshes.increment();
    }

    public void recordFieldRefreshFailure() {
        fieldRefreshFailures.increment();
    }

    /**
     * Calculate cache hit rate as a percentage
     * @return cache hit rate (0-100) or 0 if no cache operations
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double total = hits + cacheMisses.count();
        if (total == 0) {
            return 0.0;
        }
        return (hits / total) * 100.0;
    }

    public double getCompileErrorCount(ErrorCode code) {
        Counter counter = meterRegistry.find(COMPILE_ERRORS).tag("code", code.name()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    // Getter methods for testing
    public Counter getQueriesCompiled() {
        return queriesCompiled;
    }

    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getQueriesTimedOut() {
        return queriesTimedOut;
    }

    public Timer getCompileLatency() {
        return compileLatency;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public Counter getCacheHits() {
        return cacheHits;
    }

    public Counter getCacheMisses() {
        return cacheMisses;
    }

    public Counter getFieldRefreshes() {
        return fieldRefreshes;
    }

    public Counter getFieldRefreshFailures() {
        return fieldRefreshFailures;
    }
}
