package com.loglens.query.exec;

import com.loglens.query.sql.CompiledQuery;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Runs compiled SQL against the event store.
 *
 * Implementations hold no compiler logic. Each row is keyed by output column
 * name, in output schema order.
 */
public interface ExecutionAdapter {

    Mono<List<Map<String, Object>>> execute(CompiledQuery query, Duration timeout);
}
