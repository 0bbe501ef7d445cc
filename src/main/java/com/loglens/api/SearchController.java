package com.loglens.api;

import com.loglens.domain.FieldListing;
import com.loglens.domain.SearchRequest;
import com.loglens.domain.SearchResult;
import com.loglens.fields.FieldDiscoveryOptions;
import com.loglens.fields.FieldDiscoveryService;
import com.loglens.fields.FieldPreferences;
import com.loglens.query.ParseResult;
import com.loglens.query.SearchCompiler;
import com.loglens.query.ValidationResult;
import com.loglens.query.exec.SearchExecutor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST surface of the search compiler, field sidebar and field preferences.
 *
 * Note: authn/authz is expected to be enforced by upstream security layers.
 */
@RestController
@RequestMapping("/api/search")
public class SearchController {

    private final SearchCompiler compiler;
    private final SearchExecutor executor;
    private final FieldDiscoveryService fieldDiscoveryService;
    private final FieldPreferences fieldPreferences;

    public SearchController(
        SearchCompiler compiler,
        SearchExecutor executor,
        FieldDiscoveryService fieldDiscoveryService,
        FieldPreferences fieldPreferences
    ) {
        this.compiler = compiler;
        this.executor = executor;
        this.fieldDiscoveryService = fieldDiscoveryService;
        this.fieldPreferences = fieldPreferences;
    }

    @PostMapping("/query")
    public Mono<SearchResult> query(@RequestBody SearchRequest request) {
        return executor.compileAndRun(request);
    }

    @PostMapping("/parse")
    public ParseResult parse(@RequestBody SearchRequest request) {
        return compiler.parse(request.getQuery(), request.toBindings(), request.toTimeRange());
    }

    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody SearchRequest request) {
        return compiler.validate(request.getQuery(), request.toBindings(), request.toTimeRange());
    }

    @GetMapping("/fields")
    public FieldListing fields(
        @RequestParam(required = false) Integer limit,
        @RequestParam(required = false) String prefix
    ) {
        return fieldDiscoveryService.discoverFields(new FieldDiscoveryOptions(limit, prefix));
    }

    @PostMapping("/fields/{name}/pin")
    public FieldPreferences.Snapshot pin(@PathVariable String name) {
        return fieldPreferences.pinField(name);
    }

    @DeleteMapping("/fields/{name}/pin")
    public FieldPreferences.Snapshot unpin(@PathVariable String name) {
        return fieldPreferences.unpinField(name);
    }

    @PutMapping("/fields/order")
    public FieldPreferences.Snapshot reorder(@RequestBody List<String> order) {
        return fieldPreferences.reorderFields(order);
    }

    @GetMapping("/preferences")
    public FieldPreferences.Snapshot preferences() {
        return fieldPreferences.preferences();
    }
}
