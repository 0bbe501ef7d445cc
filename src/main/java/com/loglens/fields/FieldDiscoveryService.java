package com.loglens.fields;

import com.loglens.domain.FieldListing;
import com.loglens.query.QueryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Keeps the field alias table in sync with the keys seen in ingested events
 * and serves the field listing.
 *
 * A refresh that fails leaves the previous snapshot in place; queries keep
 * compiling against the last known field set.
 */
@Service
public class FieldDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(FieldDiscoveryService.class);

    private final FieldDiscoverySource source;
    private final FieldAliasTable aliasTable;
    private final QueryMetrics metrics;
    private final Duration lookback;
    private final int maxDiscovered;

    public FieldDiscoveryService(
            FieldDiscoverySource source,
            FieldAliasTable aliasTable,
            QueryMetrics metrics,
            @Value("${loglens.fields.lookback:PT24H}") Duration lookback,
            @Value("${loglens.fields.max-discovered:500}") int maxDiscovered) {
        this.source = source;
        this.aliasTable = aliasTable;
        this.metrics = metrics;
        this.lookback = lookback;
        this.maxDiscovered = maxDiscovered;
    }

    /**
     * Scan for new keys and publish a new catalog snapshot.
     *
     * @return true if a new snapshot was published
     */
    @Scheduled(fixedDelayString = "${loglens.fields.refresh-interval:PT5M}",
               initialDelayString = "${loglens.fields.initial-delay:PT10S}")
    public boolean refresh() {
        List<DiscoveredField> discovered;
        try {
            discovered = source.discover(lookback, maxDiscovered);
        } catch (RuntimeException e) {
            log.warn("Field discovery failed, keeping catalog version {}: {}",
                aliasTable.snapshot().getVersion(), e.getMessage(), e);
            metrics.recordFieldRefreshFailure();
            return false;
        }
        aliasTable.refresh(discovered);
        metrics.recordFieldRefresh();
        return true;
    }

    public FieldListing discoverFields(FieldDiscoveryOptions options) {
        FieldCatalog catalog = aliasTable.snapshot();
        String prefix = options == null || options.getPrefix() == null
            ? "" : options.getPrefix().toLowerCase(Locale.ROOT);
        long limit = options == null || options.getLimit() == null || options.getLimit() < 0
            ? Long.MAX_VALUE : options.getLimit();

        List<FieldDefinition> core = catalog.getCoreFields().stream()
            .filter(field -> field.getName().toLowerCase(Locale.ROOT).startsWith(prefix))
            .collect(Collectors.toList());
        List<FieldDefinition> discovered = catalog.getDiscoveredFields().stream()
            .filter(field -> field.getName().toLowerCase(Locale.ROOT).startsWith(prefix))
            .limit(limit)
            .collect(Collectors.toList());
        return new FieldListing(core, discovered, catalog.getVersion());
    }
}
