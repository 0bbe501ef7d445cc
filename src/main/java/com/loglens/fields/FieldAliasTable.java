package com.loglens.fields;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the current {@link FieldCatalog}.
 *
 * The catalog is replaced wholesale: a refresh builds a new immutable snapshot
 * and swaps the reference, so a compilation that grabbed a snapshot keeps
 * seeing one consistent field set and readers never wait on a refresh.
 */
@Component
public class FieldAliasTable {

    private static final Logger log = LoggerFactory.getLogger(FieldAliasTable.class);

    private final AtomicReference<FieldCatalog> current = new AtomicReference<>(FieldCatalog.builtIn());

    public FieldCatalog snapshot() {
        return current.get();
    }

    /**
     * Publish a new snapshot built from the given discovery results.
     *
     * @return the snapshot now in effect
     */
    public FieldCatalog refresh(List<DiscoveredField> discovered) {
        FieldCatalog updated = current.updateAndGet(previous ->
            FieldCatalog.withDiscovered(previous.getVersion() + 1, discovered));
        log.info("Field catalog refreshed to version {} with {} discovered fields",
            updated.getVersion(), updated.getDiscoveredFields().size());
        return updated;
    }
}
