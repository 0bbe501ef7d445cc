package com.loglens.fields;

import java.time.Duration;
import java.util.List;

/**
 * Scans ingested events for structured-data keys.
 */
public interface FieldDiscoverySource {

    /**
     * @param lookback how far back from now to scan
     * @param limit maximum number of keys, most frequent first
     */
    List<DiscoveredField> discover(Duration lookback, int limit);
}
