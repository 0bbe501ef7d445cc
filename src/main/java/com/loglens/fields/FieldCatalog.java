package com.loglens.fields;

import com.loglens.query.UnresolvedFieldException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of every field a query may reference.
 *
 * Resolution order for a surface name:
 * <ol>
 *   <li>canonical name of a core field (case-insensitive)</li>
 *   <li>alias of a core field (case-insensitive)</li>
 *   <li>discovered field (exact, then case-insensitive)</li>
 * </ol>
 * Each alias maps to exactly one canonical field. Discovered keys that collide
 * with a canonical name or alias are dropped when the snapshot is built.
 */
public final class FieldCatalog {

    private static final Logger log = LoggerFactory.getLogger(FieldCatalog.class);

    /**
     * Discovered keys are embedded into SQL as quoted literals, so only plain
     * identifier characters are accepted.
     */
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");

    private static final List<FieldDefinition> BUILT_IN = List.of(
        FieldDefinition.core("timestamp", FieldType.TIMESTAMP, "time", "_time"),
        FieldDefinition.core("hostname", FieldType.STRING, "host", "source"),
        FieldDefinition.core("app_name", FieldType.STRING, "app", "program", "sourcetype"),
        FieldDefinition.core("severity", FieldType.INTEGER, "level"),
        FieldDefinition.core("facility", FieldType.INTEGER),
        FieldDefinition.core("priority", FieldType.INTEGER),
        FieldDefinition.core("message", FieldType.STRING, "msg"),
        FieldDefinition.core("raw", FieldType.STRING, "_raw"),
        FieldDefinition.core("index_name", FieldType.STRING, "index"),
        FieldDefinition.core("protocol", FieldType.STRING),
        FieldDefinition.core("source_ip", FieldType.IP, "src_ip"),
        FieldDefinition.core("source_port", FieldType.INTEGER, "src_port")
    );

    private final long version;
    private final List<FieldDefinition> coreFields;
    private final List<FieldDefinition> discoveredFields;
    private final Map<String, FieldDefinition> coreIndex;
    private final Map<String, FieldDefinition> discoveredExact;
    private final Map<String, FieldDefinition> discoveredFolded;

    private FieldCatalog(long version, List<FieldDefinition> coreFields, List<FieldDefinition> discoveredFields) {
        this.version = version;
        this.coreFields = List.copyOf(coreFields);

        Map<String, FieldDefinition> index = new HashMap<>();
        for (FieldDefinition field : this.coreFields) {
            index.put(fold(field.getName()), field);
            for (String alias : field.getAliases()) {
                index.putIfAbsent(fold(alias), field);
            }
        }
        this.coreIndex = Collections.unmodifiableMap(index);

        List<FieldDefinition> accepted = new ArrayList<>();
        Map<String, FieldDefinition> exact = new LinkedHashMap<>();
        Map<String, FieldDefinition> folded = new HashMap<>();
        for (FieldDefinition field : discoveredFields) {
            if (coreIndex.containsKey(fold(field.getName())) || exact.containsKey(field.getName())) {
                log.debug("Ignoring discovered field '{}': name already resolves", field.getName());
                continue;
            }
            accepted.add(field);
            exact.put(field.getName(), field);
            folded.putIfAbsent(fold(field.getName()), field);
        }
        this.discoveredFields = List.copyOf(accepted);
        this.discoveredExact = Collections.unmodifiableMap(exact);
        this.discoveredFolded = Collections.unmodifiableMap(folded);
    }

    /**
     * Catalog holding only the built-in fields.
     */
    public static FieldCatalog builtIn() {
        return new FieldCatalog(0L, BUILT_IN, List.of());
    }

    /**
     * New snapshot with the built-in fields plus the given discovered fields.
     * Keys that are not safe identifiers are skipped.
     */
    public static FieldCatalog withDiscovered(long version, List<DiscoveredField> discovered) {
        List<FieldDefinition> definitions = new ArrayList<>();
        for (DiscoveredField field : discovered) {
            if (field.getName() == null || !SAFE_KEY.matcher(field.getName()).matches()) {
                log.warn("Skipping discovered field with unsupported name: {}", field.getName());
                continue;
            }
            definitions.add(FieldDefinition.discovered(field.getName(), field.getType()));
        }
        return new FieldCatalog(version, BUILT_IN, definitions);
    }

    public Optional<FieldDefinition> find(String surfaceName) {
        if (surfaceName == null || surfaceName.isEmpty()) {
            return Optional.empty();
        }
        FieldDefinition core = coreIndex.get(fold(surfaceName));
        if (core != null) {
            return Optional.of(core);
        }
        FieldDefinition discovered = discoveredExact.get(surfaceName);
        if (discovered != null) {
            return Optional.of(discovered);
        }
        return Optional.ofNullable(discoveredFolded.get(fold(surfaceName)));
    }

    /**
     * @throws UnresolvedFieldException if the name resolves to nothing
     */
    public FieldDefinition resolve(String surfaceName) {
        return find(surfaceName).orElseThrow(() ->
            new UnresolvedFieldException(-1, surfaceName, "no such field"));
    }

    /**
     * Core fields followed by discovered fields, in catalog order.
     */
    public List<FieldDefinition> allFields() {
        List<FieldDefinition> all = new ArrayList<>(coreFields.size() + discoveredFields.size());
        all.addAll(coreFields);
        all.addAll(discoveredFields);
        return all;
    }

    public List<FieldDefinition> getCoreFields() {
        return coreFields;
    }

    public List<FieldDefinition> getDiscoveredFields() {
        return discoveredFields;
    }

    public long getVersion() {
        return version;
    }

    private static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
