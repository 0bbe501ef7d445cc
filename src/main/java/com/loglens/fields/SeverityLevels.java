package com.loglens.fields;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Syslog severity names accepted wherever a severity number is expected.
 */
public final class SeverityLevels {

    public static final String FIELD = "severity";

    private static final Map<String, Integer> LEVELS = Map.ofEntries(
        Map.entry("emerg", 0),
        Map.entry("emergency", 0),
        Map.entry("alert", 1),
        Map.entry("crit", 2),
        Map.entry("critical", 2),
        Map.entry("err", 3),
        Map.entry("error", 3),
        Map.entry("warn", 4),
        Map.entry("warning", 4),
        Map.entry("notice", 5),
        Map.entry("info", 6),
        Map.entry("informational", 6),
        Map.entry("debug", 7));

    private SeverityLevels() {
    }

    public static Optional<Integer> toNumber(String name) {
        return Optional.ofNullable(LEVELS.get(name.toLowerCase(Locale.ROOT)));
    }
}
