package com.loglens.query.variable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Variable definitions plus the values selected for one compilation.
 *
 * A value is a scalar or a list of scalars; scalars are kept as strings.
 */
public final class VariableBindings {

    private static final VariableBindings EMPTY = new VariableBindings(List.of(), Map.of());

    private final Map<String, Variable> definitions;
    private final Map<String, Object> values;

    public VariableBindings(Collection<Variable> definitions, Map<String, ?> values) {
        Map<String, Variable> byName = new LinkedHashMap<>();
        if (definitions != null) {
            for (Variable variable : definitions) {
                byName.put(variable.getName(), variable);
            }
        }
        this.definitions = Collections.unmodifiableMap(byName);

        Map<String, Object> normalized = new TreeMap<>();
        if (values != null) {
            values.forEach((name, value) -> normalized.put(name, normalize(value)));
        }
        this.values = Collections.unmodifiableMap(normalized);
    }

    public static VariableBindings empty() {
        return EMPTY;
    }

    /**
     * Values only; every referenced variable is treated as a plain scalar
     * variable without a default.
     */
    public static VariableBindings ofValues(Map<String, ?> values) {
        return new VariableBindings(List.of(), values);
    }

    public Optional<Variable> definition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public boolean hasValue(String name) {
        return values.containsKey(name);
    }

    /**
     * The selected value: a String, a List of Strings, or null.
     */
    public Object value(String name) {
        return values.get(name);
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public Collection<Variable> getDefinitions() {
        return definitions.values();
    }

    /**
     * Stable textual form used as part of cache keys. Every name and value is
     * length-prefixed and tagged as scalar ({@code s}), list ({@code l}) or
     * absent ({@code n}), so distinct bindings never share a fingerprint.
     */
    public String fingerprint() {
        if (values.isEmpty() && definitions.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        values.forEach((name, value) -> {
            appendString(sb, name);
            appendValue(sb, value);
        });
        sb.append('|');
        for (Variable variable : new TreeMap<>(definitions).values()) {
            appendString(sb, variable.getName());
            appendValue(sb, normalize(variable.getDefaultValue()));
            sb.append(variable.isMultiSelect() ? 'M' : '-')
                .append(variable.isIncludeAll() ? 'A' : '-');
        }
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append('n');
        } else if (value instanceof List) {
            List<?> list = (List<?>) value;
            sb.append('l').append(list.size()).append(':');
            for (Object item : list) {
                appendString(sb, (String) item);
            }
        } else {
            sb.append('s');
            appendString(sb, (String) value);
        }
    }

    private static void appendString(StringBuilder sb, String text) {
        sb.append(text.length()).append(':').append(text);
    }

    static Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection) {
            List<String> list = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    list.add(String.valueOf(item));
                }
            }
            return List.copyOf(list);
        }
        if (value instanceof Object[]) {
            return normalize(Arrays.asList((Object[]) value));
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableBindings)) return false;
        VariableBindings that = (VariableBindings) o;
        return definitions.equals(that.definitions) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definitions, values);
    }
}
