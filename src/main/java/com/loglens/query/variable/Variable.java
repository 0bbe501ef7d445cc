package com.loglens.query.variable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Definition of a query variable referenced as {@code $name$}.
 *
 * The default value is either a string or a list of strings.
 */
public final class Variable {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("default_value")
    private final Object defaultValue;

    @JsonProperty("multi_select")
    private final boolean multiSelect;

    @JsonProperty("include_all")
    private final boolean includeAll;

    @JsonCreator
    public Variable(@JsonProperty("name") String name,
                    @JsonProperty("default_value") Object defaultValue,
                    @JsonProperty("multi_select") boolean multiSelect,
                    @JsonProperty("include_all") boolean includeAll) {
        this.name = Objects.requireNonNull(name, "name");
        this.defaultValue = defaultValue;
        this.multiSelect = multiSelect;
        this.includeAll = includeAll;
    }

    public static Variable of(String name) {
        return new Variable(name, null, false, false);
    }

    public String getName() {
        return name;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean isMultiSelect() {
        return multiSelect;
    }

    public boolean isIncludeAll() {
        return includeAll;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable)) return false;
        Variable that = (Variable) o;
        return multiSelect == that.multiSelect && includeAll == that.includeAll
            && name.equals(that.name) && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, defaultValue, multiSelect, includeAll);
    }

    @Override
    public String toString() {
        return "$" + name + "$";
    }
}
