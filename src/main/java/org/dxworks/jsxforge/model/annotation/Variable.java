package org.dxworks.jsxforge.model.annotation;

import java.util.List;
import java.util.Objects;

public final class Variable implements Annotation {
    public final String name;
    public final String defaultValue;
    public final String filter;
    public final List<String> filterArgs;
    public final boolean raw;

    public Variable(String name) {
        this(name, null, null, List.of(), false);
    }

    public Variable(String name, String defaultValue, String filter, List<String> filterArgs, boolean raw) {
        this.name = Objects.requireNonNull(name, "name");
        this.defaultValue = defaultValue;
        this.filter = filter;
        this.filterArgs = filterArgs == null ? List.of() : List.copyOf(filterArgs);
        this.raw = raw;
    }

    public Variable withDefault(String defaultValue) {
        return new Variable(name, defaultValue, filter, filterArgs, raw);
    }

    public Variable withFilter(String filter, List<String> filterArgs) {
        return new Variable(name, defaultValue, filter, filterArgs, raw);
    }

    public Variable asRaw() {
        return new Variable(name, defaultValue, filter, filterArgs, true);
    }

    @Override
    public AnnotationKind kind() {
        return AnnotationKind.VARIABLE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Variable other
                && name.equals(other.name)
                && Objects.equals(defaultValue, other.defaultValue)
                && Objects.equals(filter, other.filter)
                && filterArgs.equals(other.filterArgs)
                && raw == other.raw;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, defaultValue, filter, filterArgs, raw);
    }

    @Override
    public String toString() {
        return "Variable{" + name
                + (defaultValue != null ? ", default=" + defaultValue : "")
                + (filter != null ? ", filter=" + filter + filterArgs : "")
                + (raw ? ", raw" : "") + "}";
    }
}
