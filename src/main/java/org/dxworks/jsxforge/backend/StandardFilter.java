package org.dxworks.jsxforge.backend;

import java.util.Optional;

/**
 * The closed, dialect-independent set of value transforms.
 */
public enum StandardFilter {
    UPPERCASE,
    LOWERCASE,
    CAPITALIZE,
    TRIM,
    DATE,
    CURRENCY,
    NUMBER,
    JSON,
    ESCAPE,
    RAW,
    DEFAULT,
    FIRST,
    LAST,
    LENGTH,
    JOIN,
    SPLIT,
    REVERSE,
    SORT,
    SLICE,
    TRUNCATE;

    public String id() {
        return name().toLowerCase();
    }

    public static Optional<StandardFilter> fromName(String name) {
        if (name == null) return Optional.empty();
        for (StandardFilter filter : values()) {
            if (filter.id().equalsIgnoreCase(name.trim())) return Optional.of(filter);
        }
        return Optional.empty();
    }
}
