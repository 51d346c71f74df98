package org.dxworks.jsxforge.backend;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A dialect's mapping for every {@link StandardFilter}. Built once and read-only afterwards.
 */
public final class FilterTable {
    private final Map<StandardFilter, FilterDefinition> definitions;

    private FilterTable(Map<StandardFilter, FilterDefinition> definitions) {
        this.definitions = Collections.unmodifiableMap(new EnumMap<>(definitions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FilterDefinition> lookup(String filterName) {
        return StandardFilter.fromName(filterName).map(definitions::get);
    }

    public FilterDefinition get(StandardFilter filter) {
        return definitions.get(filter);
    }

    public int size() {
        return definitions.size();
    }

    public static final class Builder {
        private final Map<StandardFilter, FilterDefinition> definitions = new EnumMap<>(StandardFilter.class);

        private Builder() {
        }

        public Builder put(StandardFilter filter, FilterDefinition definition) {
            definitions.put(filter, definition);
            return this;
        }

        public Builder named(StandardFilter filter, String nativeName) {
            return put(filter, FilterDefinition.named(nativeName));
        }

        /**
         * @throws IllegalStateException if a standard filter has no mapping
         */
        public FilterTable build() {
            for (StandardFilter filter : StandardFilter.values()) {
                if (!definitions.containsKey(filter)) {
                    throw new IllegalStateException("No mapping for standard filter: " + filter.id());
                }
            }
            return new FilterTable(definitions);
        }
    }
}
