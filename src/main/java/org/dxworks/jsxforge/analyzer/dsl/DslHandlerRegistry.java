package org.dxworks.jsxforge.analyzer.dsl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup table from DSL tag name to handler. Build it once and share it between
 * compilations.
 */
public final class DslHandlerRegistry {

    private final Map<String, DslHandler> handlers;

    public DslHandlerRegistry(Collection<? extends DslHandler> handlers) {
        Map<String, DslHandler> byName = new LinkedHashMap<>();
        for (DslHandler handler : handlers) {
            if (byName.putIfAbsent(handler.tagName(), handler) != null) {
                throw new IllegalArgumentException("Duplicate DSL handler for tag: " + handler.tagName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byName);
    }

    public static DslHandlerRegistry defaults() {
        return new DslHandlerRegistry(List.of(
                new LoopHandler(),
                new IfHandler(),
                new ElseIfHandler(),
                new ElseHandler(),
                new VarHandler(),
                new RawHandler(),
                new SlotHandler(),
                new IncludeHandler(),
                new DefineBlockHandler(),
                new ExtendsHandler()));
    }

    public Optional<DslHandler> get(String tagName) {
        return Optional.ofNullable(handlers.get(tagName));
    }

    public boolean has(String tagName) {
        return handlers.containsKey(tagName);
    }

    public Set<String> tagNames() {
        return handlers.keySet();
    }
}
