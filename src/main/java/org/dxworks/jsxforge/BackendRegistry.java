package org.dxworks.jsxforge;

import org.dxworks.jsxforge.backend.TemplateBackend;
import org.dxworks.jsxforge.backend.dialect.HandlebarsBackend;
import org.dxworks.jsxforge.backend.dialect.LatteBackend;
import org.dxworks.jsxforge.backend.dialect.LiquidBackend;
import org.dxworks.jsxforge.backend.dialect.ReactBackend;
import org.dxworks.jsxforge.backend.dialect.TwigBackend;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Backends by dialect. Read-only once built, so it can be shared by concurrent compilations.
 */
public final class BackendRegistry {

    private final Map<Dialect, TemplateBackend> backends;

    public BackendRegistry(Map<Dialect, TemplateBackend> backends) {
        this.backends = Collections.unmodifiableMap(new EnumMap<>(backends));
    }

    public static BackendRegistry defaults() {
        Map<Dialect, TemplateBackend> backends = new EnumMap<>(Dialect.class);
        for (Dialect dialect : Dialect.values()) {
            backends.put(dialect, createBackend(dialect));
        }
        return new BackendRegistry(backends);
    }

    private static TemplateBackend createBackend(Dialect dialect) {
        return switch (dialect) {
            case REACT -> new ReactBackend();
            case HANDLEBARS -> new HandlebarsBackend();
            case LIQUID -> new LiquidBackend();
            case TWIG -> new TwigBackend();
            case LATTE -> new LatteBackend();
        };
    }

    public TemplateBackend get(Dialect dialect) {
        TemplateBackend backend = backends.get(dialect);
        if (backend == null) {
            throw new IllegalArgumentException("No backend registered for dialect: " + dialect);
        }
        return backend;
    }

    public TemplateBackend get(String dialectName) {
        return get(Dialect.fromName(dialectName));
    }

    public Set<Dialect> dialects() {
        return backends.keySet();
    }
}
