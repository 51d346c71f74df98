package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.ComponentMeta;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-compilation state of a transform. Backends are shared and stateless; anything they need
 * to report goes here.
 */
public final class RenderContext {
    private final ComponentMeta meta;
    private final boolean prettyPrint;
    private final List<String> warnings = new ArrayList<>();

    public RenderContext(ComponentMeta meta, boolean prettyPrint) {
        this.meta = meta != null ? meta : ComponentMeta.empty(null);
        this.prettyPrint = prettyPrint;
    }

    public static RenderContext standalone() {
        return new RenderContext(null, false);
    }

    public ComponentMeta getMeta() {
        return meta;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void warn(String message) {
        warnings.add(message);
    }

    public List<String> getWarnings() {
        return List.copyOf(warnings);
    }
}
