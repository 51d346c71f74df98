package org.dxworks.jsxforge.backend;

/**
 * Capabilities a dialect supports natively.
 */
public final class BackendFeatures {
    public final boolean inheritance;
    public final boolean partials;
    public final boolean filters;
    public final boolean macros;
    public final boolean asyncOutput;
    public final boolean rawOutput;
    public final boolean comments;

    public BackendFeatures(boolean inheritance, boolean partials, boolean filters, boolean macros,
                           boolean asyncOutput, boolean rawOutput, boolean comments) {
        this.inheritance = inheritance;
        this.partials = partials;
        this.filters = filters;
        this.macros = macros;
        this.asyncOutput = asyncOutput;
        this.rawOutput = rawOutput;
        this.comments = comments;
    }

    @Override
    public String toString() {
        return "BackendFeatures{inheritance=" + inheritance + ", partials=" + partials + ", filters=" + filters
                + ", macros=" + macros + ", asyncOutput=" + asyncOutput + ", rawOutput=" + rawOutput
                + ", comments=" + comments + "}";
    }
}
