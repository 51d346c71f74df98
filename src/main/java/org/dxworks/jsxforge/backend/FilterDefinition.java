package org.dxworks.jsxforge.backend;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * How one standard filter is spelled in a dialect: a native filter or helper name with an
 * optional argument formatter, or (for expression dialects) a rewrite of the whole expression.
 */
public final class FilterDefinition {
    public final String nativeName;
    private final UnaryOperator<List<String>> argumentFormatter;
    private final BiFunction<String, List<String>, String> rewriter;

    private FilterDefinition(String nativeName, UnaryOperator<List<String>> argumentFormatter,
                             BiFunction<String, List<String>, String> rewriter) {
        this.nativeName = nativeName;
        this.argumentFormatter = argumentFormatter;
        this.rewriter = rewriter;
    }

    public static FilterDefinition named(String nativeName) {
        return new FilterDefinition(nativeName, null, null);
    }

    public static FilterDefinition named(String nativeName, UnaryOperator<List<String>> argumentFormatter) {
        return new FilterDefinition(nativeName, argumentFormatter, null);
    }

    /**
     * A filter expressed by rewriting the filtered expression, e.g. {@code e -> e.toUpperCase()}.
     */
    public static FilterDefinition rewriting(BiFunction<String, List<String>, String> rewriter) {
        return new FilterDefinition(null, null, rewriter);
    }

    public boolean isRewriting() {
        return rewriter != null;
    }

    public List<String> formatArguments(List<String> args) {
        List<String> safe = args == null ? List.of() : args;
        return argumentFormatter != null ? argumentFormatter.apply(safe) : safe;
    }

    public String rewrite(String expression, List<String> args) {
        if (rewriter == null) throw new IllegalStateException("Filter " + nativeName + " is not a rewriting filter");
        return rewriter.apply(expression, formatArguments(args));
    }
}
