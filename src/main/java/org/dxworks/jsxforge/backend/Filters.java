package org.dxworks.jsxforge.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Filter-table lookup and argument formatters shared by the dialects.
 */
public final class Filters {

    private Filters() {
    }

    /**
     * Standard filter definition, or empty for a name outside the standard set.
     */
    public static Optional<FilterDefinition> resolve(FilterTable table, String filterName) {
        return table.lookup(filterName);
    }

    /**
     * Leaves numbers, booleans and quoted strings alone and double-quotes everything else.
     * Surrounding whitespace is only ignored for the first three; a plain string keeps it.
     */
    public static String literal(String arg) {
        if (arg == null) return "\"\"";
        String a = arg.trim();
        if (a.matches("-?\\d+(\\.\\d+)?") || a.equals("true") || a.equals("false")) return a;
        if (a.length() >= 2 && (a.startsWith("\"") && a.endsWith("\"") || a.startsWith("'") && a.endsWith("'"))) {
            return a;
        }
        return "\"" + arg.replace("\"", "\\\"") + "\"";
    }

    public static UnaryOperator<List<String>> quoted() {
        return args -> {
            List<String> result = new ArrayList<>();
            for (String arg : args) result.add(literal(arg));
            return result;
        };
    }

    /**
     * Quotes the arguments and supplies {@code defaults} for missing trailing ones.
     */
    public static UnaryOperator<List<String>> quotedWithDefaults(String... defaults) {
        return args -> {
            List<String> result = new ArrayList<>();
            for (String arg : args) result.add(literal(arg));
            for (int i = result.size(); i < defaults.length; i++) result.add(literal(defaults[i]));
            return result;
        };
    }

    /**
     * Single numeric argument with a fallback.
     */
    public static UnaryOperator<List<String>> numberOr(String fallback) {
        return args -> List.of(args.isEmpty() ? fallback : args.get(0).trim());
    }

    public static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    /**
     * Default values are literal text; numbers and booleans stay unquoted.
     */
    public static String defaultLiteral(String value) {
        if (value.matches("-?\\d+(\\.\\d+)?") || value.equals("true") || value.equals("false")) return value;
        return quote(value);
    }
}
