package org.dxworks.jsxforge;

public enum Dialect {
    REACT("react"),
    HANDLEBARS("handlebars"),
    LIQUID("liquid"),
    TWIG("twig"),
    LATTE("latte");

    private final String name;

    Dialect(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @throws IllegalArgumentException for a name no dialect answers to
     */
    public static Dialect fromName(String name) {
        if (name != null) {
            for (Dialect dialect : values()) {
                if (dialect.name.equalsIgnoreCase(name.trim())) return dialect;
            }
        }
        throw new IllegalArgumentException("Unknown dialect: " + name);
    }
}
