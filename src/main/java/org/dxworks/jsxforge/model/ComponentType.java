package org.dxworks.jsxforge.model;

public enum ComponentType {
    LAYOUT,
    PARTIAL,
    PAGE,
    BLOCK,
    COMPONENT;

    public static ComponentType fromComponentName(String name) {
        if (name == null) return COMPONENT;
        String lower = name.toLowerCase();
        if (lower.contains("layout")) return LAYOUT;
        if (lower.contains("page")) return PAGE;
        if (lower.contains("block") || lower.contains("section")) return BLOCK;
        if (lower.contains("partial") || lower.contains("header") || lower.contains("footer")
                || lower.contains("nav")) return PARTIAL;
        return COMPONENT;
    }
}
