package org.dxworks.jsxforge.model;

public final class PropDefinition {
    public final String name;
    public final boolean required;
    public final String defaultValue;

    public PropDefinition(String name, boolean required, String defaultValue) {
        this.name = name;
        this.required = required;
        this.defaultValue = defaultValue;
    }

    @Override
    public String toString() {
        return name + (defaultValue != null ? " = " + defaultValue : "");
    }
}
