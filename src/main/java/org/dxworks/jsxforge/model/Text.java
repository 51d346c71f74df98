package org.dxworks.jsxforge.model;

import java.util.Objects;

public final class Text extends Node {
    public final String value;

    public Text(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType getType() {
        return NodeType.TEXT;
    }

    public boolean isBlank() {
        return value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Text other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Text(" + value + ")";
    }
}
