package org.dxworks.jsxforge.model;

import java.util.Objects;

public final class Comment extends Node {
    public final String value;

    public Comment(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public NodeType getType() {
        return NodeType.COMMENT;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Comment other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Comment(" + value + ")";
    }
}
