package org.dxworks.jsxforge.model;

import java.util.List;

public final class Root extends Node {
    public final List<Node> children;
    public final ComponentMeta meta;

    public Root(List<Node> children, ComponentMeta meta) {
        this.children = children == null ? List.of() : List.copyOf(children);
        this.meta = meta != null ? meta : ComponentMeta.empty(null);
    }

    public Root(List<Node> children) {
        this(children, null);
    }

    @Override
    public NodeType getType() {
        return NodeType.ROOT;
    }

    public Root withChildren(List<Node> newChildren) {
        return new Root(newChildren, meta);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Root other && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return "Root(" + children + ")";
    }
}
