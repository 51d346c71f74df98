package org.dxworks.jsxforge.model;

public final class Doctype extends Node {
    public static final Doctype HTML = new Doctype("html");

    public final String name;

    public Doctype(String name) {
        this.name = name;
    }

    @Override
    public NodeType getType() {
        return NodeType.DOCTYPE;
    }

    @Override
    public String toString() {
        return "Doctype(" + name + ")";
    }
}
