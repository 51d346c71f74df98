package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.analyzer.SyntaxNode;

import java.util.List;

/**
 * A recognised DSL tag as found in the source: its name, attributes and the syntax of its
 * children (not yet turned into tree nodes).
 */
public final class DslTag {
    public final String name;
    public final DslAttributes attributes;
    public final SyntaxNode node;
    public final List<SyntaxNode> children;

    public DslTag(String name, DslAttributes attributes, SyntaxNode node, List<SyntaxNode> children) {
        this.name = name;
        this.attributes = attributes;
        this.node = node;
        this.children = List.copyOf(children);
    }

    public int line() {
        return node.line;
    }
}
