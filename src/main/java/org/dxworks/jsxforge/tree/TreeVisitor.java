package org.dxworks.jsxforge.tree;

import org.dxworks.jsxforge.model.Node;

/**
 * Depth-first visitor. {@code parent} is null for the node the walk started from.
 */
public interface TreeVisitor {

    VisitAction enter(Node node, Node parent, int depth);

    default void exit(Node node, Node parent, int depth) {
    }
}
