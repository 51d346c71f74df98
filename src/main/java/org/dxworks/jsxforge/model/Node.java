package org.dxworks.jsxforge.model;

/**
 * Base of the intermediate tree. Nodes are immutable; transformations build new nodes.
 */
public abstract class Node {

    public abstract NodeType getType();
}
