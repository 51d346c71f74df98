package org.dxworks.jsxforge.model;

public enum NodeType {
    ROOT,
    ELEMENT,
    TEXT,
    COMMENT,
    DOCTYPE
}
