package org.dxworks.jsxforge.tree;

public enum VisitAction {
    CONTINUE,
    SKIP_CHILDREN,
    ABORT
}
