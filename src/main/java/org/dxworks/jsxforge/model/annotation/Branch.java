package org.dxworks.jsxforge.model.annotation;

public enum Branch {
    IF,
    ELSE_IF,
    ELSE
}
