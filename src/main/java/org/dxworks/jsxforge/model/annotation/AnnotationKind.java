package org.dxworks.jsxforge.model.annotation;

public enum AnnotationKind {
    LOOP,
    CONDITION,
    VARIABLE,
    SLOT,
    INCLUDE,
    BLOCK
}
