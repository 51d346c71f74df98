package org.dxworks.jsxforge.model.annotation;

/**
 * Semantic payload attached to an element, independent of any target syntax.
 * An element holds at most one annotation.
 */
public interface Annotation {

    AnnotationKind kind();
}
