package org.dxworks.jsxforge.model.annotation;

import java.util.Objects;

/**
 * A named overridable region, or (when {@code extendsTemplate} is set) a declaration that the
 * unit inherits from a parent layout.
 */
public final class Block implements Annotation {
    public static final String EXTENDS_NAME = "extends";

    public final String name;
    public final String extendsTemplate;

    public Block(String name) {
        this(name, null);
    }

    public Block(String name, String extendsTemplate) {
        this.name = Objects.requireNonNull(name, "name");
        this.extendsTemplate = extendsTemplate;
    }

    public static Block extending(String layout) {
        return new Block(EXTENDS_NAME, Objects.requireNonNull(layout, "layout"));
    }

    public boolean isExtends() {
        return extendsTemplate != null;
    }

    @Override
    public AnnotationKind kind() {
        return AnnotationKind.BLOCK;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Block other
                && name.equals(other.name)
                && Objects.equals(extendsTemplate, other.extendsTemplate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, extendsTemplate);
    }

    @Override
    public String toString() {
        return "Block{" + name + (extendsTemplate != null ? " extends " + extendsTemplate : "") + "}";
    }
}
