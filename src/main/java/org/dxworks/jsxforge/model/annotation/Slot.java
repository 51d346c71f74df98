package org.dxworks.jsxforge.model.annotation;

import java.util.Objects;

public final class Slot implements Annotation {
    public static final String DEFAULT_NAME = "default";

    public final String name;

    public Slot(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public boolean isDefault() {
        return DEFAULT_NAME.equals(name);
    }

    @Override
    public AnnotationKind kind() {
        return AnnotationKind.SLOT;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Slot other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "Slot{" + name + "}";
    }
}
