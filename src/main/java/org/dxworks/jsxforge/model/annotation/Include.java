package org.dxworks.jsxforge.model.annotation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inclusion of a partial template. Props keep their source order; values are opaque expressions
 * (string literals keep their quotes).
 */
public final class Include implements Annotation {
    public final String partial;
    public final Map<String, String> props;
    public final String originalName;

    public Include(String partial) {
        this(partial, Map.of(), null);
    }

    public Include(String partial, Map<String, String> props, String originalName) {
        this.partial = Objects.requireNonNull(partial, "partial");
        this.props = props == null || props.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        this.originalName = originalName;
    }

    public boolean hasProps() {
        return !props.isEmpty();
    }

    @Override
    public AnnotationKind kind() {
        return AnnotationKind.INCLUDE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Include other
                && partial.equals(other.partial)
                && props.equals(other.props)
                && Objects.equals(originalName, other.originalName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partial, props, originalName);
    }

    @Override
    public String toString() {
        return "Include{" + partial + (props.isEmpty() ? "" : ", " + props) + "}";
    }
}
