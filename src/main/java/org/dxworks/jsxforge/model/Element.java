package org.dxworks.jsxforge.model;

import org.dxworks.jsxforge.model.annotation.Annotation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Markup element. Carries at most one {@link Annotation}; {@code unwrap} marks a synthetic
 * wrapper whose tag is never emitted, only its rendered children.
 */
public final class Element extends Node {
    public final String tag;
    public final Map<String, AttributeValue> attributes;
    public final List<Node> children;
    public final Annotation annotation;
    public final boolean unwrap;

    public Element(String tag, Map<String, AttributeValue> attributes, List<Node> children,
                   Annotation annotation, boolean unwrap) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.attributes = attributes == null || attributes.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = children == null ? List.of() : List.copyOf(children);
        this.annotation = annotation;
        this.unwrap = unwrap;
    }

    public Element(String tag, Map<String, AttributeValue> attributes, List<Node> children) {
        this(tag, attributes, children, null, false);
    }

    /**
     * Synthetic wrapper that only contributes its children to the output.
     */
    public static Element synthetic(String tag, Annotation annotation, List<Node> children) {
        return new Element(tag, Map.of(), children, annotation, true);
    }

    @Override
    public NodeType getType() {
        return NodeType.ELEMENT;
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }

    public <T extends Annotation> T annotationAs(Class<T> type) {
        return type.isInstance(annotation) ? type.cast(annotation) : null;
    }

    public AttributeValue getAttribute(String name) {
        return attributes.get(name);
    }

    public String getId() {
        AttributeValue id = attributes.get("id");
        return id != null && id.isLiteral() ? id.value : null;
    }

    public List<String> getClassNames() {
        AttributeValue value = attributes.get("className");
        if (value == null) value = attributes.get("class");
        if (value == null || !value.isLiteral() || value.value.isBlank()) return List.of();
        return new ArrayList<>(Arrays.asList(value.value.trim().split("\\s+")));
    }

    public Element withChildren(List<Node> newChildren) {
        return new Element(tag, attributes, newChildren, annotation, unwrap);
    }

    public Element withAnnotation(Annotation newAnnotation) {
        return new Element(tag, attributes, children, newAnnotation, unwrap);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Element other
                && tag.equals(other.tag)
                && unwrap == other.unwrap
                && attributes.equals(other.attributes)
                && children.equals(other.children)
                && Objects.equals(annotation, other.annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, attributes, children, annotation, unwrap);
    }

    @Override
    public String toString() {
        return "Element(" + tag + (annotation != null ? " " + annotation : "") + ", " + children + ")";
    }
}
