package org.dxworks.jsxforge.tree;

import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Comment;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Annotation;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Short-hand constructors for building trees in code.
 */
public final class Nodes {

    private Nodes() {
    }

    public static Text text(String value) {
        return new Text(value);
    }

    public static Comment comment(String value) {
        return new Comment(value);
    }

    public static Element element(String tag, Node... children) {
        return new Element(tag, Map.of(), Arrays.asList(children));
    }

    public static Element element(String tag, Map<String, AttributeValue> attributes, Node... children) {
        return new Element(tag, attributes, Arrays.asList(children));
    }

    public static Root root(Node... children) {
        return new Root(Arrays.asList(children));
    }

    public static Element annotate(Element element, Annotation annotation) {
        return element.withAnnotation(annotation);
    }

    /**
     * Synthetic annotated wrapper, never emitted as a tag.
     */
    public static Element wrap(Annotation annotation, Node... children) {
        return Element.synthetic("template", annotation, List.of(children));
    }
}
