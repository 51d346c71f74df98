package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Element;

import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Serialises plain elements: HTML for the template dialects, JSX for the component dialect.
 * Dynamic attribute values are delegated to the dialect.
 */
public final class MarkupRenderer {

    public enum Mode { HTML, JSX }

    public static final Set<String> VOID_TAGS = Set.of(
            "area", "base", "br", "col", "embed", "hr", "img", "input",
            "link", "meta", "param", "source", "track", "wbr");

    private static final Map<String, String> HTML_ATTRIBUTE_NAMES = Map.of(
            "className", "class",
            "htmlFor", "for");

    private final Mode mode;
    private final UnaryOperator<String> attributeExpression;

    private MarkupRenderer(Mode mode, UnaryOperator<String> attributeExpression) {
        this.mode = mode;
        this.attributeExpression = attributeExpression;
    }

    /**
     * @param attributeExpression spelling of a dynamic value inside a quoted HTML attribute
     */
    public static MarkupRenderer html(UnaryOperator<String> attributeExpression) {
        return new MarkupRenderer(Mode.HTML, attributeExpression);
    }

    public static MarkupRenderer jsx() {
        return new MarkupRenderer(Mode.JSX, expression -> "{" + expression + "}");
    }

    public Mode getMode() {
        return mode;
    }

    public String element(Element element, String content) {
        boolean empty = content == null || content.isEmpty();
        if (empty && (VOID_TAGS.contains(element.tag) || mode == Mode.JSX)) {
            return selfClosingTag(element);
        }
        return openingTag(element) + (empty ? "" : content) + closingTag(element);
    }

    public String openingTag(Element element) {
        return "<" + element.tag + attributes(element.attributes) + ">";
    }

    public String closingTag(Element element) {
        return "</" + element.tag + ">";
    }

    public String selfClosingTag(Element element) {
        return "<" + element.tag + attributes(element.attributes) + " />";
    }

    /**
     * Attribute list with a leading space, or the empty string.
     */
    public String attributes(Map<String, AttributeValue> attributes) {
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
            String name = attributeName(entry.getKey());
            AttributeValue value = entry.getValue();
            out.append(' ').append(name);
            if (value.isFlag()) continue;
            if (value.isLiteral()) {
                out.append("=\"").append(escapeAttribute(value.value)).append('"');
            } else if (mode == Mode.JSX) {
                out.append('=').append(attributeExpression.apply(value.value));
            } else {
                out.append("=\"").append(attributeExpression.apply(value.value)).append('"');
            }
        }
        return out.toString();
    }

    private String attributeName(String name) {
        if (mode == Mode.JSX) return name;
        return HTML_ATTRIBUTE_NAMES.getOrDefault(name, name);
    }

    public static String escapeAttribute(String value) {
        return value
                .replace("&", "&amp;")
                .replace("\"", "&quot;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }
}
