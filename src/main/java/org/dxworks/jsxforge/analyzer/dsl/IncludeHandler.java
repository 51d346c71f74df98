package org.dxworks.jsxforge.analyzer.dsl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.jsxforge.analyzer.SyntaxNode;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Include;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.jsxforge.analyzer.SyntaxHelper.NT_OBJECT;
import static org.dxworks.jsxforge.analyzer.SyntaxHelper.objectLiteralEntries;

/**
 * {@code <Include partial="partials/card" props='{"title": "Hi"}' />} or
 * {@code props={{ title: pageTitle }}}. Prop values are stored as expressions: JSON strings
 * become quoted literals.
 */
public class IncludeHandler implements DslHandler {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> PROPS_TYPE = new TypeReference<>() { };

    @Override
    public String tagName() {
        return "Include";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String partial = tag.attributes.getString("partial");
        if (partial == null) {
            context.warn("Include requires a 'partial' attribute", tag.node);
            return new Element("div", Map.of(), List.of());
        }
        Include include = new Include(partial, readProps(tag, context), null);
        return Element.synthetic("template", include, context.buildChildren(tag));
    }

    private Map<String, String> readProps(DslTag tag, DslContext context) {
        if (!tag.attributes.has("props")) return Map.of();

        SyntaxNode expression = tag.attributes.expressionNode("props");
        if (expression != null && expression.is(NT_OBJECT)) {
            return objectLiteralEntries(expression);
        }

        String json = tag.attributes.getString("props");
        if (json == null) return Map.of();
        try {
            Map<String, Object> parsed = MAPPER.readValue(json, PROPS_TYPE);
            Map<String, String> props = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : parsed.entrySet()) {
                props.put(entry.getKey(), toExpression(entry.getValue()));
            }
            return props;
        } catch (JsonProcessingException e) {
            context.warn("Include props are not a valid JSON object: " + e.getOriginalMessage(), tag.node);
            return Map.of();
        }
    }

    private static String toExpression(Object value) throws JsonProcessingException {
        if (value instanceof String s) return "\"" + s.replace("\"", "\\\"") + "\"";
        if (value == null) return "null";
        if (value instanceof Number || value instanceof Boolean) return value.toString();
        return MAPPER.writeValueAsString(value);
    }
}
