package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.analyzer.SyntaxNode;
import org.dxworks.jsxforge.model.AttributeValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes of a DSL tag, with access to the syntax of expression values.
 */
public final class DslAttributes {
    private final Map<String, AttributeValue> values;
    private final Map<String, SyntaxNode> expressionNodes;

    public DslAttributes(Map<String, AttributeValue> values, Map<String, SyntaxNode> expressionNodes) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.expressionNodes = Collections.unmodifiableMap(new LinkedHashMap<>(expressionNodes));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Literal value or expression source text; null for absent attributes and bare flags.
     */
    public String getString(String name) {
        AttributeValue value = values.get(name);
        if (value == null || value.isFlag()) return null;
        String text = value.value.trim();
        return text.isEmpty() ? null : text;
    }

    public boolean getBoolean(String name) {
        AttributeValue value = values.get(name);
        if (value == null) return false;
        return value.isFlag() || "true".equals(value.value);
    }

    public SyntaxNode expressionNode(String name) {
        return expressionNodes.get(name);
    }

    public Map<String, AttributeValue> asMap() {
        return values;
    }
}
