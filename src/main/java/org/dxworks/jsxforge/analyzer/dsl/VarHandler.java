package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code <Var name="user.name" default="Guest" filter="truncate" args="20" raw />}, or the
 * variable name as text content: {@code <Var>title</Var>}.
 */
public class VarHandler implements DslHandler {

    @Override
    public String tagName() {
        return "Var";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String name = tag.attributes.getString("name");
        if (name == null) {
            String text = context.textContent(tag);
            name = text.isEmpty() ? null : text;
        }
        if (name == null) {
            context.warn("Var requires a 'name' attribute or text content", tag.node);
            return new Element("span", Map.of(), List.of());
        }

        Variable variable = new Variable(name,
                tag.attributes.getString("default"),
                tag.attributes.getString("filter"),
                splitArgs(tag.attributes.getString("args")),
                tag.attributes.getBoolean("raw"));
        return Element.synthetic("span", variable, List.of());
    }

    /**
     * Comma-separated filter arguments. A quoted argument keeps its quotes and inner spaces, so
     * {@code args="' / ', 2"} gives {@code ' / '} and {@code 2}.
     */
    static List<String> splitArgs(String args) {
        List<String> result = new ArrayList<>();
        if (args == null) return result;
        StringBuilder current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == ',') {
                addArg(current, result);
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        addArg(current, result);
        return result;
    }

    private static void addArg(StringBuilder part, List<String> result) {
        String trimmed = part.toString().trim();
        if (!trimmed.isEmpty()) result.add(trimmed);
    }
}
