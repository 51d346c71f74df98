package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Variable;

import java.util.List;
import java.util.Map;

/**
 * {@code <Raw>content</Raw>}: unescaped output of the named value.
 */
public class RawHandler implements DslHandler {

    @Override
    public String tagName() {
        return "Raw";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String name = context.textContent(tag);
        if (name.isEmpty()) {
            context.warn("Raw requires text content naming the value to output", tag.node);
            return new Element("span", Map.of(), List.of());
        }
        return Element.synthetic("span", new Variable(name).asRaw(), List.of());
    }
}
