package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Condition;

import java.util.Map;

public class IfHandler implements DslHandler {

    @Override
    public String tagName() {
        return "If";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String test = tag.attributes.getString("test");
        if (test == null) {
            context.warn("If requires a 'test' attribute", tag.node);
            return new Element("div", Map.of(), context.buildChildren(tag));
        }
        return Element.synthetic("template", Condition.ifTrue(test), context.buildChildren(tag));
    }
}
