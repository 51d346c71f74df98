package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Condition;

import java.util.Map;

public class ElseIfHandler implements DslHandler {

    @Override
    public String tagName() {
        return "ElseIf";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String test = tag.attributes.getString("test");
        if (test == null) {
            context.warn("ElseIf requires a 'test' attribute", tag.node);
            return new Element("div", Map.of(), context.buildChildren(tag));
        }
        return Element.synthetic("template", Condition.elseIf(test), context.buildChildren(tag));
    }
}
