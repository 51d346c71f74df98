package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Condition;

public class ElseHandler implements DslHandler {

    @Override
    public String tagName() {
        return "Else";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        return Element.synthetic("template", Condition.otherwise(), context.buildChildren(tag));
    }
}
