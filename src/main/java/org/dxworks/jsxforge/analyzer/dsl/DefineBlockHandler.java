package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Block;

import java.util.Map;

public class DefineBlockHandler implements DslHandler {

    @Override
    public String tagName() {
        return "DefineBlock";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String name = tag.attributes.getString("name");
        if (name == null) {
            context.warn("DefineBlock requires a 'name' attribute", tag.node);
            return new Element("div", Map.of(), context.buildChildren(tag));
        }
        return Element.synthetic("template", new Block(name), context.buildChildren(tag));
    }
}
