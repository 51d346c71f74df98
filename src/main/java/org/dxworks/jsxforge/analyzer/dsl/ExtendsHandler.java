package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Block;

import java.util.List;
import java.util.Map;

public class ExtendsHandler implements DslHandler {

    @Override
    public String tagName() {
        return "Extends";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String layout = tag.attributes.getString("layout");
        if (layout == null) {
            context.warn("Extends requires a 'layout' attribute", tag.node);
            return new Element("div", Map.of(), List.of());
        }
        return Element.synthetic("template", Block.extending(layout), List.of());
    }
}
