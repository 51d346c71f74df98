package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.annotation.Slot;

/**
 * {@code <Slot name="sidebar">fallback</Slot>}. Children are the default content.
 */
public class SlotHandler implements DslHandler {
    static final String DEFAULT_SLOT_NAME = "content";

    @Override
    public String tagName() {
        return "Slot";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String name = tag.attributes.getString("name");
        Slot slot = new Slot(name != null ? name : DEFAULT_SLOT_NAME);
        return Element.synthetic("template", slot, context.buildChildren(tag));
    }
}
