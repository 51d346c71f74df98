package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.model.Element;

/**
 * Turns one DSL component tag into an annotated element. A malformed tag produces a warning
 * and a safe substitute, never an exception.
 */
public interface DslHandler {

    String tagName();

    Element handle(DslTag tag, DslContext context);
}
