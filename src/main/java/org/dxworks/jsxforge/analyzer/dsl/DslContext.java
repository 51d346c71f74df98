package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.analyzer.SyntaxNode;
import org.dxworks.jsxforge.model.Node;

import java.util.List;

/**
 * What a {@link DslHandler} may ask of the tree builder during one compilation.
 */
public interface DslContext {

    /**
     * Builds the tag's children as ordinary markup.
     */
    List<Node> buildChildren(DslTag tag);

    /**
     * Builds the body returned by a render function such as {@code (item) => <li/>}.
     * Destructured parameters are rewritten to member paths on {@code itemName}.
     */
    List<Node> buildRenderFunctionBody(SyntaxNode function, String itemName);

    /**
     * Concatenated static text of the tag's children, trimmed.
     */
    String textContent(DslTag tag);

    void warn(String message, SyntaxNode at);
}
