package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.analyzer.SyntaxNode;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.annotation.Loop;

import java.util.List;
import java.util.Map;

import static org.dxworks.jsxforge.analyzer.SyntaxHelper.NT_JSX_EXPRESSION;
import static org.dxworks.jsxforge.analyzer.SyntaxHelper.isFunction;
import static org.dxworks.jsxforge.analyzer.SyntaxHelper.unwrapExpression;

/**
 * {@code <Loop each="items" as="item" keyExpr="id" index="i">}. The body is either plain
 * children or a single render function child.
 */
public class LoopHandler implements DslHandler {

    @Override
    public String tagName() {
        return "Loop";
    }

    @Override
    public Element handle(DslTag tag, DslContext context) {
        String each = tag.attributes.getString("each");
        String as = tag.attributes.getString("as");
        if (each == null || as == null) {
            context.warn("Loop requires 'each' and 'as' attributes", tag.node);
            return new Element("div", Map.of(), context.buildChildren(tag));
        }

        SyntaxNode renderFunction = findRenderFunction(tag);
        List<Node> body = renderFunction != null
                ? context.buildRenderFunctionBody(renderFunction, as)
                : context.buildChildren(tag);

        Loop loop = new Loop(as, each, tag.attributes.getString("keyExpr"), tag.attributes.getString("index"));
        return Element.synthetic("template", loop, body);
    }

    private static SyntaxNode findRenderFunction(DslTag tag) {
        for (SyntaxNode child : tag.children) {
            if (!child.is(NT_JSX_EXPRESSION)) continue;
            SyntaxNode inner = unwrapExpression(child);
            if (inner != null && isFunction(inner)) return inner;
        }
        return null;
    }
}
