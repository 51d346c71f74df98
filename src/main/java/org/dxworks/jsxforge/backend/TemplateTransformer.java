package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.Comment;
import org.dxworks.jsxforge.model.Doctype;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Block;
import org.dxworks.jsxforge.model.annotation.Branch;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Slot;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.dxworks.jsxforge.tree.Trees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives a backend over an annotated tree. Children are rendered first, so backends only ever
 * see serialized text. Runs of IF, ELSE_IF and ELSE siblings are folded into one
 * {@link ConditionChain}.
 */
public class TemplateTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateTransformer.class);

    public TemplateOutput transform(Root root, TemplateBackend backend, RenderContext context) {
        String body = renderChildren(root.children, backend, context);
        String content = backend.finishDocument(root, body, context);
        List<String> variables = Trees.collectVariables(root);
        List<String> dependencies = Trees.collectDependencies(root);
        LOG.debug("Rendered {} nodes as {}: {} variables, {} dependencies",
                Trees.countNodes(root), backend.name(), variables.size(), dependencies.size());
        return new TemplateOutput(backend.outputFileName(root.meta), content, variables, dependencies,
                context.getWarnings());
    }

    /**
     * Renders one element on its own. A lone ELSE or ELSE_IF is dangling here.
     */
    public String transformElement(Element element, TemplateBackend backend, RenderContext context) {
        return renderChildren(List.of(element), backend, context);
    }

    String renderChildren(List<Node> children, TemplateBackend backend, RenderContext context) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < children.size()) {
            Node child = children.get(i);
            Condition condition = conditionOf(child);
            if (condition == null) {
                out.append(renderNode(child, backend, context));
                i++;
            } else if (condition.branch == Branch.IF) {
                List<ConditionBranch> branches = new ArrayList<>();
                branches.add(new ConditionBranch(condition, renderInner((Element) child, backend, context)));
                i = foldBranches(children, i + 1, branches, backend, context);
                out.append(backend.renderCondition(new ConditionChain(branches), context));
            } else {
                String name = condition.branch == Branch.ELSE ? "Else" : "ElseIf";
                context.warn(name + " without a preceding If");
                out.append(ConditionChains.danglingMarker(condition.branch))
                        .append(renderInner((Element) child, backend, context));
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Collects the ELSE_IF and ELSE siblings that continue a chain. Whitespace between branches
     * belongs to the chain only when another branch follows it.
     *
     * @return index of the first sibling after the chain
     */
    private int foldBranches(List<Node> children, int from, List<ConditionBranch> branches,
                             TemplateBackend backend, RenderContext context) {
        int next = from;
        while (true) {
            int candidate = next;
            while (candidate < children.size() && isBlankText(children.get(candidate))) candidate++;
            if (candidate >= children.size()) return next;
            Condition condition = conditionOf(children.get(candidate));
            if (condition == null || condition.branch == Branch.IF) return next;
            branches.add(new ConditionBranch(condition, renderInner((Element) children.get(candidate), backend, context)));
            next = candidate + 1;
            if (condition.branch == Branch.ELSE) return next;
        }
    }

    private String renderNode(Node node, TemplateBackend backend, RenderContext context) {
        if (node instanceof Text text) return backend.renderText(text.value);
        if (node instanceof Comment comment) return backend.renderComment(comment.value);
        if (node instanceof Doctype doctype) return backend.renderDoctype(doctype);
        if (node instanceof Element element) return renderElement(element, backend, context);
        return renderChildren(Trees.childrenOf(node), backend, context);
    }

    private String renderElement(Element element, TemplateBackend backend, RenderContext context) {
        if (element.annotation == null) {
            String children = renderChildren(element.children, backend, context);
            return element.unwrap ? children : backend.markup().element(element, children);
        }

        if (element.annotation instanceof Variable variable) {
            return wrap(element, backend.renderVariable(variable, context), backend);
        }
        if (element.annotation instanceof Include include) {
            String children = renderChildren(element.children, backend, context);
            return wrap(element, backend.renderInclude(include, children, context), backend);
        }
        if (element.annotation instanceof Loop loop) {
            Loop resolved = new Loop(loop.item, loop.collection, LoopKeys.resolve(loop, element.children), loop.index);
            return backend.renderLoop(resolved, renderInner(element, backend, context), context);
        }
        if (element.annotation instanceof Slot slot) {
            return backend.renderSlot(slot, renderInner(element, backend, context), context);
        }
        if (element.annotation instanceof Block block) {
            if (block.isExtends()) return backend.renderExtends(block.extendsTemplate, context);
            return backend.renderBlock(block, renderInner(element, backend, context), context);
        }
        // conditions are folded by renderChildren
        return renderChildren(List.of(element), backend, context);
    }

    /**
     * The element's own markup around its rendered children, or just the children when the
     * element is a synthetic wrapper.
     */
    private String renderInner(Element element, TemplateBackend backend, RenderContext context) {
        String children = renderChildren(element.children, backend, context);
        return element.unwrap ? children : backend.markup().element(element, children);
    }

    private static String wrap(Element element, String rendered, TemplateBackend backend) {
        return element.unwrap ? rendered : backend.markup().element(element, rendered);
    }

    private static Condition conditionOf(Node node) {
        return node instanceof Element element ? element.annotationAs(Condition.class) : null;
    }

    private static boolean isBlankText(Node node) {
        return node instanceof Text text && text.value.isBlank();
    }
}
