package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.analyzer.dsl.DslAttributes;
import org.dxworks.jsxforge.analyzer.dsl.DslContext;
import org.dxworks.jsxforge.analyzer.dsl.DslHandler;
import org.dxworks.jsxforge.analyzer.dsl.DslHandlerRegistry;
import org.dxworks.jsxforge.analyzer.dsl.DslTag;
import org.dxworks.jsxforge.expression.ExpressionToken;
import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Comment;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Slot;
import org.dxworks.jsxforge.model.annotation.Variable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.dxworks.jsxforge.analyzer.SyntaxHelper.*;

/**
 * Builds the intermediate tree for the markup of one component. One instance per compilation:
 * it accumulates warnings and tracks the names bound by enclosing loops.
 */
public class TemplateTreeBuilder implements DslContext {

    private static final Set<String> FRAGMENT_TAGS = Set.of("Fragment", "React.Fragment");

    private final DslHandlerRegistry dslHandlers;
    private final ExpressionAnalyzer expressionAnalyzer;
    private final Set<String> passthroughComponents;
    private final String partialPrefix;
    private final List<String> warnings = new ArrayList<>();
    private final Deque<Map<String, String>> scopes = new ArrayDeque<>();

    public TemplateTreeBuilder(DslHandlerRegistry dslHandlers, ExpressionAnalyzer expressionAnalyzer,
                               Set<String> passthroughComponents, String partialPrefix) {
        this.dslHandlers = dslHandlers;
        this.expressionAnalyzer = expressionAnalyzer;
        this.passthroughComponents = passthroughComponents;
        this.partialPrefix = partialPrefix;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * References through the props parameter ({@code props.title}) are reduced to the prop
     * name, since templates receive props as top-level variables.
     */
    public void bindPropsObject(String propsObject) {
        if (propsObject == null) return;
        Map<String, String> scope = new HashMap<>();
        scope.put(propsObject, "");
        scopes.push(scope);
    }

    // --- Markup ---

    public List<Node> buildMarkup(SyntaxNode node) {
        SyntaxNode n = unwrapParentheses(node);
        if (n == null) return List.of();
        if (isJsx(n)) return buildElement(n);
        if (n.is(NT_JSX_EXPRESSION)) return buildExpressionContainer(n);
        return buildContent(n);
    }

    private List<Node> buildElement(SyntaxNode node) {
        SyntaxNode opening = node.is(NT_JSX_SELF_CLOSING) ? node : ExpressionAnalyzer.openingElement(node);
        SyntaxNode nameNode = opening != null ? opening.childByField("name") : null;
        if (nameNode == null) {
            return buildChildNodes(node);
        }

        String tagName = nameNode.text();
        if (FRAGMENT_TAGS.contains(tagName)) {
            return buildChildNodes(node);
        }

        Optional<DslHandler> handler = dslHandlers.get(tagName);
        if (handler.isPresent()) {
            DslTag tag = new DslTag(tagName, dslAttributes(opening), node, childSyntax(node));
            return List.of(handler.get().handle(tag, this));
        }

        if (isPascalCase(tagName) || tagName.contains(".")) {
            if (passthroughComponents.contains(tagName)) {
                return List.of(new Element(tagName, attributes(opening), buildChildNodes(node)));
            }
            Include include = new Include(partialPrefix + kebabCase(tagName), componentProps(opening), tagName);
            return List.of(Element.synthetic("template", include, buildChildNodes(node)));
        }

        return List.of(new Element(tagName, attributes(opening), buildChildNodes(node)));
    }

    /**
     * Children of a JSX element with the text between them. Text is taken from the source
     * gaps between child elements and expression containers, then normalised the JSX way.
     */
    private List<Node> buildChildNodes(SyntaxNode node) {
        List<Node> result = new ArrayList<>();
        if (node.is(NT_JSX_SELF_CLOSING)) return result;

        SyntaxNode opening = ExpressionAnalyzer.openingElement(node);
        SyntaxNode closing = node.childByField("close_tag");
        if (closing == null) closing = findFirstChild(node, NT_JSX_CLOSING);
        int cursor = opening != null ? opening.end : node.start;
        int end = closing != null ? closing.start : node.end;
        String source = node.source();

        for (SyntaxNode child : childSyntax(node)) {
            if (!child.is(NT_JSX_ELEMENT, NT_JSX_SELF_CLOSING, NT_JSX_EXPRESSION)) continue;
            addText(result, source.substring(cursor, Math.max(cursor, child.start)));
            if (child.is(NT_JSX_EXPRESSION)) {
                result.addAll(buildExpressionContainer(child));
            } else {
                result.addAll(buildElement(child));
            }
            cursor = child.end;
        }
        if (end > cursor) addText(result, source.substring(cursor, end));
        return result;
    }

    private static List<SyntaxNode> childSyntax(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>();
        if (!node.is(NT_JSX_ELEMENT)) return result;
        for (SyntaxNode child : node.children) {
            if (child.is(NT_JSX_OPENING, NT_JSX_CLOSING)) continue;
            if ("open_tag".equals(child.field) || "close_tag".equals(child.field)) continue;
            result.add(child);
        }
        return result;
    }

    private static void addText(List<Node> out, String raw) {
        String text = normalizeJsxText(raw);
        if (text != null) out.add(new Text(text));
    }

    /**
     * JSX whitespace rules: a single-line run is kept as is; across lines, each line is trimmed
     * on its inner sides, blank lines are dropped and the rest joined with single spaces.
     */
    static String normalizeJsxText(String raw) {
        if (raw == null || raw.isEmpty()) return null;
        if (raw.indexOf('\n') < 0) return raw;
        String[] lines = raw.split("\r?\n", -1);
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (i > 0) line = line.stripLeading();
            if (i < lines.length - 1) line = line.stripTrailing();
            if (line.isEmpty()) continue;
            if (text.length() > 0) text.append(' ');
            text.append(line);
        }
        return text.length() == 0 ? null : text.toString();
    }

    // --- Expressions ---

    private List<Node> buildExpressionContainer(SyntaxNode container) {
        SyntaxNode inner = unwrapExpression(container);
        if (inner == null) return List.of();
        if (inner.is(NT_SPREAD_ELEMENT)) {
            warn("Spread children are not supported in templates: " + normalizeInline(container.text()), container);
            return List.of(new Comment("unsupported expression: " + normalizeInline(inner.text())));
        }
        return buildExpression(inner);
    }

    private List<Node> buildExpression(SyntaxNode expr) {
        AnalyzedExpression analyzed = expressionAnalyzer.analyze(expr);
        switch (analyzed.kind) {
            case ITERATION:
                return List.of(buildLoop(analyzed));
            case LOGICAL_AND:
                return List.of(Element.synthetic("template",
                        Condition.ifTrue(rewriteExpression(analyzed.guard)), buildContent(analyzed.consequence)));
            case TERNARY:
                return buildTernary(analyzed);
            case CHILDREN:
                return List.of(Element.synthetic("template", new Slot(Slot.DEFAULT_NAME), List.of()));
            case VARIABLE:
            case MEMBER:
                Variable variable = new Variable(rewritePath(analyzed.path), analyzed.defaultValue, null, List.of(), false);
                return List.of(Element.synthetic("span", variable, List.of()));
            case TEMPLATE_LITERAL:
                return buildTemplateLiteral(analyzed);
            case LITERAL:
                if (expr.is(NT_STRING, NT_NUMBER) && !analyzed.literalValue.isEmpty()) {
                    return List.of(new Text(analyzed.literalValue));
                }
                return List.of();
            case CALL:
                String call = rewriteExpression(normalizeInline(analyzed.raw));
                warn("Call expression emitted verbatim as a variable: " + call, expr);
                return List.of(Element.synthetic("span", new Variable(call), List.of()));
            default:
                String raw = normalizeInline(analyzed.raw);
                warn("Unsupported expression: " + raw, expr);
                return List.of(new Comment("unsupported expression: " + raw));
        }
    }

    private Element buildLoop(AnalyzedExpression analyzed) {
        String collection = rewritePath(analyzed.collection);

        Map<String, String> scope = new HashMap<>(analyzed.itemAliases);
        scope.put(analyzed.item, analyzed.item);
        if (analyzed.index != null) scope.put(analyzed.index, analyzed.index);
        scopes.push(scope);
        List<Node> body;
        String key;
        try {
            if (analyzed.body == null) {
                warn("Loop callback does not return markup: " + normalizeInline(analyzed.raw), analyzed.node);
                body = List.of();
            } else {
                body = buildContent(analyzed.body);
            }
            key = analyzed.key != null ? rewriteExpression(analyzed.key) : null;
        } finally {
            scopes.pop();
        }
        return Element.synthetic("template", new Loop(analyzed.item, collection, key, analyzed.index), body);
    }

    /**
     * {@code a ? x : b ? y : z} becomes an IF, ELSE_IF, ELSE sibling run. A nullish final
     * alternative produces no ELSE.
     */
    private List<Node> buildTernary(AnalyzedExpression analyzed) {
        List<Node> chain = new ArrayList<>();
        chain.add(Element.synthetic("template",
                Condition.ifTrue(rewriteExpression(analyzed.guard)), buildContent(analyzed.consequence)));

        SyntaxNode alternative = unwrapParentheses(analyzed.alternative);
        while (alternative != null && alternative.is(NT_TERNARY_EXPRESSION)) {
            SyntaxNode condition = alternative.childByField("condition");
            String guard = condition != null ? normalizeInline(condition.text()) : "";
            chain.add(Element.synthetic("template",
                    Condition.elseIf(rewriteExpression(guard)), buildContent(alternative.childByField("consequence"))));
            alternative = unwrapParentheses(alternative.childByField("alternative"));
        }
        if (!isNullish(alternative) && !isEmptyString(alternative)) {
            chain.add(Element.synthetic("template", Condition.otherwise(), buildContent(alternative)));
        }
        return chain;
    }

    private List<Node> buildTemplateLiteral(AnalyzedExpression analyzed) {
        List<Node> result = new ArrayList<>();
        for (Object part : analyzed.templateParts) {
            if (part instanceof String s) {
                if (!s.isEmpty()) result.add(new Text(s));
            } else if (part instanceof SyntaxNode expression) {
                result.addAll(buildExpression(expression));
            }
        }
        return result;
    }

    /**
     * Markup or value in a conditional branch or loop body.
     */
    private List<Node> buildContent(SyntaxNode node) {
        SyntaxNode n = unwrapParentheses(node);
        if (n == null || isNullish(n)) return List.of();
        if (isJsx(n)) return buildElement(n);
        if (n.is(NT_STRING)) {
            String value = ExpressionTokenizer.unquote(n.text());
            return value.isEmpty() ? List.of() : List.of(new Text(value));
        }
        return buildExpression(n);
    }

    private static boolean isEmptyString(SyntaxNode node) {
        return node.is(NT_STRING) && ExpressionTokenizer.unquote(node.text()).isEmpty();
    }

    // --- Attributes ---

    private Map<String, AttributeValue> attributes(SyntaxNode opening) {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        for (SyntaxNode child : opening.namedChildren()) {
            if (child.is(NT_JSX_EXPRESSION)) {
                warn("Spread attribute not supported in templates: " + normalizeInline(child.text()), child);
                continue;
            }
            if (!child.is(NT_JSX_ATTRIBUTE)) continue;
            SyntaxNode nameNode = child.namedChild(0);
            if (nameNode == null) continue;
            String name = nameNode.text();
            if ("key".equals(name)) continue;
            AttributeValue value = attributeValue(child.namedChild(1));
            if (value != null) attributes.put(name, value);
        }
        return attributes;
    }

    private AttributeValue attributeValue(SyntaxNode value) {
        if (value == null) return AttributeValue.flag();
        if (value.is(NT_STRING)) return AttributeValue.literal(ExpressionTokenizer.unquote(value.text()));
        if (!value.is(NT_JSX_EXPRESSION)) return AttributeValue.expression(normalizeInline(value.text()));

        SyntaxNode inner = unwrapExpression(value);
        if (inner == null || inner.is(NT_FALSE, NT_NULL, NT_UNDEFINED)) return null;
        if (inner.is(NT_TRUE)) return AttributeValue.flag();
        if (inner.is(NT_STRING)) return AttributeValue.literal(ExpressionTokenizer.unquote(inner.text()));
        if (inner.is(NT_NUMBER)) return AttributeValue.literal(inner.text());
        if (inner.is(NT_TEMPLATE_STRING) && findFirstChild(inner, NT_TEMPLATE_SUBSTITUTION) == null) {
            return AttributeValue.literal(ExpressionTokenizer.unquote(inner.text()));
        }
        return AttributeValue.expression(rewriteExpression(normalizeInline(inner.text())));
    }

    private DslAttributes dslAttributes(SyntaxNode opening) {
        Map<String, AttributeValue> values = new LinkedHashMap<>();
        Map<String, SyntaxNode> expressions = new LinkedHashMap<>();
        for (SyntaxNode child : opening.namedChildren()) {
            if (!child.is(NT_JSX_ATTRIBUTE)) continue;
            SyntaxNode nameNode = child.namedChild(0);
            if (nameNode == null) continue;
            SyntaxNode value = child.namedChild(1);
            if (value == null) {
                values.put(nameNode.text(), AttributeValue.flag());
            } else if (value.is(NT_STRING)) {
                values.put(nameNode.text(), AttributeValue.literal(ExpressionTokenizer.unquote(value.text())));
            } else {
                SyntaxNode inner = unwrapExpression(value);
                if (inner == null) continue;
                if (inner.is(NT_STRING)) {
                    values.put(nameNode.text(), AttributeValue.literal(ExpressionTokenizer.unquote(inner.text())));
                } else {
                    values.put(nameNode.text(), AttributeValue.expression(normalizeInline(inner.text())));
                    expressions.put(nameNode.text(), inner);
                }
            }
        }
        return new DslAttributes(values, expressions);
    }

    /**
     * Props passed to a component: string literals quoted, expressions verbatim, bare flags
     * {@code true}, spreads keyed {@code ...0}, {@code ...1}.
     */
    private Map<String, String> componentProps(SyntaxNode opening) {
        Map<String, String> props = new LinkedHashMap<>();
        int spreads = 0;
        for (SyntaxNode child : opening.namedChildren()) {
            if (child.is(NT_JSX_EXPRESSION)) {
                SyntaxNode spread = findFirstChild(child, NT_SPREAD_ELEMENT);
                SyntaxNode argument = spread != null ? firstNamedNonComment(spread) : null;
                if (argument != null) {
                    props.put("..." + spreads++, rewriteExpression(normalizeInline(argument.text())));
                }
                continue;
            }
            if (!child.is(NT_JSX_ATTRIBUTE)) continue;
            SyntaxNode nameNode = child.namedChild(0);
            if (nameNode == null || "key".equals(nameNode.text())) continue;
            SyntaxNode value = child.namedChild(1);
            if (value == null) {
                props.put(nameNode.text(), "true");
            } else if (value.is(NT_STRING)) {
                props.put(nameNode.text(), "\"" + ExpressionTokenizer.unquote(value.text()) + "\"");
            } else {
                SyntaxNode inner = unwrapExpression(value);
                if (inner != null) props.put(nameNode.text(), rewriteExpression(normalizeInline(inner.text())));
            }
        }
        return props;
    }

    // --- Loop-bound names ---

    /**
     * Applies the innermost binding of a path's root identifier.
     */
    String rewritePath(String path) {
        if (path == null) return null;
        String root = ExpressionTokenizer.rootOf(path);
        String replacement = lookup(root);
        if (replacement == null || replacement.equals(root)) return path;
        String rest = path.substring(root.length());
        if (replacement.isEmpty()) {
            return rest.startsWith(".") && rest.length() > 1 ? rest.substring(1) : path;
        }
        return replacement + rest;
    }

    String rewriteExpression(String expression) {
        if (expression == null || scopes.isEmpty()) return expression;
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize(expression);
        StringBuilder out = new StringBuilder();
        ExpressionToken previous = null;
        for (int i = 0; i < tokens.size(); i++) {
            ExpressionToken token = tokens.get(i);
            if (token.is(ExpressionToken.Type.IDENTIFIER)
                    && (previous == null || !(previous.isOperator(".") || previous.isOperator("?.")))) {
                String replacement = lookup(token.text);
                if (replacement != null && replacement.isEmpty()) {
                    // drop "props." and keep the member name as the root
                    ExpressionToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                    if (next != null && (next.isOperator(".") || next.isOperator("?."))) {
                        i++;
                        previous = next;
                        continue;
                    }
                    out.append(token.text);
                } else {
                    out.append(replacement != null ? replacement : token.text);
                }
            } else {
                out.append(token.text);
            }
            if (!token.is(ExpressionToken.Type.WHITESPACE)) previous = token;
        }
        return out.toString();
    }

    private String lookup(String name) {
        for (Map<String, String> scope : scopes) {
            if (scope.containsKey(name)) return scope.get(name);
        }
        return null;
    }

    // --- DslContext ---

    @Override
    public List<Node> buildChildren(DslTag tag) {
        return buildChildNodes(tag.node);
    }

    @Override
    public List<Node> buildRenderFunctionBody(SyntaxNode function, String itemName) {
        List<SyntaxNode> parameters = functionParameters(function);
        Map<String, String> scope = new HashMap<>();
        if (!parameters.isEmpty()) {
            String parameter = parameterName(parameters.get(0));
            if (parameter != null) {
                scope.put(parameter, itemName);
            } else {
                scope.putAll(destructuredAliases(parameters.get(0), itemName));
            }
        }
        scope.putIfAbsent(itemName, itemName);
        scopes.push(scope);
        try {
            return buildContent(functionReturnValue(function));
        } finally {
            scopes.pop();
        }
    }

    @Override
    public String textContent(DslTag tag) {
        StringBuilder text = new StringBuilder();
        for (SyntaxNode child : tag.children) {
            if (child.is(NT_JSX_EXPRESSION)) {
                SyntaxNode inner = unwrapExpression(child);
                if (inner != null) text.append(ExpressionTokenizer.unquote(inner.text()));
            } else if (!child.is(NT_JSX_ELEMENT, NT_JSX_SELF_CLOSING)) {
                text.append(child.text());
            }
        }
        return normalizeInline(text.toString());
    }

    @Override
    public void warn(String message, SyntaxNode at) {
        warnings.add(at != null ? message + " (line " + at.line + ")" : message);
    }
}
