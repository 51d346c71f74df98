package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.expression.ExpressionTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.dxworks.jsxforge.analyzer.SyntaxHelper.*;

/**
 * Classifies embedded expressions. Precedence is fixed: iteration, logical AND, ternary,
 * children reference, variable, member path, template literal, literal, call, unknown.
 * Stateless, so one instance can be shared.
 */
public class ExpressionAnalyzer {

    static final String CHILDREN = "children";
    static final String DESTRUCTURED_ITEM = "item";

    public AnalyzedExpression analyze(SyntaxNode expression) {
        SyntaxNode expr = unwrapParentheses(expression);
        if (expr == null) {
            return AnalyzedExpression.of(ExpressionKind.UNKNOWN, expression).build();
        }

        AnalyzedExpression iteration = analyzeIteration(expr);
        if (iteration != null) return iteration;

        if (expr.is(NT_BINARY_EXPRESSION)) {
            String operator = operatorOf(expr);
            SyntaxNode left = expr.childByField("left");
            SyntaxNode right = expr.childByField("right");
            if ("&&".equals(operator) && left != null && right != null) {
                return AnalyzedExpression.of(ExpressionKind.LOGICAL_AND, expr)
                        .condition(normalizeInline(left.text()), right, null)
                        .build();
            }
            AnalyzedExpression withDefault = analyzeDefaulted(expr, operator, left, right);
            if (withDefault != null) return withDefault;
        }

        if (expr.is(NT_TERNARY_EXPRESSION)) {
            SyntaxNode condition = expr.childByField("condition");
            return AnalyzedExpression.of(ExpressionKind.TERNARY, expr)
                    .condition(condition != null ? normalizeInline(condition.text()) : "",
                            expr.childByField("consequence"), expr.childByField("alternative"))
                    .build();
        }

        if (expr.is(NT_IDENTIFIER)) {
            String name = expr.text();
            ExpressionKind kind = CHILDREN.equals(name) ? ExpressionKind.CHILDREN : ExpressionKind.VARIABLE;
            return AnalyzedExpression.of(kind, expr).path(name, name).build();
        }

        if (expr.is(NT_MEMBER_EXPRESSION, NT_SUBSCRIPT_EXPRESSION)) {
            String path = toPath(expr);
            if (path != null) {
                return AnalyzedExpression.of(ExpressionKind.MEMBER, expr)
                        .path(path, ExpressionTokenizer.rootOf(path))
                        .build();
            }
        }

        if (expr.is(NT_TEMPLATE_STRING)) {
            return AnalyzedExpression.of(ExpressionKind.TEMPLATE_LITERAL, expr)
                    .templateParts(templateParts(expr))
                    .build();
        }

        if (isLiteral(expr)) {
            String value = expr.is(NT_STRING) ? ExpressionTokenizer.unquote(expr.text()) : expr.text();
            return AnalyzedExpression.of(ExpressionKind.LITERAL, expr).literal(value).build();
        }

        if (expr.is(NT_CALL_EXPRESSION) || findFirstDescendant(expr, NT_CALL_EXPRESSION) != null) {
            return AnalyzedExpression.of(ExpressionKind.CALL, expr).build();
        }

        return AnalyzedExpression.of(ExpressionKind.UNKNOWN, expr).build();
    }

    /**
     * {@code collection.map((item, index) => <li key={item.id}/>)}
     */
    private AnalyzedExpression analyzeIteration(SyntaxNode expr) {
        if (!expr.is(NT_CALL_EXPRESSION)) return null;
        SyntaxNode function = expr.childByField("function");
        if (function == null || !function.is(NT_MEMBER_EXPRESSION)) return null;
        SyntaxNode property = function.childByField("property");
        if (property == null || !"map".equals(property.text())) return null;

        SyntaxNode arguments = expr.childByField("arguments");
        SyntaxNode callback = arguments != null ? unwrapParentheses(firstNamedNonComment(arguments)) : null;
        if (!isFunction(callback)) return null;

        SyntaxNode object = function.childByField("object");
        String collection = toPath(object);
        if (collection == null) collection = object != null ? normalizeInline(object.text()) : "";

        List<SyntaxNode> parameters = functionParameters(callback);
        String item = parameters.isEmpty() ? DESTRUCTURED_ITEM : parameterName(parameters.get(0));
        Map<String, String> aliases = Map.of();
        if (item == null) {
            item = DESTRUCTURED_ITEM;
            aliases = destructuredAliases(parameters.get(0), DESTRUCTURED_ITEM);
        }
        String index = parameters.size() > 1 ? parameterName(parameters.get(1)) : null;

        SyntaxNode body = functionReturnValue(callback);
        return AnalyzedExpression.of(ExpressionKind.ITERATION, expr)
                .loop(collection, item, index, keyOf(body), body, aliases)
                .build();
    }

    /**
     * {@code title || "Untitled"} and {@code title ?? "Untitled"} read as a variable with a default.
     */
    private AnalyzedExpression analyzeDefaulted(SyntaxNode expr, String operator, SyntaxNode left, SyntaxNode right) {
        if (!"||".equals(operator) && !"??".equals(operator)) return null;
        String path = toPath(left);
        SyntaxNode fallback = unwrapParentheses(right);
        if (path == null || fallback == null || !fallback.is(NT_STRING, NT_NUMBER, NT_TRUE, NT_FALSE)) return null;
        String value = fallback.is(NT_STRING) ? ExpressionTokenizer.unquote(fallback.text()) : fallback.text();
        ExpressionKind kind = path.contains(".") ? ExpressionKind.MEMBER : ExpressionKind.VARIABLE;
        return AnalyzedExpression.of(kind, expr)
                .path(path, ExpressionTokenizer.rootOf(path))
                .defaultValue(value)
                .build();
    }

    static String keyOf(SyntaxNode body) {
        if (!isJsx(body)) return null;
        SyntaxNode opening = body.is(NT_JSX_ELEMENT) ? openingElement(body) : body;
        if (opening == null) return null;
        for (SyntaxNode attribute : findAllChildren(opening, NT_JSX_ATTRIBUTE)) {
            SyntaxNode name = attribute.namedChild(0);
            SyntaxNode value = attribute.namedChild(1);
            if (name == null || value == null || !"key".equals(name.text())) continue;
            if (value.is(NT_STRING)) return ExpressionTokenizer.unquote(value.text());
            SyntaxNode inner = unwrapExpression(value);
            return inner != null ? normalizeInline(inner.text()) : null;
        }
        return null;
    }

    static SyntaxNode openingElement(SyntaxNode jsxElement) {
        SyntaxNode open = jsxElement.childByField("open_tag");
        return open != null ? open : findFirstChild(jsxElement, NT_JSX_OPENING);
    }

    static String operatorOf(SyntaxNode binary) {
        SyntaxNode operator = binary.childByField("operator");
        if (operator != null) return operator.text();
        for (SyntaxNode child : binary.children) {
            if (!child.named) return child.text();
        }
        return null;
    }

    /**
     * Literal text and substitution expressions of a template string, in order.
     */
    private static List<Object> templateParts(SyntaxNode template) {
        List<Object> parts = new ArrayList<>();
        String source = template.source();
        int cursor = template.start + 1;
        int end = template.end - 1;
        for (SyntaxNode child : template.children) {
            if (!child.is(NT_TEMPLATE_SUBSTITUTION)) continue;
            if (child.start > cursor) parts.add(source.substring(cursor, child.start));
            SyntaxNode inner = firstNamedNonComment(child);
            if (inner != null) parts.add(inner);
            cursor = child.end;
        }
        if (end > cursor) parts.add(source.substring(cursor, end));
        return parts;
    }
}
