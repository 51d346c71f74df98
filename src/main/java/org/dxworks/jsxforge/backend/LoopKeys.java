package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.expression.ExpressionToken;
import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.dxworks.jsxforge.tree.Trees;
import org.dxworks.jsxforge.tree.VisitAction;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Key resolution for loops: the explicit key, else an identifier-like field of the item that
 * the body references, else the positional index.
 */
public final class LoopKeys {

    public static final String DEFAULT_INDEX = "index";

    static final List<String> ID_FIELDS = List.of("id", "_id", "key", "uuid", "slug");

    private LoopKeys() {
    }

    public static String resolve(Loop loop, List<Node> body) {
        if (loop.key != null && !loop.key.isBlank()) return explicitKey(loop);
        String field = identifierField(loop.item, referencedFields(loop.item, body));
        if (field != null) return loop.item + "." + field;
        return indexName(loop);
    }

    public static String indexName(Loop loop) {
        return loop.index != null ? loop.index : DEFAULT_INDEX;
    }

    /**
     * {@code keyExpr="id"} names a field of the item.
     */
    private static String explicitKey(Loop loop) {
        String key = loop.key.trim();
        if (ExpressionTokenizer.isIdentifier(key) && !key.equals(loop.item) && !key.equals(loop.index)) {
            return loop.item + "." + key;
        }
        return key;
    }

    static String identifierField(String item, Set<String> fields) {
        for (String candidate : ID_FIELDS) {
            if (fields.contains(candidate)) return candidate;
        }
        for (String field : fields) {
            if (field.length() > 2 && field.endsWith("Id")) return field;
        }
        return null;
    }

    /**
     * Fields read directly off {@code item} anywhere in the body, in first-occurrence order.
     */
    static Set<String> referencedFields(String item, List<Node> body) {
        Set<String> fields = new LinkedHashSet<>();
        for (Node node : body) {
            for (String expression : expressions(node, item)) {
                collectFields(item, expression, fields);
            }
        }
        return fields;
    }

    private static List<String> expressions(Node tree, String item) {
        List<String> result = new ArrayList<>();
        Trees.visit(tree, (node, parent, depth) -> {
            if (!(node instanceof Element element)) return VisitAction.CONTINUE;
            for (AttributeValue value : element.attributes.values()) {
                if (value.isExpression()) result.add(value.value);
            }
            if (element.annotation instanceof Variable variable) {
                result.add(variable.name);
            } else if (element.annotation instanceof Condition condition && condition.expression != null) {
                result.add(condition.expression);
            } else if (element.annotation instanceof Include include) {
                result.addAll(include.props.values());
            } else if (element.annotation instanceof Loop inner) {
                result.add(inner.collection);
                if (inner.item.equals(item)) return VisitAction.SKIP_CHILDREN;
            }
            return VisitAction.CONTINUE;
        });
        return result;
    }

    private static void collectFields(String item, String expression, Set<String> fields) {
        List<ExpressionToken> tokens = significant(ExpressionTokenizer.tokenize(expression));
        for (int i = 0; i + 2 < tokens.size(); i++) {
            ExpressionToken root = tokens.get(i);
            ExpressionToken access = tokens.get(i + 1);
            ExpressionToken field = tokens.get(i + 2);
            boolean afterMember = i > 0 && (tokens.get(i - 1).isOperator(".") || tokens.get(i - 1).isOperator("?."));
            if (!afterMember && root.is(ExpressionToken.Type.IDENTIFIER) && root.text.equals(item)
                    && (access.isOperator(".") || access.isOperator("?."))
                    && field.is(ExpressionToken.Type.IDENTIFIER)) {
                fields.add(field.text);
            }
        }
    }

    private static List<ExpressionToken> significant(List<ExpressionToken> tokens) {
        List<ExpressionToken> result = new ArrayList<>();
        for (ExpressionToken token : tokens) {
            if (!token.is(ExpressionToken.Type.WHITESPACE)) result.add(token);
        }
        return result;
    }
}
