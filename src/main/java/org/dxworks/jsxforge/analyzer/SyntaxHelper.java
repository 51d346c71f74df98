package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.expression.ExpressionTokenizer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node kinds of the JavaScript/JSX grammar and small helpers over {@link SyntaxNode}.
 */
public final class SyntaxHelper {

    public static final String NT_PROGRAM = "program";
    public static final String NT_COMMENT = "comment";
    public static final String NT_IMPORT_STATEMENT = "import_statement";
    public static final String NT_EXPORT_STATEMENT = "export_statement";
    public static final String NT_FUNCTION_DECLARATION = "function_declaration";
    public static final String NT_FUNCTION_EXPRESSION = "function_expression";
    public static final String NT_FUNCTION = "function";
    public static final String NT_ARROW_FUNCTION = "arrow_function";
    public static final String NT_LEXICAL_DECLARATION = "lexical_declaration";
    public static final String NT_VARIABLE_DECLARATION = "variable_declaration";
    public static final String NT_VARIABLE_DECLARATOR = "variable_declarator";
    public static final String NT_STATEMENT_BLOCK = "statement_block";
    public static final String NT_RETURN_STATEMENT = "return_statement";
    public static final String NT_PARENTHESIZED = "parenthesized_expression";
    public static final String NT_FORMAL_PARAMETERS = "formal_parameters";
    public static final String NT_OBJECT_PATTERN = "object_pattern";
    public static final String NT_ARRAY_PATTERN = "array_pattern";
    public static final String NT_SHORTHAND_PATTERN = "shorthand_property_identifier_pattern";
    public static final String NT_PAIR_PATTERN = "pair_pattern";
    public static final String NT_OBJECT_ASSIGNMENT_PATTERN = "object_assignment_pattern";
    public static final String NT_ASSIGNMENT_PATTERN = "assignment_pattern";
    public static final String NT_REST_PATTERN = "rest_pattern";

    public static final String NT_JSX_ELEMENT = "jsx_element";
    public static final String NT_JSX_SELF_CLOSING = "jsx_self_closing_element";
    public static final String NT_JSX_OPENING = "jsx_opening_element";
    public static final String NT_JSX_CLOSING = "jsx_closing_element";
    public static final String NT_JSX_ATTRIBUTE = "jsx_attribute";
    public static final String NT_JSX_EXPRESSION = "jsx_expression";
    public static final String NT_JSX_TEXT = "jsx_text";

    public static final String NT_IDENTIFIER = "identifier";
    public static final String NT_PROPERTY_IDENTIFIER = "property_identifier";
    public static final String NT_MEMBER_EXPRESSION = "member_expression";
    public static final String NT_SUBSCRIPT_EXPRESSION = "subscript_expression";
    public static final String NT_CALL_EXPRESSION = "call_expression";
    public static final String NT_BINARY_EXPRESSION = "binary_expression";
    public static final String NT_TERNARY_EXPRESSION = "ternary_expression";
    public static final String NT_STRING = "string";
    public static final String NT_TEMPLATE_STRING = "template_string";
    public static final String NT_TEMPLATE_SUBSTITUTION = "template_substitution";
    public static final String NT_NUMBER = "number";
    public static final String NT_TRUE = "true";
    public static final String NT_FALSE = "false";
    public static final String NT_NULL = "null";
    public static final String NT_UNDEFINED = "undefined";
    public static final String NT_OBJECT = "object";
    public static final String NT_PAIR = "pair";
    public static final String NT_SHORTHAND_PROPERTY = "shorthand_property_identifier";
    public static final String NT_SPREAD_ELEMENT = "spread_element";

    private SyntaxHelper() {
    }

    public static boolean isFunction(SyntaxNode node) {
        return node != null && node.is(NT_ARROW_FUNCTION, NT_FUNCTION_EXPRESSION, NT_FUNCTION);
    }

    public static boolean isJsx(SyntaxNode node) {
        return node != null && node.is(NT_JSX_ELEMENT, NT_JSX_SELF_CLOSING);
    }

    public static boolean isNullish(SyntaxNode node) {
        return node == null || node.is(NT_NULL, NT_UNDEFINED, NT_FALSE);
    }

    public static boolean isLiteral(SyntaxNode node) {
        return node != null && node.is(NT_STRING, NT_NUMBER, NT_TRUE, NT_FALSE, NT_NULL, NT_UNDEFINED);
    }

    public static SyntaxNode unwrapParentheses(SyntaxNode node) {
        SyntaxNode current = node;
        while (current != null && current.is(NT_PARENTHESIZED)) {
            current = firstNamedNonComment(current);
        }
        return current;
    }

    /**
     * The expression inside a {@code {...}} container, parentheses removed; null for an empty
     * or comment-only container.
     */
    public static SyntaxNode unwrapExpression(SyntaxNode container) {
        if (container == null) return null;
        if (!container.is(NT_JSX_EXPRESSION)) return unwrapParentheses(container);
        return unwrapParentheses(firstNamedNonComment(container));
    }

    public static SyntaxNode firstNamedNonComment(SyntaxNode node) {
        for (SyntaxNode child : node.children) {
            if (child.named && !child.is(NT_COMMENT)) return child;
        }
        return null;
    }

    public static SyntaxNode findFirstChild(SyntaxNode parent, String... kinds) {
        if (parent == null) return null;
        for (SyntaxNode child : parent.children) {
            if (child.named && child.is(kinds)) return child;
        }
        return null;
    }

    public static List<SyntaxNode> findAllChildren(SyntaxNode parent, String... kinds) {
        List<SyntaxNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (SyntaxNode child : parent.children) {
            if (child.named && child.is(kinds)) result.add(child);
        }
        return result;
    }

    public static SyntaxNode findFirstDescendant(SyntaxNode root, String... kinds) {
        if (root == null) return null;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.is(kinds)) return node;
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return null;
    }

    public static List<SyntaxNode> findAllDescendants(SyntaxNode root, String... kinds) {
        List<SyntaxNode> result = new ArrayList<>();
        if (root == null) return result;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.is(kinds)) result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return result;
    }

    /**
     * Dotted path for identifiers and member chains ({@code a.b?.c}, {@code a["b"]},
     * {@code a[0]}); null when the chain contains anything else, such as a call.
     */
    public static String toPath(SyntaxNode node) {
        SyntaxNode n = unwrapParentheses(node);
        if (n == null) return null;
        if (n.is(NT_IDENTIFIER)) return n.text();
        if (n.is(NT_MEMBER_EXPRESSION)) {
            String object = toPath(n.childByField("object"));
            SyntaxNode property = n.childByField("property");
            if (object == null || property == null) return null;
            return object + "." + property.text();
        }
        if (n.is(NT_SUBSCRIPT_EXPRESSION)) {
            String object = toPath(n.childByField("object"));
            SyntaxNode index = unwrapParentheses(n.childByField("index"));
            if (object == null || index == null) return null;
            if (index.is(NT_NUMBER)) return object + "." + index.text();
            if (index.is(NT_STRING)) {
                String key = ExpressionTokenizer.unquote(index.text());
                return ExpressionTokenizer.isIdentifier(key) ? object + "." + key : null;
            }
        }
        return null;
    }

    /**
     * Entries of an object literal in source order, values as source text. Spread entries are
     * keyed {@code ...0}, {@code ...1} in order of appearance.
     */
    public static Map<String, String> objectLiteralEntries(SyntaxNode object) {
        Map<String, String> entries = new LinkedHashMap<>();
        int spreads = 0;
        for (SyntaxNode child : object.namedChildren()) {
            if (child.is(NT_PAIR)) {
                SyntaxNode key = child.childByField("key");
                SyntaxNode value = child.childByField("value");
                if (key == null || value == null) continue;
                entries.put(ExpressionTokenizer.unquote(key.text()), value.text());
            } else if (child.is(NT_SHORTHAND_PROPERTY)) {
                entries.put(child.text(), child.text());
            } else if (child.is(NT_SPREAD_ELEMENT)) {
                SyntaxNode argument = firstNamedNonComment(child);
                entries.put("..." + spreads++, argument != null ? argument.text() : child.text());
            }
        }
        return entries;
    }

    // --- Functions ---

    public static List<SyntaxNode> functionParameters(SyntaxNode function) {
        List<SyntaxNode> result = new ArrayList<>();
        if (function == null) return result;
        SyntaxNode single = function.childByField("parameter");
        if (single != null) {
            result.add(single);
            return result;
        }
        SyntaxNode parameters = function.childByField("parameters");
        if (parameters == null) parameters = findFirstChild(function, NT_FORMAL_PARAMETERS);
        if (parameters == null) return result;
        for (SyntaxNode child : parameters.namedChildren()) {
            if (!child.is(NT_COMMENT)) result.add(child);
        }
        return result;
    }

    /**
     * The value a function returns: an arrow's expression body, or the argument of the first
     * top-level {@code return} of a block body. Parentheses removed.
     */
    public static SyntaxNode functionReturnValue(SyntaxNode function) {
        if (function == null) return null;
        SyntaxNode body = function.childByField("body");
        if (body == null) return null;
        if (!body.is(NT_STATEMENT_BLOCK)) return unwrapParentheses(body);
        SyntaxNode returnStatement = findFirstChild(body, NT_RETURN_STATEMENT);
        if (returnStatement == null) return null;
        return unwrapParentheses(firstNamedNonComment(returnStatement));
    }

    /**
     * Name a parameter binds: the identifier itself, the left side of a default, or null for
     * destructuring patterns.
     */
    public static String parameterName(SyntaxNode parameter) {
        if (parameter == null) return null;
        if (parameter.is(NT_IDENTIFIER)) return parameter.text();
        if (parameter.is(NT_ASSIGNMENT_PATTERN)) return parameterName(parameter.childByField("left"));
        return null;
    }

    /**
     * Local names bound by an object destructuring pattern mapped to member paths on
     * {@code owner}, e.g. {@code {id, title: t}} gives {@code id -> owner.id, t -> owner.title}.
     */
    public static Map<String, String> destructuredAliases(SyntaxNode pattern, String owner) {
        Map<String, String> aliases = new LinkedHashMap<>();
        SyntaxNode p = pattern;
        if (p != null && p.is(NT_ASSIGNMENT_PATTERN)) p = p.childByField("left");
        if (p == null || !p.is(NT_OBJECT_PATTERN)) return aliases;
        for (SyntaxNode child : p.namedChildren()) {
            if (child.is(NT_SHORTHAND_PATTERN)) {
                aliases.put(child.text(), owner + "." + child.text());
            } else if (child.is(NT_OBJECT_ASSIGNMENT_PATTERN)) {
                SyntaxNode left = child.childByField("left");
                if (left != null) aliases.put(left.text(), owner + "." + left.text());
            } else if (child.is(NT_PAIR_PATTERN)) {
                SyntaxNode key = child.childByField("key");
                SyntaxNode value = child.childByField("value");
                String local = parameterName(value);
                if (key != null && local != null) {
                    aliases.put(local, owner + "." + ExpressionTokenizer.unquote(key.text()));
                }
            }
        }
        return aliases;
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static String kebabCase(String name) {
        return name
                .replaceAll("([A-Z]+)([A-Z][a-z])", "$1-$2")
                .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
                .replace('.', '-')
                .toLowerCase();
    }

    public static boolean isPascalCase(String name) {
        return name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }
}
