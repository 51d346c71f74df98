package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.expression.ExpressionToken;
import org.dxworks.jsxforge.expression.ExpressionTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rewrites JavaScript conditions into Handlebars subexpressions built from the usual logic
 * helpers: {@code a === 'x' && !b} becomes {@code (and (eq a 'x') (not b))}. Expressions outside
 * that grammar fall back to dropping the comparison operators.
 */
final class HandlebarsExpressions {

    private static final Map<String, String> COMPARISONS = Map.of(
            "===", "eq", "==", "eq", "!==", "ne", "!=", "ne",
            ">", "gt", "<", "lt", ">=", "gte", "<=", "lte");

    private final List<ExpressionToken> tokens;
    private int position;

    private HandlebarsExpressions(List<ExpressionToken> tokens) {
        this.tokens = tokens;
    }

    static String toHelpers(String expression) {
        return tryHelpers(expression).orElseGet(() -> fallback(expression));
    }

    /**
     * The helper form, or empty when the expression is outside the helper grammar.
     */
    static Optional<String> tryHelpers(String expression) {
        List<ExpressionToken> significant = new ArrayList<>();
        for (ExpressionToken token : ExpressionTokenizer.tokenize(expression)) {
            if (!token.is(ExpressionToken.Type.WHITESPACE)) significant.add(token);
        }
        HandlebarsExpressions parser = new HandlebarsExpressions(significant);
        String result = parser.or();
        if (result == null || parser.position != significant.size()) return Optional.empty();
        return Optional.of(result);
    }

    /**
     * Member paths with optional chaining flattened, for output and helper arguments.
     */
    static String path(String expression) {
        return expression == null ? null : expression.replace("?.", ".");
    }

    private static String fallback(String expression) {
        return path(expression)
                .replaceAll("\\s*[!=]==?\\s*", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private String or() {
        return logical("||", "or", this::and);
    }

    private String and() {
        return logical("&&", "and", this::comparison);
    }

    private String logical(String operator, String helper, Supplier<String> operand) {
        List<String> operands = new ArrayList<>();
        String first = operand.get();
        if (first == null) return null;
        operands.add(first);
        while (peekOperator(operator)) {
            position++;
            String next = operand.get();
            if (next == null) return null;
            operands.add(next);
        }
        return operands.size() == 1 ? first : "(" + helper + " " + String.join(" ", operands) + ")";
    }

    private String comparison() {
        String left = unary();
        if (left == null) return null;
        if (position < tokens.size() && tokens.get(position).is(ExpressionToken.Type.OPERATOR)
                && COMPARISONS.containsKey(tokens.get(position).text)) {
            String helper = COMPARISONS.get(tokens.get(position).text);
            position++;
            String right = unary();
            if (right == null) return null;
            return "(" + helper + " " + left + " " + right + ")";
        }
        return left;
    }

    private String unary() {
        if (peekOperator("!")) {
            position++;
            String operand = unary();
            return operand == null ? null : "(not " + operand + ")";
        }
        return primary();
    }

    private String primary() {
        if (position >= tokens.size()) return null;
        ExpressionToken token = tokens.get(position);
        if (token.isOperator("(")) {
            position++;
            String inner = or();
            if (inner == null || !peekOperator(")")) return null;
            position++;
            return inner;
        }
        if (token.is(ExpressionToken.Type.STRING) || token.is(ExpressionToken.Type.NUMBER)) {
            position++;
            return token.text;
        }
        if (!token.is(ExpressionToken.Type.IDENTIFIER)) return null;

        StringBuilder path = new StringBuilder(token.text);
        position++;
        while (position + 1 < tokens.size()
                && (peekOperator(".") || peekOperator("?."))
                && tokens.get(position + 1).is(ExpressionToken.Type.IDENTIFIER)) {
            path.append('.').append(tokens.get(position + 1).text);
            position += 2;
        }
        if (peekOperator("(") || peekOperator("[")) return null;
        return path.toString();
    }

    private boolean peekOperator(String operator) {
        return position < tokens.size() && tokens.get(position).isOperator(operator);
    }
}
