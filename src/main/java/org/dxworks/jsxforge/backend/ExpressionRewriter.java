package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.expression.ExpressionToken;
import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.expression.KnownGlobals;

import java.util.List;
import java.util.Map;

/**
 * Token-level rewriting of opaque expressions for dialects whose operators or variable
 * syntax differ from JavaScript. String literals are never touched.
 */
public final class ExpressionRewriter {

    /**
     * Replacement for one token; {@code previous} is the last non-whitespace token or null.
     */
    @FunctionalInterface
    public interface TokenMapper {
        String map(ExpressionToken token, ExpressionToken previous);
    }

    private ExpressionRewriter() {
    }

    public static String rewrite(String expression, TokenMapper mapper) {
        if (expression == null) return null;
        StringBuilder out = new StringBuilder();
        ExpressionToken previous = null;
        for (ExpressionToken token : ExpressionTokenizer.tokenize(expression)) {
            out.append(mapper.map(token, previous));
            if (!token.is(ExpressionToken.Type.WHITESPACE)) previous = token;
        }
        return out.toString();
    }

    /**
     * Replaces operators (and word operators such as {@code !}) by the given table.
     */
    public static String replaceOperators(String expression, Map<String, String> operators) {
        return rewrite(expression, (token, previous) ->
                token.is(ExpressionToken.Type.OPERATOR) && operators.containsKey(token.text)
                        ? operators.get(token.text)
                        : token.text);
    }

    /**
     * Operator replacement that also pads the replacement with spaces when it is a word, so
     * {@code !a} becomes {@code not a} rather than {@code nota}.
     */
    public static String replaceOperatorsWithWords(String expression, Map<String, String> operators) {
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize(expression);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            ExpressionToken token = tokens.get(i);
            String replacement = token.is(ExpressionToken.Type.OPERATOR) ? operators.get(token.text) : null;
            if (replacement == null) {
                out.append(token.text);
                continue;
            }
            boolean word = !replacement.isEmpty() && Character.isLetter(replacement.charAt(0));
            if (word && out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) out.append(' ');
            out.append(replacement);
            ExpressionToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            if (word && next != null && !next.is(ExpressionToken.Type.WHITESPACE)) out.append(' ');
        }
        return out.toString();
    }

    /**
     * Prefixes root identifiers with {@code sigil} (PHP-style {@code $name}) and spells member
     * access with {@code memberOperator}. Globals, keywords and object keys stay as they are.
     */
    public static String sigilVariables(String expression, String sigil, String memberOperator) {
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize(expression);
        StringBuilder out = new StringBuilder();
        ExpressionToken previous = null;
        for (int i = 0; i < tokens.size(); i++) {
            ExpressionToken token = tokens.get(i);
            if (token.isOperator(".") || token.isOperator("?.")) {
                out.append(token.isOperator("?.") ? "?" + memberOperator : memberOperator);
            } else if (token.is(ExpressionToken.Type.IDENTIFIER)) {
                boolean member = previous != null && (previous.isOperator(".") || previous.isOperator("?."));
                boolean call = nextNonWhitespace(tokens, i) != null && nextNonWhitespace(tokens, i).isOperator("(");
                boolean key = nextNonWhitespace(tokens, i) != null && nextNonWhitespace(tokens, i).isOperator(":")
                        && (previous == null || previous.isOperator("{") || previous.isOperator(","));
                boolean literal = token.text.equals("true") || token.text.equals("false") || token.text.equals("null");
                if (member || call || key || literal || KnownGlobals.isKeyword(token.text)) {
                    out.append(token.text);
                } else {
                    out.append(sigil).append(token.text);
                }
            } else {
                out.append(token.text);
            }
            if (!token.is(ExpressionToken.Type.WHITESPACE)) previous = token;
        }
        return out.toString();
    }

    private static ExpressionToken nextNonWhitespace(List<ExpressionToken> tokens, int index) {
        for (int i = index + 1; i < tokens.size(); i++) {
            if (!tokens.get(i).is(ExpressionToken.Type.WHITESPACE)) return tokens.get(i);
        }
        return null;
    }
}
