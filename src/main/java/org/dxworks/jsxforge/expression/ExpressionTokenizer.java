package org.dxworks.jsxforge.expression;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lossless lexer for the opaque expression text carried by annotations. Concatenating the token
 * texts gives back the input; string and template literals are single tokens so rewriting never
 * touches their content.
 */
public final class ExpressionTokenizer {

    private static final String[] OPERATORS = {
            "===", "!==", "...", "**=", "??=", "&&=", "||=",
            "==", "!=", "<=", ">=", "&&", "||", "??", "?.", "=>", "**", "++", "--", "+=", "-=", "*=", "/="
    };

    private ExpressionTokenizer() {
    }

    public static List<ExpressionToken> tokenize(String expression) {
        List<ExpressionToken> tokens = new ArrayList<>();
        if (expression == null) return tokens;
        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            int start = i;
            if (Character.isWhitespace(c)) {
                while (i < n && Character.isWhitespace(expression.charAt(i))) i++;
                tokens.add(new ExpressionToken(ExpressionToken.Type.WHITESPACE, expression.substring(start, i)));
            } else if (c == '"' || c == '\'' || c == '`') {
                i = skipString(expression, i, c);
                tokens.add(new ExpressionToken(ExpressionToken.Type.STRING, expression.substring(start, i)));
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(expression.charAt(i + 1))
                    && !precededByIdentifier(tokens))) {
                i++;
                while (i < n && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '.'
                        || expression.charAt(i) == '_')) i++;
                tokens.add(new ExpressionToken(ExpressionToken.Type.NUMBER, expression.substring(start, i)));
            } else if (Character.isJavaIdentifierStart(c)) {
                i++;
                while (i < n && Character.isJavaIdentifierPart(expression.charAt(i))) i++;
                tokens.add(new ExpressionToken(ExpressionToken.Type.IDENTIFIER, expression.substring(start, i)));
            } else {
                String op = matchOperator(expression, i);
                i += op.length();
                tokens.add(new ExpressionToken(ExpressionToken.Type.OPERATOR, op));
            }
        }
        return tokens;
    }

    /**
     * Identifiers that start a reference chain, i.e. not preceded by a member access. Object
     * literal keys and arrow function parameters are not references and are left out.
     */
    public static List<String> rootIdentifiers(String expression) {
        List<ExpressionToken> tokens = new ArrayList<>();
        for (ExpressionToken token : tokenize(expression)) {
            if (!token.is(ExpressionToken.Type.WHITESPACE)) tokens.add(token);
        }
        Set<String> parameters = arrowParameters(tokens);
        List<String> roots = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            ExpressionToken token = tokens.get(i);
            if (!token.is(ExpressionToken.Type.IDENTIFIER) || parameters.contains(token.text)) continue;
            ExpressionToken previous = i > 0 ? tokens.get(i - 1) : null;
            ExpressionToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            boolean member = previous != null && (previous.isOperator(".") || previous.isOperator("?."));
            boolean key = next != null && next.isOperator(":")
                    && previous != null && (previous.isOperator("{") || previous.isOperator(","));
            if (!member && !key) roots.add(token.text);
        }
        return roots;
    }

    /**
     * Names bound by {@code x => ...} and {@code (x, { y }) => ...}.
     */
    private static Set<String> arrowParameters(List<ExpressionToken> tokens) {
        Set<String> parameters = new HashSet<>();
        for (int i = 1; i < tokens.size(); i++) {
            if (!tokens.get(i).isOperator("=>")) continue;
            ExpressionToken before = tokens.get(i - 1);
            if (before.is(ExpressionToken.Type.IDENTIFIER)) {
                parameters.add(before.text);
                continue;
            }
            if (!before.isOperator(")")) continue;
            int depth = 0;
            for (int j = i - 1; j >= 0; j--) {
                ExpressionToken token = tokens.get(j);
                if (token.isOperator(")")) depth++;
                else if (token.isOperator("(") && --depth == 0) break;
                else if (token.is(ExpressionToken.Type.IDENTIFIER) && j > 0 && bindsName(tokens.get(j - 1))) {
                    parameters.add(token.text);
                }
            }
        }
        return parameters;
    }

    private static boolean bindsName(ExpressionToken previous) {
        return previous.isOperator("(") || previous.isOperator(",") || previous.isOperator("{")
                || previous.isOperator("[") || previous.isOperator("...");
    }

    /**
     * Text before the first member access or call, e.g. {@code user} for {@code user.profile.name}.
     */
    public static String rootOf(String path) {
        if (path == null) return null;
        String trimmed = path.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isJavaIdentifierPart(trimmed.charAt(end))) end++;
        return trimmed.substring(0, end);
    }

    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !Character.isJavaIdentifierStart(text.charAt(0))) return false;
        for (int i = 1; i < text.length(); i++) {
            if (!Character.isJavaIdentifierPart(text.charAt(i))) return false;
        }
        return true;
    }

    /**
     * A dotted path of identifiers such as {@code a.b.c}.
     */
    public static boolean isPath(String text) {
        if (text == null || text.isEmpty()) return false;
        for (String part : text.split("\\.", -1)) {
            if (!isIdentifier(part)) return false;
        }
        return true;
    }

    public static boolean isStringLiteral(String text) {
        if (text == null || text.length() < 2) return false;
        char first = text.charAt(0);
        return (first == '"' || first == '\'' || first == '`') && text.charAt(text.length() - 1) == first
                && skipString(text, 0, first) == text.length();
    }

    public static String unquote(String text) {
        return isStringLiteral(text) ? text.substring(1, text.length() - 1) : text;
    }

    private static int skipString(String s, int i, char quote) {
        i++;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            i++;
            if (c == quote) return i;
        }
        return s.length();
    }

    private static boolean precededByIdentifier(List<ExpressionToken> tokens) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).is(ExpressionToken.Type.IDENTIFIER);
    }

    private static String matchOperator(String s, int i) {
        for (String op : OPERATORS) {
            if (s.startsWith(op, i)) {
                // "?." followed by a digit is a ternary, not optional chaining
                if (op.equals("?.") && i + 2 < s.length() && Character.isDigit(s.charAt(i + 2))) continue;
                return op;
            }
        }
        return String.valueOf(s.charAt(i));
    }
}
