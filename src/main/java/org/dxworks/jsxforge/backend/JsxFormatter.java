package org.dxworks.jsxforge.backend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Re-indents flat JSX: one tag per line, two spaces per level. Elements that hold text stay on
 * one line, since breaking them would change JSX whitespace, and so do elements holding only
 * one-line expressions. Multi-line expression containers keep their own relative indentation.
 */
public final class JsxFormatter {

    private static final String INDENT = "  ";

    private enum Kind { ELEMENT, SELF_CLOSING, EXPRESSION, TEXT }

    private static final class Piece {
        final Kind kind;
        final String text;
        final List<Piece> children = new ArrayList<>();
        String closing = "";

        Piece(Kind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }

    private JsxFormatter() {
    }

    /**
     * Formatted JSX without a trailing newline. Input that does not nest properly is returned
     * trimmed but otherwise untouched.
     */
    public static String format(String jsx) {
        if (jsx == null || jsx.isBlank()) return "";
        List<Piece> pieces = parse(jsx);
        if (pieces == null) return jsx.strip();
        List<String> lines = new ArrayList<>();
        for (Piece piece : pieces) render(piece, 0, lines);
        return String.join("\n", lines);
    }

    /**
     * Number of top-level tags, expressions and non-blank text runs; 0 when the input does not
     * nest properly.
     */
    public static int rootCount(String jsx) {
        if (jsx == null || jsx.isBlank()) return 0;
        List<Piece> pieces = parse(jsx);
        if (pieces == null) return 0;
        int count = 0;
        for (Piece piece : pieces) {
            if (piece.kind != Kind.TEXT || !piece.text.isBlank()) count++;
        }
        return count;
    }

    /**
     * Prefixes every non-blank line with {@code depth} indentation levels.
     */
    public static String indent(String text, int depth) {
        String prefix = INDENT.repeat(depth);
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            if (!lines[i].isBlank()) out.append(prefix).append(lines[i]);
        }
        return out.toString();
    }

    private static List<Piece> parse(String input) {
        List<Piece> top = new ArrayList<>();
        Deque<Piece> open = new ArrayDeque<>();
        int pos = 0;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            List<Piece> target = open.isEmpty() ? top : open.peek().children;
            if (c == '<' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
                int end = input.indexOf('>', pos);
                if (end < 0 || open.isEmpty()) return null;
                open.pop().closing = input.substring(pos, end + 1);
                pos = end + 1;
            } else if (c == '<') {
                int end = tagEnd(input, pos);
                if (end < 0) return null;
                String tag = input.substring(pos, end + 1);
                if (tag.endsWith("/>")) {
                    target.add(new Piece(Kind.SELF_CLOSING, tag));
                } else {
                    Piece element = new Piece(Kind.ELEMENT, tag);
                    target.add(element);
                    open.push(element);
                }
                pos = end + 1;
            } else if (c == '{') {
                int end = matchingBrace(input, pos);
                if (end < 0) return null;
                target.add(new Piece(Kind.EXPRESSION, input.substring(pos, end + 1)));
                pos = end + 1;
            } else {
                int end = pos;
                while (end < input.length() && input.charAt(end) != '<' && input.charAt(end) != '{') end++;
                target.add(new Piece(Kind.TEXT, input.substring(pos, end)));
                pos = end;
            }
        }
        return open.isEmpty() ? top : null;
    }

    private static void render(Piece piece, int depth, List<String> lines) {
        switch (piece.kind) {
            case TEXT:
                String text = piece.text.strip();
                if (!text.isEmpty()) addLines(lines, depth, text);
                break;
            case SELF_CLOSING:
            case EXPRESSION:
                addLines(lines, depth, piece.text);
                break;
            default:
                if (staysOnOneLine(piece)) {
                    addLines(lines, depth, flat(piece));
                } else {
                    lines.add(INDENT.repeat(depth) + piece.text);
                    for (Piece child : piece.children) render(child, depth + 1, lines);
                    lines.add(INDENT.repeat(depth) + piece.closing);
                }
        }
    }

    /**
     * First line at {@code depth}; later lines keep their indentation relative to it.
     */
    private static void addLines(List<String> lines, int depth, String text) {
        String prefix = INDENT.repeat(depth);
        String[] split = text.split("\n");
        lines.add(prefix + split[0].strip());
        for (int i = 1; i < split.length; i++) {
            if (!split[i].isBlank()) lines.add(prefix + split[i].stripTrailing());
        }
    }

    /**
     * Elements holding text, and elements holding nothing but one-line expressions.
     */
    private static boolean staysOnOneLine(Piece element) {
        boolean onlyShortExpressions = true;
        for (Piece child : element.children) {
            if (child.kind == Kind.TEXT && !child.text.isBlank()) return true;
            if (child.kind != Kind.TEXT && (child.kind != Kind.EXPRESSION || child.text.contains("\n"))) {
                onlyShortExpressions = false;
            }
        }
        return onlyShortExpressions;
    }

    private static String flat(Piece piece) {
        if (piece.kind != Kind.ELEMENT) return piece.text;
        StringBuilder out = new StringBuilder(piece.text);
        for (Piece child : piece.children) out.append(flat(child));
        return out.append(piece.closing).toString();
    }

    /**
     * Closing {@code >} of a tag, skipping quoted strings and braces inside attribute values.
     */
    private static int tagEnd(String input, int start) {
        int braces = 0;
        char quote = 0;
        for (int pos = start + 1; pos < input.length(); pos++) {
            char c = input.charAt(pos);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if ((c == '"' || c == '\'') && braces == 0) {
                quote = c;
            } else if (c == '{') {
                braces++;
            } else if (c == '}') {
                braces--;
            } else if (c == '>' && braces == 0) {
                return pos;
            }
        }
        return -1;
    }

    private static int matchingBrace(String input, int start) {
        int depth = 0;
        char quote = 0;
        for (int pos = start; pos < input.length(); pos++) {
            char c = input.charAt(pos);
            if (quote != 0) {
                if (c == quote && input.charAt(pos - 1) != '\\') quote = 0;
            } else if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return pos;
            }
        }
        return -1;
    }
}
