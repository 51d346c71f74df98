package org.dxworks.jsxforge.analyzer;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser-neutral syntax tree node: kind, optional field name relative to the parent, named
 * flag, character offsets into the source, 1-based line, 0-based column and children. The
 * analyzer consumes nothing else from a parser.
 */
public final class SyntaxNode {
    public static final String ERROR = "ERROR";

    public final String kind;
    public final String field;
    public final boolean named;
    public final boolean missing;
    public final int start;
    public final int end;
    public final int line;
    public final int column;
    public final List<SyntaxNode> children;
    private final String source;

    public SyntaxNode(String kind, String field, boolean named, boolean missing, int start, int end,
                      int line, int column, List<SyntaxNode> children, String source) {
        this.kind = kind;
        this.field = field;
        this.named = named;
        this.missing = missing;
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
        this.children = children == null ? List.of() : List.copyOf(children);
        this.source = source;
    }

    public String text() {
        if (source == null || start >= end) return "";
        return source.substring(Math.max(0, start), Math.min(end, source.length()));
    }

    public String source() {
        return source;
    }

    public boolean is(String... kinds) {
        for (String k : kinds) if (k.equals(kind)) return true;
        return false;
    }

    public List<SyntaxNode> namedChildren() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) if (child.named) result.add(child);
        return result;
    }

    public SyntaxNode namedChild(int index) {
        int i = 0;
        for (SyntaxNode child : children) {
            if (!child.named) continue;
            if (i++ == index) return child;
        }
        return null;
    }

    public int namedChildCount() {
        int count = 0;
        for (SyntaxNode child : children) if (child.named) count++;
        return count;
    }

    public SyntaxNode childByField(String fieldName) {
        for (SyntaxNode child : children) {
            if (fieldName.equals(child.field)) return child;
        }
        return null;
    }

    public List<SyntaxNode> childrenByField(String fieldName) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (fieldName.equals(child.field)) result.add(child);
        }
        return result;
    }

    /**
     * True when this node or any descendant is a syntax error or a token the parser had to invent.
     */
    public boolean hasError() {
        if (missing || ERROR.equals(kind)) return true;
        for (SyntaxNode child : children) {
            if (child.hasError()) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return kind + "@" + line + ":" + column;
    }
}
