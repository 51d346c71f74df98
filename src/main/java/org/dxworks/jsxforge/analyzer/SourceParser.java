package org.dxworks.jsxforge.analyzer;

/**
 * Parser boundary. Implementations turn component source text into a {@link SyntaxNode} tree.
 */
public interface SourceParser {
    SyntaxNode parse(String source);
}
