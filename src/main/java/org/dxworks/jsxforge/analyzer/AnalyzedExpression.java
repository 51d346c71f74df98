package org.dxworks.jsxforge.analyzer;

import java.util.List;
import java.util.Map;

/**
 * Result of classifying one embedded expression. Only the fields of the matching kind are set.
 */
public final class AnalyzedExpression {
    public final ExpressionKind kind;
    public final SyntaxNode node;
    public final String raw;

    // VARIABLE / MEMBER
    public final String path;
    public final String rootIdentifier;
    public final String defaultValue;

    // ITERATION
    public final String collection;
    public final String item;
    public final String index;
    public final String key;
    public final SyntaxNode body;
    public final Map<String, String> itemAliases;

    // LOGICAL_AND / TERNARY
    public final String guard;
    public final SyntaxNode consequence;
    public final SyntaxNode alternative;

    // LITERAL
    public final String literalValue;

    // TEMPLATE_LITERAL: plain strings and expression nodes, in order
    public final List<Object> templateParts;

    private AnalyzedExpression(Builder b) {
        this.kind = b.kind;
        this.node = b.node;
        this.raw = b.node != null ? b.node.text() : "";
        this.path = b.path;
        this.rootIdentifier = b.rootIdentifier;
        this.defaultValue = b.defaultValue;
        this.collection = b.collection;
        this.item = b.item;
        this.index = b.index;
        this.key = b.key;
        this.body = b.body;
        this.itemAliases = b.itemAliases == null ? Map.of() : Map.copyOf(b.itemAliases);
        this.guard = b.guard;
        this.consequence = b.consequence;
        this.alternative = b.alternative;
        this.literalValue = b.literalValue;
        this.templateParts = b.templateParts == null ? List.of() : List.copyOf(b.templateParts);
    }

    static Builder of(ExpressionKind kind, SyntaxNode node) {
        return new Builder(kind, node);
    }

    static final class Builder {
        private final ExpressionKind kind;
        private final SyntaxNode node;
        private String path;
        private String rootIdentifier;
        private String defaultValue;
        private String collection;
        private String item;
        private String index;
        private String key;
        private SyntaxNode body;
        private Map<String, String> itemAliases;
        private String guard;
        private SyntaxNode consequence;
        private SyntaxNode alternative;
        private String literalValue;
        private List<Object> templateParts;

        private Builder(ExpressionKind kind, SyntaxNode node) {
            this.kind = kind;
            this.node = node;
        }

        Builder path(String path, String rootIdentifier) {
            this.path = path;
            this.rootIdentifier = rootIdentifier;
            return this;
        }

        Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        Builder loop(String collection, String item, String index, String key, SyntaxNode body,
                     Map<String, String> itemAliases) {
            this.collection = collection;
            this.item = item;
            this.index = index;
            this.key = key;
            this.body = body;
            this.itemAliases = itemAliases;
            return this;
        }

        Builder condition(String guard, SyntaxNode consequence, SyntaxNode alternative) {
            this.guard = guard;
            this.consequence = consequence;
            this.alternative = alternative;
            return this;
        }

        Builder literal(String literalValue) {
            this.literalValue = literalValue;
            return this;
        }

        Builder templateParts(List<Object> templateParts) {
            this.templateParts = templateParts;
            return this;
        }

        AnalyzedExpression build() {
            return new AnalyzedExpression(this);
        }
    }
}
