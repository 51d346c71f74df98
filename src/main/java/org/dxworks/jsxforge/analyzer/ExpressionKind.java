package org.dxworks.jsxforge.analyzer;

/**
 * Classification buckets for embedded expressions, in precedence order.
 */
public enum ExpressionKind {
    ITERATION,
    LOGICAL_AND,
    TERNARY,
    CHILDREN,
    VARIABLE,
    MEMBER,
    TEMPLATE_LITERAL,
    LITERAL,
    CALL,
    UNKNOWN
}
