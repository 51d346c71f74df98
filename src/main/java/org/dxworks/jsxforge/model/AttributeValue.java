package org.dxworks.jsxforge.model;

import java.util.Objects;

/**
 * Value of an element attribute: a literal string, a bare flag, or an opaque dynamic expression.
 */
public final class AttributeValue {

    public enum Kind { LITERAL, FLAG, EXPRESSION }

    private static final AttributeValue FLAG = new AttributeValue(Kind.FLAG, "true");

    public final Kind kind;
    public final String value;

    private AttributeValue(Kind kind, String value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static AttributeValue literal(String value) {
        return new AttributeValue(Kind.LITERAL, value);
    }

    public static AttributeValue expression(String expression) {
        return new AttributeValue(Kind.EXPRESSION, expression);
    }

    public static AttributeValue flag() {
        return FLAG;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public boolean isExpression() {
        return kind == Kind.EXPRESSION;
    }

    public boolean isFlag() {
        return kind == Kind.FLAG;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AttributeValue other && kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case LITERAL -> "\"" + value + "\"";
            case FLAG -> "true";
            case EXPRESSION -> "{" + value + "}";
        };
    }
}
