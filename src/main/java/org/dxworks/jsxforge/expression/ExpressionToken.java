package org.dxworks.jsxforge.expression;

public final class ExpressionToken {

    public enum Type { IDENTIFIER, NUMBER, STRING, OPERATOR, WHITESPACE }

    public final Type type;
    public final String text;

    public ExpressionToken(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    public boolean is(Type t) {
        return type == t;
    }

    public boolean isOperator(String op) {
        return type == Type.OPERATOR && text.equals(op);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
