package org.dxworks.jsxforge.model.annotation;

import java.util.Objects;

public final class Condition implements Annotation {
    public final String expression;
    public final Branch branch;

    public Condition(String expression, Branch branch) {
        this.branch = Objects.requireNonNull(branch, "branch");
        if (branch != Branch.ELSE && (expression == null || expression.isBlank())) {
            throw new IllegalArgumentException(branch + " condition requires an expression");
        }
        this.expression = branch == Branch.ELSE ? null : expression;
    }

    public static Condition ifTrue(String expression) {
        return new Condition(expression, Branch.IF);
    }

    public static Condition elseIf(String expression) {
        return new Condition(expression, Branch.ELSE_IF);
    }

    public static Condition otherwise() {
        return new Condition(null, Branch.ELSE);
    }

    @Override
    public AnnotationKind kind() {
        return AnnotationKind.CONDITION;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Condition other
                && branch == other.branch
                && Objects.equals(expression, other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, branch);
    }

    @Override
    public String toString() {
        return "Condition{" + branch + (expression != null ? ", " + expression : "") + "}";
    }
}
