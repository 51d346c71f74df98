package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.annotation.Branch;
import org.dxworks.jsxforge.model.annotation.Condition;

/**
 * One branch of a condition chain with its already rendered content.
 */
public final class ConditionBranch {
    public final Condition condition;
    public final String content;

    public ConditionBranch(Condition condition, String content) {
        this.condition = condition;
        this.content = content == null ? "" : content;
    }

    public Branch branch() {
        return condition.branch;
    }

    public String expression() {
        return condition.expression;
    }
}
