package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.annotation.Branch;
import org.dxworks.jsxforge.model.annotation.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered IF, ELSE_IF*, ELSE? branches folded into one conditional by a backend.
 */
public final class ConditionChain {
    public final List<ConditionBranch> branches;

    public ConditionChain(List<ConditionBranch> branches) {
        if (branches == null || branches.isEmpty()) {
            throw new IllegalArgumentException("A condition chain needs at least one branch");
        }
        for (int i = 0; i < branches.size(); i++) {
            Branch b = branches.get(i).branch();
            boolean valid = i == 0 ? b == Branch.IF
                    : b == Branch.ELSE_IF || (b == Branch.ELSE && i == branches.size() - 1);
            if (!valid) {
                throw new IllegalArgumentException("Invalid " + b + " at position " + i + " of a condition chain");
            }
        }
        this.branches = List.copyOf(branches);
    }

    public static ConditionChain of(Condition condition, String content) {
        return new ConditionChain(List.of(new ConditionBranch(condition, content)));
    }

    public static ConditionChain ifElse(String expression, String content, String elseContent) {
        List<ConditionBranch> branches = new ArrayList<>();
        branches.add(new ConditionBranch(Condition.ifTrue(expression), content));
        if (elseContent != null) branches.add(new ConditionBranch(Condition.otherwise(), elseContent));
        return new ConditionChain(branches);
    }

    public ConditionBranch ifBranch() {
        return branches.get(0);
    }

    public List<ConditionBranch> elseIfBranches() {
        List<ConditionBranch> result = new ArrayList<>();
        for (ConditionBranch branch : branches) {
            if (branch.branch() == Branch.ELSE_IF) result.add(branch);
        }
        return result;
    }

    public ConditionBranch elseBranch() {
        ConditionBranch last = branches.get(branches.size() - 1);
        return last.branch() == Branch.ELSE ? last : null;
    }

    /**
     * Decides between the two-way and the multi-branch strategy.
     */
    public boolean hasElseIf() {
        for (ConditionBranch branch : branches) {
            if (branch.branch() == Branch.ELSE_IF) return true;
        }
        return false;
    }
}
