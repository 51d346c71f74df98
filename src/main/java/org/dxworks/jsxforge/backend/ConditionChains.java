package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.annotation.Branch;

import java.util.function.UnaryOperator;

/**
 * Chain composition for dialects that spell conditionals as paired block tags, and the marker
 * left in the output for an ELSE or ELSE_IF with no IF before it.
 */
public final class ConditionChains {

    public static final String SENTINEL_PREFIX = "@@jsxforge:";

    private ConditionChains() {
    }

    /**
     * {@code open(if) content [branch(elseIf) content]* [branch(null) content] close}, one tag per line.
     *
     * @param open   opening tag for the IF guard
     * @param branch tag that starts an ELSE_IF (non-null guard) or the ELSE (null guard)
     */
    public static String composeBlocks(ConditionChain chain, UnaryOperator<String> open,
                                       UnaryOperator<String> branch, String close) {
        StringBuilder out = new StringBuilder();
        for (ConditionBranch b : chain.branches) {
            String tag = switch (b.branch()) {
                case IF -> open.apply(b.expression());
                case ELSE_IF -> branch.apply(b.expression());
                case ELSE -> branch.apply(null);
            };
            out.append(tag).append('\n');
            if (!b.content.isEmpty()) out.append(b.content).append('\n');
        }
        return out.append(close).toString();
    }

    public static String danglingMarker(Branch branch) {
        return SENTINEL_PREFIX + "dangling-" + branch.name().toLowerCase().replace('_', '-') + "@@";
    }

    public static boolean containsSentinel(String output) {
        return output != null && output.contains(SENTINEL_PREFIX);
    }
}
