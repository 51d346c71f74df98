package org.dxworks.jsxforge.backend;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionRewriterTest {

    @Test
    void operatorsAreReplacedOutsideStrings() {
        assertEquals("'a && b' and c", ExpressionRewriter.replaceOperators("'a && b' && c", Map.of("&&", "and")));
        assertEquals("a == b", ExpressionRewriter.replaceOperators("a === b", Map.of("===", "==")));
    }

    @Test
    void wordOperatorsArePadded() {
        assertEquals("not a and b", ExpressionRewriter.replaceOperatorsWithWords("!a && b", Map.of("!", "not", "&&", "and")));
        assertEquals("a or not b", ExpressionRewriter.replaceOperatorsWithWords("a||!b", Map.of("!", "not", "||", "or")));
    }

    @Test
    void sigilsGoOnRootsOnly() {
        assertEquals("$user->name + $count", ExpressionRewriter.sigilVariables("user.name + count", "$", "->"));
        assertEquals("$user?->name", ExpressionRewriter.sigilVariables("user?.name", "$", "->"));
    }

    @Test
    void callsKeysAndLiteralsKeepTheirNames() {
        assertEquals("format($x, true)", ExpressionRewriter.sigilVariables("format(x, true)", "$", "->"));
        assertEquals("{a: $b}", ExpressionRewriter.sigilVariables("{a: b}", "$", "->"));
        assertEquals("typeof $x", ExpressionRewriter.sigilVariables("typeof x", "$", "->"));
    }

    @Test
    void rewriteSeesThePreviousSignificantToken() {
        String rewritten = ExpressionRewriter.rewrite("a. b + b", (token, previous) ->
                token.text.equals("b") && previous != null && previous.isOperator("+") ? "B" : token.text);

        assertEquals("a. b + B", rewritten);
    }
}
