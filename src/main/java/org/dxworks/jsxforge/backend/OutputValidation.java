package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural checks shared by the dialects' {@code validate} implementations. Messages name
 * the construct in words and never quote dialect delimiters, so validating a report of errors
 * never reports new ones.
 */
public final class OutputValidation {

    private final List<String> errors = new ArrayList<>();
    private final String output;

    private OutputValidation(String output) {
        this.output = output == null ? "" : output;
    }

    public static OutputValidation of(String output) {
        return new OutputValidation(output);
    }

    public OutputValidation notEmpty() {
        if (output.isBlank()) errors.add("Output is empty");
        return this;
    }

    public OutputValidation noSentinels() {
        if (ConditionChains.containsSentinel(output)) {
            errors.add("Output contains an else branch without a preceding if");
        }
        return this;
    }

    /**
     * Equal numbers of {@code open} and {@code close} delimiters.
     */
    public OutputValidation balanced(String open, String close, String what) {
        int opened = count(output, open);
        int closed = count(output, close);
        if (opened != closed) {
            errors.add("Unbalanced " + what + ": " + opened + " opening and " + closed + " closing");
        }
        return this;
    }

    /**
     * Like {@link #balanced}, but delimiters inside the given spans are not counted. Spans come
     * as opening and closing pairs, e.g. {@code "{%", "%}"}, so the braces closing a hash
     * literal inside a tag are not taken for the end of an output tag.
     */
    public OutputValidation balancedOutside(String open, String close, String what, String... spans) {
        String visible = withoutSpans(output, spans);
        int opened = count(visible, open);
        int closed = count(visible, close);
        if (opened != closed) {
            errors.add("Unbalanced " + what + ": " + opened + " opening and " + closed + " closing");
        }
        return this;
    }

    /**
     * Equal numbers of matches for an opening and a closing tag pattern.
     */
    public OutputValidation pairedTags(Pattern open, Pattern close, String what) {
        int opened = count(output, open);
        int closed = count(output, close);
        if (opened != closed) {
            errors.add("Unbalanced " + what + " tags: " + opened + " opening and " + closed + " closing");
        }
        return this;
    }

    /**
     * Braces balance in order: no closing brace before its opening one.
     */
    public OutputValidation nestedBraces(String what) {
        int depth = 0;
        boolean negative = false;
        for (int i = 0; i < output.length(); i++) {
            char c = output.charAt(i);
            if (c == '{') depth++;
            else if (c == '}') {
                depth--;
                if (depth < 0) negative = true;
            }
        }
        if (negative) errors.add("Unbalanced " + what + ": closing brace without an opening one");
        else if (depth > 0) errors.add("Unbalanced " + what + ": " + depth + " unclosed");
        return this;
    }

    public ValidationResult result() {
        return ValidationResult.of(errors);
    }

    static String withoutSpans(String text, String... spans) {
        StringBuilder visible = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int end = spanEnd(text, i, spans);
            if (end > i) {
                i = end;
            } else {
                visible.append(text.charAt(i++));
            }
        }
        return visible.toString();
    }

    // an unterminated span is left visible; the delimiter checks report it
    private static int spanEnd(String text, int i, String[] spans) {
        for (int s = 0; s + 1 < spans.length; s += 2) {
            if (!text.startsWith(spans[s], i)) continue;
            int end = text.indexOf(spans[s + 1], i + spans[s].length());
            if (end >= 0) return end + spans[s + 1].length();
        }
        return i;
    }

    static int count(String text, String token) {
        int count = 0;
        int index = text.indexOf(token);
        while (index >= 0) {
            count++;
            index = text.indexOf(token, index + token.length());
        }
        return count;
    }

    static int count(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }
}
