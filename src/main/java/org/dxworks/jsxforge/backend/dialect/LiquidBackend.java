package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.backend.BackendFeatures;
import org.dxworks.jsxforge.backend.ConditionChain;
import org.dxworks.jsxforge.backend.ConditionChains;
import org.dxworks.jsxforge.backend.FilterDefinition;
import org.dxworks.jsxforge.backend.FilterTable;
import org.dxworks.jsxforge.backend.Filters;
import org.dxworks.jsxforge.backend.MarkupRenderer;
import org.dxworks.jsxforge.backend.OutputValidation;
import org.dxworks.jsxforge.backend.RenderContext;
import org.dxworks.jsxforge.backend.StandardFilter;
import org.dxworks.jsxforge.backend.TemplateBackend;
import org.dxworks.jsxforge.expression.ExpressionToken;
import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.model.ValidationResult;
import org.dxworks.jsxforge.model.annotation.Block;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Slot;
import org.dxworks.jsxforge.model.annotation.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.dxworks.jsxforge.backend.dialect.DialectSupport.block;
import static org.dxworks.jsxforge.backend.dialect.DialectSupport.isSpread;
import static org.dxworks.jsxforge.backend.dialect.DialectSupport.singleQuoted;
import static org.dxworks.jsxforge.backend.dialect.DialectSupport.slotName;
import static org.dxworks.jsxforge.backend.dialect.DialectSupport.withExtension;

/**
 * Liquid, as used by Shopify, Jekyll and Eleventy. No template inheritance: extends renders a
 * marked placeholder.
 */
public class LiquidBackend implements TemplateBackend {

    private static final Pattern TAG_OPEN = Pattern.compile("\\{%-?\\s*(if|unless|for|case|capture|comment)\\b");
    private static final Pattern TAG_CLOSE = Pattern.compile("\\{%-?\\s*end(if|unless|for|case|capture|comment)\\b");

    static final String INCLUDE_CONTENT = "include_content";

    private static final Map<String, String> OPERATORS = Map.of(
            "&&", "and",
            "||", "or",
            "===", "==",
            "!==", "!=",
            "?.", ".");

    private final FilterTable filters = FilterTable.builder()
            .named(StandardFilter.UPPERCASE, "upcase")
            .named(StandardFilter.LOWERCASE, "downcase")
            .named(StandardFilter.CAPITALIZE, "capitalize")
            .named(StandardFilter.TRIM, "strip")
            .put(StandardFilter.DATE, FilterDefinition.named("date", Filters.quotedWithDefaults("%Y-%m-%d")))
            .named(StandardFilter.CURRENCY, "money")
            .named(StandardFilter.NUMBER, "round")
            .named(StandardFilter.JSON, "json")
            .named(StandardFilter.ESCAPE, "escape")
            .named(StandardFilter.RAW, "raw")
            .put(StandardFilter.DEFAULT, FilterDefinition.named("default", Filters.quoted()))
            .named(StandardFilter.FIRST, "first")
            .named(StandardFilter.LAST, "last")
            .named(StandardFilter.LENGTH, "size")
            .put(StandardFilter.JOIN, FilterDefinition.named("join", Filters.quotedWithDefaults(", ")))
            .put(StandardFilter.SPLIT, FilterDefinition.named("split", Filters.quotedWithDefaults(",")))
            .named(StandardFilter.REVERSE, "reverse")
            .named(StandardFilter.SORT, "sort")
            .named(StandardFilter.SLICE, "slice")
            .put(StandardFilter.TRUNCATE, FilterDefinition.named("truncate", Filters.numberOr("50")))
            .build();

    private final MarkupRenderer markup = MarkupRenderer.html(this::formatAttributeExpression);

    @Override
    public String name() {
        return "liquid";
    }

    @Override
    public String fileExtension() {
        return ".liquid";
    }

    @Override
    public String description() {
        return "Liquid templates for Shopify, Jekyll and Eleventy";
    }

    @Override
    public BackendFeatures features() {
        return new BackendFeatures(false, true, true, false, true, true, true);
    }

    @Override
    public FilterTable filters() {
        return filters;
    }

    @Override
    public MarkupRenderer markup() {
        return markup;
    }

    /**
     * A named index is assigned from {@code forloop.index0} at the top of the body.
     */
    @Override
    public String renderLoop(Loop loop, String content, RenderContext context) {
        String open = "{% for " + loop.item + " in " + formatExpression(loop.collection) + " %}";
        if (loop.index != null) {
            open += "\n{% assign " + loop.index + " = forloop.index0 %}";
        }
        return block(open, content, "{% endfor %}");
    }

    @Override
    public String renderCondition(ConditionChain chain, RenderContext context) {
        return ConditionChains.composeBlocks(chain,
                expression -> "{% if " + formatExpression(expression) + " %}",
                this::renderElse,
                "{% endif %}");
    }

    @Override
    public String renderElse(String condition) {
        return condition != null ? "{% elsif " + formatExpression(condition) + " %}" : "{% else %}";
    }

    @Override
    public String renderVariable(Variable variable, RenderContext context) {
        String expression = formatExpression(variable.name);
        if (variable.defaultValue != null) {
            expression += " | default: " + Filters.defaultLiteral(variable.defaultValue);
        }
        if (variable.filter != null) {
            expression = applyFilter(expression, variable.filter, variable.filterArgs, context);
        }
        return "{{ " + expression + " }}";
    }

    @Override
    public String renderSlot(Slot slot, String defaultContent, RenderContext context) {
        String name = slotName(slot);
        if (defaultContent.isBlank()) return "{{ " + name + " }}";
        return "{% if " + name + " %}\n{{ " + name + " }}\n{% else %}\n" + defaultContent + "\n{% endif %}";
    }

    /**
     * Children are captured and handed to the partial as its {@code content}.
     */
    @Override
    public String renderInclude(Include include, String childrenContent, RenderContext context) {
        List<String> arguments = new ArrayList<>();
        for (Map.Entry<String, String> prop : include.props.entrySet()) {
            if (isSpread(prop.getKey())) {
                context.warn("Liquid includes cannot spread props; dropped: " + prop.getValue());
                continue;
            }
            arguments.add(prop.getKey() + ": " + formatExpression(prop.getValue()));
        }
        String capture = "";
        if (childrenContent != null && !childrenContent.isBlank()) {
            capture = block("{% capture " + INCLUDE_CONTENT + " %}", childrenContent, "{% endcapture %}") + "\n";
            arguments.add(DialectSupport.CONTENT_SLOT + ": " + INCLUDE_CONTENT);
        }
        String partial = singleQuoted(withExtension(include.partial, fileExtension()));
        String tag = arguments.isEmpty()
                ? "{% include " + partial + " %}"
                : "{% include " + partial + ", " + String.join(", ", arguments) + " %}";
        return capture + tag;
    }

    @Override
    public String renderBlock(Block block, String content, RenderContext context) {
        return block("{% capture " + block.name + " %}", content, "{% endcapture %}");
    }

    @Override
    public String renderExtends(String layout, RenderContext context) {
        context.warn("Liquid has no template inheritance; extends of " + layout + " left as a comment");
        return renderComment("extends " + singleQuoted(withExtension(layout, fileExtension())) + " is not supported in Liquid");
    }

    @Override
    public String renderComment(String text) {
        return "{% comment %}" + text + "{% endcomment %}";
    }

    @Override
    public String applyFilter(String expression, String filter, List<String> args, RenderContext context) {
        Optional<FilterDefinition> definition = Filters.resolve(filters, filter);
        String name = definition.map(d -> d.nativeName).orElse(filter);
        List<String> arguments = definition.isPresent() ? definition.get().formatArguments(args) : args;
        if (definition.isEmpty()) context.warn("Unknown filter '" + filter + "' emitted as Liquid filter " + filter);
        return arguments.isEmpty()
                ? expression + " | " + name
                : expression + " | " + name + ": " + String.join(", ", arguments);
    }

    /**
     * Word operators, {@code nil} for null and undefined, {@code .size} for {@code .length}, and
     * {@code x == blank} for a negated path, since Liquid has no unary not.
     */
    @Override
    public String formatExpression(String expression) {
        if (expression == null) return null;
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize(expression);
        StringBuilder out = new StringBuilder();
        ExpressionToken previous = null;
        int i = 0;
        while (i < tokens.size()) {
            ExpressionToken token = tokens.get(i);
            if (token.isOperator("!") && i + 1 < tokens.size() && tokens.get(i + 1).is(ExpressionToken.Type.IDENTIFIER)) {
                int end = i + 1;
                StringBuilder path = new StringBuilder(tokens.get(end).text);
                while (end + 2 < tokens.size()
                        && (tokens.get(end + 1).isOperator(".") || tokens.get(end + 1).isOperator("?."))
                        && tokens.get(end + 2).is(ExpressionToken.Type.IDENTIFIER)) {
                    path.append('.').append(member(tokens.get(end + 2).text));
                    end += 2;
                }
                out.append(path).append(" == blank");
                previous = tokens.get(end);
                i = end + 1;
                continue;
            }
            boolean member = previous != null && (previous.isOperator(".") || previous.isOperator("?."));
            if (token.is(ExpressionToken.Type.OPERATOR) && OPERATORS.containsKey(token.text)) {
                String replacement = OPERATORS.get(token.text);
                boolean word = Character.isLetter(replacement.charAt(0));
                if (word && out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) out.append(' ');
                out.append(replacement);
                if (word && i + 1 < tokens.size() && !tokens.get(i + 1).is(ExpressionToken.Type.WHITESPACE)) out.append(' ');
            } else if (token.is(ExpressionToken.Type.IDENTIFIER) && member) {
                out.append(member(token.text));
            } else if (token.is(ExpressionToken.Type.IDENTIFIER)
                    && (token.text.equals("null") || token.text.equals("undefined"))) {
                out.append("nil");
            } else {
                out.append(token.text);
            }
            if (!token.is(ExpressionToken.Type.WHITESPACE)) previous = token;
            i++;
        }
        return out.toString().trim();
    }

    private static String member(String name) {
        return name.equals("length") ? "size" : name;
    }

    @Override
    public String formatAttributeExpression(String expression) {
        return "{{ " + formatExpression(expression) + " }}";
    }

    @Override
    public ValidationResult validate(String output) {
        return OutputValidation.of(output)
                .notEmpty()
                .noSentinels()
                .pairedTags(TAG_OPEN, TAG_CLOSE, "control")
                .balancedOutside("{{", "}}", "output tags", "{%", "%}")
                .balanced("{%", "%}", "tag delimiters")
                .result();
    }
}
