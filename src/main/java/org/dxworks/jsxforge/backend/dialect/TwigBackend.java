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
 * Twig, for Symfony and other PHP applications. Blocks and extends are native.
 */
public class TwigBackend implements TemplateBackend {

    private static final Pattern TAG_OPEN = Pattern.compile("\\{%-?\\s*(if|for|block|macro|embed|apply|with)\\b");
    private static final Pattern TAG_CLOSE = Pattern.compile("\\{%-?\\s*end(if|for|block|macro|embed|apply|with)\\b");

    private static final Map<String, String> OPERATORS = Map.of(
            "&&", "and",
            "||", "or",
            "!", "not",
            "===", "==",
            "!==", "!=",
            "?.", ".");

    private final FilterTable filters = FilterTable.builder()
            .named(StandardFilter.UPPERCASE, "upper")
            .named(StandardFilter.LOWERCASE, "lower")
            .named(StandardFilter.CAPITALIZE, "capitalize")
            .named(StandardFilter.TRIM, "trim")
            .put(StandardFilter.DATE, FilterDefinition.named("date", Filters.quotedWithDefaults("Y-m-d")))
            .put(StandardFilter.CURRENCY, FilterDefinition.named("format_currency", Filters.quotedWithDefaults("USD")))
            .named(StandardFilter.NUMBER, "number_format")
            .named(StandardFilter.JSON, "json_encode")
            .named(StandardFilter.ESCAPE, "e")
            .named(StandardFilter.RAW, "raw")
            .put(StandardFilter.DEFAULT, FilterDefinition.named("default", Filters.quoted()))
            .named(StandardFilter.FIRST, "first")
            .named(StandardFilter.LAST, "last")
            .named(StandardFilter.LENGTH, "length")
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
        return "twig";
    }

    @Override
    public String fileExtension() {
        return ".twig";
    }

    @Override
    public String description() {
        return "Twig templates for Symfony and PHP applications";
    }

    @Override
    public BackendFeatures features() {
        return new BackendFeatures(true, true, true, true, false, true, true);
    }

    @Override
    public FilterTable filters() {
        return filters;
    }

    @Override
    public MarkupRenderer markup() {
        return markup;
    }

    @Override
    public String renderLoop(Loop loop, String content, RenderContext context) {
        String target = loop.index != null ? loop.index + ", " + loop.item : loop.item;
        return block("{% for " + target + " in " + formatExpression(loop.collection) + " %}", content, "{% endfor %}");
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
        return condition != null ? "{% elseif " + formatExpression(condition) + " %}" : "{% else %}";
    }

    /**
     * {@code {{ name ?? "x" }}}; with a filter the coalescing is parenthesised so the filter
     * applies to the result.
     */
    @Override
    public String renderVariable(Variable variable, RenderContext context) {
        String expression = formatExpression(variable.name);
        if (variable.defaultValue != null) {
            expression += " ?? " + Filters.defaultLiteral(variable.defaultValue);
            if (variable.filter != null || variable.raw) expression = "(" + expression + ")";
        }
        if (variable.filter != null) {
            expression = applyFilter(expression, variable.filter, variable.filterArgs, context);
        }
        if (variable.raw) expression += "|raw";
        return "{{ " + expression + " }}";
    }

    @Override
    public String renderSlot(Slot slot, String defaultContent, RenderContext context) {
        return block("{% block " + slotName(slot) + " %}", defaultContent, "{% endblock %}");
    }

    /**
     * Children turn the include into an embed that overrides the partial's content block.
     */
    @Override
    public String renderInclude(Include include, String childrenContent, RenderContext context) {
        String partial = singleQuoted(withExtension(include.partial, fileExtension()));
        String with = withClause(include.props);
        if (childrenContent == null || childrenContent.isBlank()) {
            return "{% include " + partial + with + " %}";
        }
        String content = block("{% block " + DialectSupport.CONTENT_SLOT + " %}", childrenContent, "{% endblock %}");
        return block("{% embed " + partial + with + " %}", content, "{% endembed %}");
    }

    /**
     * {@code  with {k: v}}; spreads are merged in front of the explicit keys.
     */
    private String withClause(Map<String, String> props) {
        if (props.isEmpty()) return "";
        List<String> spreads = new ArrayList<>();
        List<String> pairs = new ArrayList<>();
        for (Map.Entry<String, String> prop : props.entrySet()) {
            if (isSpread(prop.getKey())) {
                spreads.add(formatExpression(prop.getValue()));
            } else {
                pairs.add(prop.getKey() + ": " + formatExpression(prop.getValue()));
            }
        }
        String hash = "{" + String.join(", ", pairs) + "}";
        if (spreads.isEmpty()) return " with " + hash;
        StringBuilder merged = new StringBuilder(spreads.get(0));
        for (int i = 1; i < spreads.size(); i++) merged.append("|merge(").append(spreads.get(i)).append(')');
        if (!pairs.isEmpty()) merged.append("|merge(").append(hash).append(')');
        return " with " + merged;
    }

    @Override
    public String renderBlock(Block block, String content, RenderContext context) {
        return block("{% block " + block.name + " %}", content, "{% endblock %}");
    }

    @Override
    public String renderExtends(String layout, RenderContext context) {
        return "{% extends " + singleQuoted(withExtension(layout, fileExtension())) + " %}";
    }

    @Override
    public String renderComment(String text) {
        return "{# " + text + " #}";
    }

    @Override
    public String applyFilter(String expression, String filter, List<String> args, RenderContext context) {
        Optional<FilterDefinition> definition = Filters.resolve(filters, filter);
        String name = definition.map(d -> d.nativeName).orElse(filter);
        List<String> arguments = definition.isPresent() ? definition.get().formatArguments(args) : args;
        if (definition.isEmpty()) context.warn("Unknown filter '" + filter + "' emitted as Twig filter " + filter);
        return arguments.isEmpty()
                ? expression + "|" + name
                : expression + "|" + name + "(" + String.join(", ", arguments) + ")";
    }

    /**
     * Word operators, {@code null} for undefined and the {@code length} filter for
     * {@code .length}.
     */
    @Override
    public String formatExpression(String expression) {
        if (expression == null) return null;
        List<ExpressionToken> tokens = ExpressionTokenizer.tokenize(expression);
        StringBuilder out = new StringBuilder();
        ExpressionToken previous = null;
        for (int i = 0; i < tokens.size(); i++) {
            ExpressionToken token = tokens.get(i);
            boolean member = previous != null && (previous.isOperator(".") || previous.isOperator("?."));
            if (member && token.is(ExpressionToken.Type.IDENTIFIER) && token.text.equals("length")) {
                out.setLength(out.length() - 1);
                out.append("|length");
            } else if (token.is(ExpressionToken.Type.OPERATOR) && OPERATORS.containsKey(token.text)) {
                String replacement = OPERATORS.get(token.text);
                boolean word = Character.isLetter(replacement.charAt(0));
                if (word && out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) out.append(' ');
                out.append(replacement);
                if (word && i + 1 < tokens.size() && !tokens.get(i + 1).is(ExpressionToken.Type.WHITESPACE)) out.append(' ');
            } else if (!member && token.is(ExpressionToken.Type.IDENTIFIER) && token.text.equals("undefined")) {
                out.append("null");
            } else {
                out.append(token.text);
            }
            if (!token.is(ExpressionToken.Type.WHITESPACE)) previous = token;
        }
        return out.toString().trim();
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
                .pairedTags(TAG_OPEN, TAG_CLOSE, "block")
                .balancedOutside("{{", "}}", "output tags", "{%", "%}", "{#", "#}")
                .balanced("{%", "%}", "tag delimiters")
                .balanced("{#", "#}", "comments")
                .result();
    }
}
