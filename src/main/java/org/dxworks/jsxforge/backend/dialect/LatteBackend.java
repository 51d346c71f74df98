package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.backend.BackendFeatures;
import org.dxworks.jsxforge.backend.ConditionChain;
import org.dxworks.jsxforge.backend.ConditionChains;
import org.dxworks.jsxforge.backend.ExpressionRewriter;
import org.dxworks.jsxforge.backend.FilterDefinition;
import org.dxworks.jsxforge.backend.FilterTable;
import org.dxworks.jsxforge.backend.Filters;
import org.dxworks.jsxforge.backend.MarkupRenderer;
import org.dxworks.jsxforge.backend.OutputValidation;
import org.dxworks.jsxforge.backend.RenderContext;
import org.dxworks.jsxforge.backend.StandardFilter;
import org.dxworks.jsxforge.backend.TemplateBackend;
import org.dxworks.jsxforge.expression.ExpressionToken;
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
 * Latte, the Nette template engine. Variables carry PHP's {@code $} sigil and members are
 * read with {@code ->}.
 */
public class LatteBackend implements TemplateBackend {

    private static final Pattern TAG_OPEN = Pattern.compile("\\{(if|foreach|for|while|block|define|embed|capture)\\b");
    private static final Pattern TAG_CLOSE = Pattern.compile("\\{/(if|foreach|for|while|block|define|embed|capture)\\}");
    private static final Pattern LENGTH = Pattern.compile("(\\$\\w+(?:\\??->\\w+)*)\\??->length\\b");

    private final FilterTable filters = FilterTable.builder()
            .named(StandardFilter.UPPERCASE, "upper")
            .named(StandardFilter.LOWERCASE, "lower")
            .named(StandardFilter.CAPITALIZE, "capitalize")
            .named(StandardFilter.TRIM, "trim")
            .put(StandardFilter.DATE, FilterDefinition.named("date", Filters.quotedWithDefaults("Y-m-d")))
            .put(StandardFilter.CURRENCY, FilterDefinition.named("number", args -> List.of("2", "','", "' '")))
            .named(StandardFilter.NUMBER, "number")
            .named(StandardFilter.JSON, "json")
            .named(StandardFilter.ESCAPE, "escapeHtml")
            .named(StandardFilter.RAW, "noescape")
            .put(StandardFilter.DEFAULT, FilterDefinition.named("default", Filters.quoted()))
            .named(StandardFilter.FIRST, "first")
            .named(StandardFilter.LAST, "last")
            .named(StandardFilter.LENGTH, "length")
            .put(StandardFilter.JOIN, FilterDefinition.named("implode", Filters.quotedWithDefaults(", ")))
            .put(StandardFilter.SPLIT, FilterDefinition.named("explode", Filters.quotedWithDefaults(",")))
            .named(StandardFilter.REVERSE, "reverse")
            .named(StandardFilter.SORT, "sort")
            .named(StandardFilter.SLICE, "slice")
            .put(StandardFilter.TRUNCATE, FilterDefinition.named("truncate", Filters.numberOr("50")))
            .build();

    private final MarkupRenderer markup = MarkupRenderer.html(this::formatAttributeExpression);

    @Override
    public String name() {
        return "latte";
    }

    @Override
    public String fileExtension() {
        return ".latte";
    }

    @Override
    public String description() {
        return "Latte templates for the Nette framework";
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
        String target = loop.index != null ? "$" + loop.index + " => $" + loop.item : "$" + loop.item;
        return block("{foreach " + formatExpression(loop.collection) + " as " + target + "}", content, "{/foreach}");
    }

    @Override
    public String renderCondition(ConditionChain chain, RenderContext context) {
        return ConditionChains.composeBlocks(chain,
                expression -> "{if " + formatExpression(expression) + "}",
                this::renderElse,
                "{/if}");
    }

    @Override
    public String renderElse(String condition) {
        return condition != null ? "{elseif " + formatExpression(condition) + "}" : "{else}";
    }

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
        if (variable.raw) expression += "|noescape";
        return "{" + expression + "}";
    }

    @Override
    public String renderSlot(Slot slot, String defaultContent, RenderContext context) {
        return block("{block " + slotName(slot) + "}", defaultContent, "{/block}");
    }

    /**
     * {@code {include 'card.latte', title: $title}}; children make it an embed whose
     * content block they fill.
     */
    @Override
    public String renderInclude(Include include, String childrenContent, RenderContext context) {
        List<String> arguments = new ArrayList<>();
        for (Map.Entry<String, String> prop : include.props.entrySet()) {
            String value = formatExpression(prop.getValue());
            arguments.add(isSpread(prop.getKey()) ? "(expand) " + value : prop.getKey() + ": " + value);
        }
        String target = singleQuoted(withExtension(include.partial, fileExtension()));
        if (!arguments.isEmpty()) target += ", " + String.join(", ", arguments);
        if (childrenContent == null || childrenContent.isBlank()) {
            return "{include " + target + "}";
        }
        String content = block("{block " + DialectSupport.CONTENT_SLOT + "}", childrenContent, "{/block}");
        return block("{embed " + target + "}", content, "{/embed}");
    }

    @Override
    public String renderBlock(Block block, String content, RenderContext context) {
        return block("{block " + block.name + "}", content, "{/block}");
    }

    @Override
    public String renderExtends(String layout, RenderContext context) {
        return "{layout " + singleQuoted(withExtension(layout, fileExtension())) + "}";
    }

    @Override
    public String renderComment(String text) {
        return "{* " + text + " *}";
    }

    @Override
    public String applyFilter(String expression, String filter, List<String> args, RenderContext context) {
        Optional<FilterDefinition> definition = Filters.resolve(filters, filter);
        String name = definition.map(d -> d.nativeName).orElse(filter);
        List<String> arguments = definition.isPresent() ? definition.get().formatArguments(args) : args;
        if (definition.isEmpty()) context.warn("Unknown filter '" + filter + "' emitted as Latte filter " + filter);
        return arguments.isEmpty()
                ? expression + "|" + name
                : expression + "|" + name + ":" + String.join(", ", arguments);
    }

    /**
     * {@code user.name} becomes {@code $user->name}, {@code undefined} becomes {@code null}
     * and {@code .length} becomes {@code count(...)}.
     */
    @Override
    public String formatExpression(String expression) {
        if (expression == null) return null;
        String withNull = ExpressionRewriter.rewrite(expression, (token, previous) ->
                token.is(ExpressionToken.Type.IDENTIFIER) && token.text.equals("undefined")
                        && (previous == null || !previous.isOperator(".") && !previous.isOperator("?."))
                        ? "null"
                        : token.text);
        String php = ExpressionRewriter.sigilVariables(withNull, "$", "->");
        return LENGTH.matcher(php).replaceAll("count($1)").trim();
    }

    @Override
    public String formatAttributeExpression(String expression) {
        return "{" + formatExpression(expression) + "}";
    }

    @Override
    public ValidationResult validate(String output) {
        return OutputValidation.of(output)
                .notEmpty()
                .noSentinels()
                .pairedTags(TAG_OPEN, TAG_CLOSE, "block")
                .result();
    }
}
