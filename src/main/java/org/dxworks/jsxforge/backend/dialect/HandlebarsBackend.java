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

/**
 * Logic-less mustache dialect. Conditions and loops are paired block tags, filters are helper
 * calls and includes are partials with {@code key=value} hash arguments.
 */
public class HandlebarsBackend implements TemplateBackend {

    private static final Pattern BLOCK_OPEN = Pattern.compile("\\{\\{~?#");
    private static final Pattern BLOCK_CLOSE = Pattern.compile("\\{\\{~?/");
    private static final Pattern MUSTACHE_OPEN = Pattern.compile("\\{\\{(?!\\{)");
    private static final Pattern MUSTACHE_CLOSE = Pattern.compile("(?<!\\})\\}\\}");

    private static final String PARTIAL_BLOCK = "@partial-block";

    private final FilterTable filters = FilterTable.builder()
            .named(StandardFilter.UPPERCASE, "uppercase")
            .named(StandardFilter.LOWERCASE, "lowercase")
            .named(StandardFilter.CAPITALIZE, "capitalize")
            .named(StandardFilter.TRIM, "trim")
            .put(StandardFilter.DATE, FilterDefinition.named("formatDate", Filters.quotedWithDefaults("YYYY-MM-DD")))
            .named(StandardFilter.CURRENCY, "formatCurrency")
            .named(StandardFilter.NUMBER, "formatNumber")
            .named(StandardFilter.JSON, "json")
            .named(StandardFilter.ESCAPE, "escape")
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
        return "handlebars";
    }

    @Override
    public String fileExtension() {
        return ".hbs";
    }

    @Override
    public String description() {
        return "Handlebars templates for Express.js and static sites";
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

    /**
     * {@code {{#each items}}}; block params only when the index is named.
     */
    @Override
    public String renderLoop(Loop loop, String content, RenderContext context) {
        String collection = HandlebarsExpressions.path(loop.collection);
        String open = loop.index != null
                ? "{{#each " + collection + " as |" + loop.item + " " + loop.index + "|}}"
                : "{{#each " + collection + "}}";
        return block(open, content, "{{/each}}");
    }

    @Override
    public String renderCondition(ConditionChain chain, RenderContext context) {
        return ConditionChains.composeBlocks(chain,
                expression -> "{{#if " + formatExpression(expression) + "}}",
                this::renderElse,
                "{{/if}}");
    }

    @Override
    public String renderElse(String condition) {
        return condition != null ? "{{else if " + formatExpression(condition) + "}}" : "{{else}}";
    }

    @Override
    public String renderVariable(Variable variable, RenderContext context) {
        String expression = HandlebarsExpressions.path(variable.name);
        if (variable.defaultValue != null) {
            expression = variable.filter != null
                    ? "(default " + expression + " " + Filters.defaultLiteral(variable.defaultValue) + ")"
                    : "default " + expression + " " + Filters.defaultLiteral(variable.defaultValue);
        }
        if (variable.filter != null) {
            expression = helperCall(expression, variable.filter, variable.filterArgs, context);
        }
        return variable.raw ? "{{{" + expression + "}}}" : "{{" + expression + "}}";
    }

    /**
     * The unnamed slot is the partial block of the caller; named slots are partials with an
     * inline fallback.
     */
    @Override
    public String renderSlot(Slot slot, String defaultContent, RenderContext context) {
        if (slot.isDefault()) {
            if (defaultContent.isBlank()) return "{{> " + PARTIAL_BLOCK + "}}";
            return "{{#if " + PARTIAL_BLOCK + "}}\n{{> " + PARTIAL_BLOCK + "}}\n{{else}}\n"
                    + defaultContent + "\n{{/if}}";
        }
        if (defaultContent.isBlank()) return "{{> " + slot.name + "}}";
        return block("{{#> " + slot.name + "}}", defaultContent, "{{/" + slot.name + "}}");
    }

    @Override
    public String renderInclude(Include include, String childrenContent, RenderContext context) {
        String partial = include.partial.endsWith(fileExtension())
                ? include.partial.substring(0, include.partial.length() - fileExtension().length())
                : include.partial;
        List<String> dropped = new ArrayList<>();
        String arguments = partialArguments(include.props, dropped, context);
        String marker = dropped.isEmpty()
                ? ""
                : renderComment("unsupported partial arguments: " + String.join(", ", dropped));
        if (childrenContent == null || childrenContent.isBlank()) {
            return marker + "{{> " + partial + arguments + "}}";
        }
        return marker + block("{{#> " + partial + arguments + "}}", childrenContent, "{{/" + partial + "}}");
    }

    /**
     * A spread becomes the partial's context argument, everything else a hash argument. Values
     * a hash argument cannot hold are left out and their keys added to {@code dropped}.
     */
    private String partialArguments(Map<String, String> props, List<String> dropped, RenderContext context) {
        StringBuilder arguments = new StringBuilder();
        List<String> hash = new ArrayList<>();
        boolean contextSet = false;
        for (Map.Entry<String, String> prop : props.entrySet()) {
            if (isSpread(prop.getKey())) {
                if (contextSet) {
                    context.warn("Handlebars partials take one context object; extra spread dropped: " + prop.getValue());
                    continue;
                }
                arguments.append(' ').append(HandlebarsExpressions.path(prop.getValue()));
                contextSet = true;
                continue;
            }
            Optional<String> value = hashValue(prop.getValue());
            if (value.isPresent()) {
                hash.add(prop.getKey() + "=" + value.get());
            } else {
                context.warn("Handlebars partial argument " + prop.getKey()
                        + " is not a path or helper expression; dropped: " + prop.getValue());
                dropped.add(prop.getKey());
            }
        }
        for (String pair : hash) arguments.append(' ').append(pair);
        return arguments.toString();
    }

    // object, array and template literals have no hash-argument form
    private static Optional<String> hashValue(String value) {
        if (value == null || value.contains("`")) return Optional.empty();
        if (value.trim().matches("-\\d+(\\.\\d+)?")) return Optional.of(value.trim());
        return HandlebarsExpressions.tryHelpers(value);
    }

    @Override
    public String renderBlock(Block block, String content, RenderContext context) {
        return block("{{#*inline \"" + block.name + "\"}}", content, "{{/inline}}");
    }

    /**
     * Layouts are chosen by the host application; the template records which one it expects.
     */
    @Override
    public String renderExtends(String layout, RenderContext context) {
        return "{{!-- layout: " + layout + " --}}";
    }

    @Override
    public String renderComment(String text) {
        return "{{!-- " + text + " --}}";
    }

    @Override
    public String applyFilter(String expression, String filter, List<String> args, RenderContext context) {
        return "(" + helperCall(expression, filter, args, context) + ")";
    }

    private String helperCall(String expression, String filter, List<String> args, RenderContext context) {
        Optional<FilterDefinition> definition = Filters.resolve(filters, filter);
        String helper = definition.map(d -> d.nativeName).orElse(filter);
        List<String> arguments = definition.isPresent() ? definition.get().formatArguments(args) : args;
        if (definition.isEmpty()) context.warn("Unknown filter '" + filter + "' emitted as helper " + filter);
        StringBuilder call = new StringBuilder(helper).append(' ').append(expression);
        for (String argument : arguments) call.append(' ').append(argument);
        return call.toString();
    }

    @Override
    public String formatExpression(String expression) {
        return HandlebarsExpressions.toHelpers(expression);
    }

    @Override
    public String formatAttributeExpression(String expression) {
        return "{{" + formatExpression(expression) + "}}";
    }

    @Override
    public ValidationResult validate(String output) {
        return OutputValidation.of(output)
                .notEmpty()
                .noSentinels()
                .pairedTags(BLOCK_OPEN, BLOCK_CLOSE, "block helper")
                .pairedTags(MUSTACHE_OPEN, MUSTACHE_CLOSE, "mustache")
                .result();
    }
}
