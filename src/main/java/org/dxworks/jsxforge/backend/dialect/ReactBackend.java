package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.backend.BackendFeatures;
import org.dxworks.jsxforge.backend.ConditionBranch;
import org.dxworks.jsxforge.backend.ConditionChain;
import org.dxworks.jsxforge.backend.FilterDefinition;
import org.dxworks.jsxforge.backend.FilterTable;
import org.dxworks.jsxforge.backend.Filters;
import org.dxworks.jsxforge.backend.JsxFormatter;
import org.dxworks.jsxforge.backend.MarkupRenderer;
import org.dxworks.jsxforge.backend.OutputValidation;
import org.dxworks.jsxforge.backend.RenderContext;
import org.dxworks.jsxforge.backend.StandardFilter;
import org.dxworks.jsxforge.backend.TemplateBackend;
import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.model.ComponentMeta;
import org.dxworks.jsxforge.model.Doctype;
import org.dxworks.jsxforge.model.PropDefinition;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.SourceImport;
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

import static org.dxworks.jsxforge.backend.dialect.DialectSupport.isSpread;

/**
 * React components. Loops become {@code map} calls, conditions ternaries (or an immediately
 * invoked function once an else-if appears), filters plain JavaScript.
 */
public class ReactBackend implements TemplateBackend {

    private static final String FRAGMENT = "Fragment";
    private static final String CHILDREN = "children";

    private final FilterTable filters = FilterTable.builder()
            .put(StandardFilter.UPPERCASE, FilterDefinition.rewriting((e, a) -> e + ".toUpperCase()"))
            .put(StandardFilter.LOWERCASE, FilterDefinition.rewriting((e, a) -> e + ".toLowerCase()"))
            .put(StandardFilter.CAPITALIZE, FilterDefinition.rewriting((e, a) -> e + ".charAt(0).toUpperCase() + " + e + ".slice(1)"))
            .put(StandardFilter.TRIM, FilterDefinition.rewriting((e, a) -> e + ".trim()"))
            .put(StandardFilter.DATE, FilterDefinition.rewriting((e, a) -> "new Date(" + e + ").toLocaleDateString()"))
            .put(StandardFilter.CURRENCY, FilterDefinition.rewriting((e, a) ->
                    "new Intl.NumberFormat(undefined, { style: \"currency\", currency: "
                            + Filters.literal(a.isEmpty() ? "USD" : a.get(0)) + " }).format(" + e + ")"))
            .put(StandardFilter.NUMBER, FilterDefinition.rewriting((e, a) -> e + ".toLocaleString()"))
            .put(StandardFilter.JSON, FilterDefinition.rewriting((e, a) -> "JSON.stringify(" + e + ")"))
            .put(StandardFilter.ESCAPE, FilterDefinition.rewriting((e, a) -> e))
            .put(StandardFilter.RAW, FilterDefinition.rewriting((e, a) -> e))
            .put(StandardFilter.DEFAULT, FilterDefinition.rewriting((e, a) ->
                    "(" + e + " ?? " + Filters.literal(a.isEmpty() ? "" : a.get(0)) + ")"))
            .put(StandardFilter.FIRST, FilterDefinition.rewriting((e, a) -> e + "[0]"))
            .put(StandardFilter.LAST, FilterDefinition.rewriting((e, a) -> e + "[" + e + ".length - 1]"))
            .put(StandardFilter.LENGTH, FilterDefinition.rewriting((e, a) -> e + ".length"))
            .put(StandardFilter.JOIN, FilterDefinition.rewriting((e, a) ->
                    e + ".join(" + Filters.literal(a.isEmpty() ? ", " : a.get(0)) + ")"))
            .put(StandardFilter.SPLIT, FilterDefinition.rewriting((e, a) ->
                    e + ".split(" + Filters.literal(a.isEmpty() ? "," : a.get(0)) + ")"))
            .put(StandardFilter.REVERSE, FilterDefinition.rewriting((e, a) -> "[..." + e + "].reverse()"))
            .put(StandardFilter.SORT, FilterDefinition.rewriting((e, a) -> "[..." + e + "].sort()"))
            .put(StandardFilter.SLICE, FilterDefinition.rewriting((e, a) ->
                    e + ".slice(" + (a.isEmpty() ? "0" : String.join(", ", a)) + ")"))
            .put(StandardFilter.TRUNCATE, FilterDefinition.rewriting((e, a) ->
                    e + ".substring(0, " + (a.isEmpty() ? "50" : a.get(0).trim()) + ")"))
            .build();

    private final MarkupRenderer markup = MarkupRenderer.jsx();

    @Override
    public String name() {
        return "react";
    }

    @Override
    public String fileExtension() {
        return ".jsx";
    }

    @Override
    public String description() {
        return "React function components in JSX";
    }

    @Override
    public BackendFeatures features() {
        return new BackendFeatures(false, true, false, false, true, true, true);
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
     * Characters JSX text cannot hold literally are written as character references.
     */
    @Override
    public String renderText(String text) {
        return text.replace("{", "&#123;").replace("}", "&#125;").replace("<", "&lt;").replace(">", "&gt;");
    }

    @Override
    public String renderDoctype(Doctype doctype) {
        return "";
    }

    /**
     * {@code {items.map((item) => (<Fragment key={item.id}>...</Fragment>))}}. The index
     * parameter is declared when it is named in the source or the key needs it.
     */
    @Override
    public String renderLoop(Loop loop, String content, RenderContext context) {
        String collection = formatExpression(loop.collection);
        if (collection.contains(".")) collection = "(" + collection + " ?? [])";
        String index = loop.index != null ? loop.index : "index";
        String key = loop.key != null ? loop.key : index;
        boolean needsIndex = loop.index != null || ExpressionTokenizer.rootIdentifiers(key).contains(index);
        String parameters = needsIndex ? loop.item + ", " + index : loop.item;

        StringBuilder out = new StringBuilder();
        out.append('{').append(collection).append(".map((").append(parameters).append(") => (\n");
        out.append("  <" + FRAGMENT + " key={").append(key).append("}>\n");
        String body = JsxFormatter.format(content);
        if (!body.isEmpty()) out.append(JsxFormatter.indent(body, 2)).append('\n');
        out.append("  </" + FRAGMENT + ">\n");
        out.append("))}");
        return out.toString();
    }

    /**
     * Ternary for IF and IF/ELSE; an immediately invoked function with one guarded return
     * per branch as soon as the chain has an ELSE_IF.
     */
    @Override
    public String renderCondition(ConditionChain chain, RenderContext context) {
        ConditionBranch first = chain.ifBranch();
        ConditionBranch otherwise = chain.elseBranch();
        if (!chain.hasElseIf()) {
            return "{" + formatExpression(first.expression()) + " ? " + fragment(first.content)
                    + " : " + (otherwise != null ? fragment(otherwise.content) : "null") + "}";
        }

        List<String> lines = new ArrayList<>();
        lines.add("{(() => {");
        lines.add(guardedReturn(first.expression(), first.content));
        for (ConditionBranch branch : chain.elseIfBranches()) {
            lines.add(guardedReturn(branch.expression(), branch.content));
        }
        lines.add(otherwise != null ? guardedReturn(null, otherwise.content) : "  return null;");
        lines.add("})()}");
        return String.join("\n", lines);
    }

    private String guardedReturn(String condition, String content) {
        String statement = renderElse(condition) + fragment(content) + ";";
        return JsxFormatter.indent(statement, 1);
    }

    /**
     * The start of a return statement inside the immediately invoked function.
     */
    @Override
    public String renderElse(String condition) {
        return condition != null ? "if (" + formatExpression(condition) + ") return " : "return ";
    }

    /**
     * {@code (<>...</>)}; content that spans lines gets the fragment on lines of its own.
     */
    private static String fragment(String content) {
        String formatted = JsxFormatter.format(content);
        if (formatted.isEmpty()) return "null";
        if (!formatted.contains("\n")) return "(<>" + formatted + "</>)";
        return "(\n  <>\n" + JsxFormatter.indent(formatted, 2) + "\n  </>\n)";
    }

    @Override
    public String renderVariable(Variable variable, RenderContext context) {
        String expression = formatExpression(variable.name);
        if (variable.defaultValue != null) {
            expression += " ?? " + Filters.defaultLiteral(variable.defaultValue);
        }
        if (variable.filter != null) {
            expression = applyFilter(expression, variable.filter, variable.filterArgs, context);
        }
        if (variable.raw) {
            return "<span dangerouslySetInnerHTML={{ __html: " + expression + " }} />";
        }
        return "{" + expression + "}";
    }

    /**
     * The default slot is the {@code children} prop; named slots are props of their own.
     */
    @Override
    public String renderSlot(Slot slot, String defaultContent, RenderContext context) {
        String prop = slot.isDefault() ? CHILDREN : slot.name;
        if (defaultContent == null || defaultContent.isBlank()) return "{" + prop + "}";
        return "{" + prop + " ?? " + fragment(defaultContent) + "}";
    }

    @Override
    public String renderInclude(Include include, String childrenContent, RenderContext context) {
        String component = include.originalName != null ? include.originalName : componentName(include.partial);
        StringBuilder tag = new StringBuilder("<").append(component);
        for (Map.Entry<String, String> prop : include.props.entrySet()) {
            String value = prop.getValue();
            tag.append(' ');
            if (isSpread(prop.getKey())) {
                tag.append("{...").append(value).append('}');
            } else if ("true".equals(value)) {
                tag.append(prop.getKey());
            } else if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                tag.append(prop.getKey()).append('=').append(value);
            } else {
                tag.append(prop.getKey()).append("={").append(value).append('}');
            }
        }
        if (childrenContent == null || childrenContent.isBlank()) return tag.append(" />").toString();
        return tag.append('>').append(childrenContent.strip()).append("</").append(component).append('>').toString();
    }

    /**
     * {@code partials/user-card} is written as {@code UserCard}.
     */
    static String componentName(String partial) {
        String base = partial.substring(partial.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        if (dot > 0) base = base.substring(0, dot);
        StringBuilder name = new StringBuilder();
        for (String part : base.split("[-_]")) {
            if (part.isEmpty()) continue;
            name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return name.toString();
    }

    @Override
    public String renderBlock(Block block, String content, RenderContext context) {
        return renderComment("block: " + block.name) + "\n" + content + "\n" + renderComment("/block: " + block.name);
    }

    @Override
    public String renderExtends(String layout, RenderContext context) {
        context.warn("React has no template inheritance; extends of " + layout + " needs composition instead");
        return renderComment("extends: " + layout + ", use composition instead");
    }

    @Override
    public String renderComment(String text) {
        return "{/* " + text.replace("*/", "* /") + " */}";
    }

    @Override
    public String applyFilter(String expression, String filter, List<String> args, RenderContext context) {
        String target = ExpressionTokenizer.isPath(expression) ? expression : "(" + expression + ")";
        Optional<FilterDefinition> definition = Filters.resolve(filters, filter);
        if (definition.isPresent()) return definition.get().rewrite(target, args);
        context.warn("Unknown filter '" + filter + "' emitted as method call " + filter + "()");
        return target + "." + filter + "(" + String.join(", ", args == null ? List.of() : args) + ")";
    }

    @Override
    public String formatExpression(String expression) {
        return expression == null ? null : expression.trim();
    }

    @Override
    public String formatAttributeExpression(String expression) {
        return formatExpression(expression);
    }

    @Override
    public ValidationResult validate(String output) {
        return OutputValidation.of(output)
                .notEmpty()
                .noSentinels()
                .nestedBraces("expression braces")
                .result();
    }

    /**
     * Always re-indented. A source that had imports comes back as a whole module: its imports,
     * the exported function with destructured props, the statements before the return, and
     * the markup.
     */
    @Override
    public String finishDocument(Root root, String body, RenderContext context) {
        String jsx = JsxFormatter.format(body);
        ComponentMeta meta = root.meta;
        if (!meta.hasImports()) return jsx + "\n";

        StringBuilder out = new StringBuilder();
        for (String line : importLines(meta.imports, jsx.contains("<" + FRAGMENT))) out.append(line).append('\n');
        out.append('\n');

        String name = meta.componentName != null ? meta.componentName : "Template";
        out.append(meta.exports.contains("default") ? "export default function " : "export function ")
                .append(name).append('(').append(propsPattern(meta.props)).append(") {\n");
        if (!meta.preamble.isBlank()) {
            out.append(JsxFormatter.indent(meta.preamble.strip(), 1)).append("\n\n");
        }
        if (JsxFormatter.rootCount(jsx) > 1) {
            jsx = "<>\n" + JsxFormatter.indent(jsx, 1) + "\n</>";
        }
        out.append("  return (\n");
        if (!jsx.isEmpty()) out.append(JsxFormatter.indent(jsx, 2)).append('\n');
        out.append("  );\n");
        out.append("}\n");
        return out.toString();
    }

    private static List<String> importLines(List<SourceImport> imports, boolean needsFragment) {
        List<String> lines = new ArrayList<>();
        boolean fragmentImported = false;
        for (SourceImport source : imports) {
            List<String> named = new ArrayList<>(source.namedImports);
            if (needsFragment && "react".equals(source.source) && source.namespaceImport == null
                    && !named.contains(FRAGMENT)) {
                named.add(FRAGMENT);
            }
            if (named.contains(FRAGMENT) && "react".equals(source.source)) fragmentImported = true;
            lines.add(importLine(source, named));
        }
        if (needsFragment && !fragmentImported) lines.add("import { " + FRAGMENT + " } from 'react';");
        return lines;
    }

    private static String importLine(SourceImport source, List<String> named) {
        String from = "'" + source.source + "'";
        if (source.namespaceImport != null) {
            String prefix = source.defaultImport != null ? source.defaultImport + ", " : "";
            return "import " + prefix + "* as " + source.namespaceImport + " from " + from + ";";
        }
        List<String> parts = new ArrayList<>();
        if (source.defaultImport != null) parts.add(source.defaultImport);
        if (!named.isEmpty()) parts.add("{ " + String.join(", ", named) + " }");
        if (parts.isEmpty()) return "import " + from + ";";
        return "import " + String.join(", ", parts) + " from " + from + ";";
    }

    private static String propsPattern(List<PropDefinition> props) {
        List<String> names = new ArrayList<>();
        for (PropDefinition prop : props) {
            if (!ExpressionTokenizer.isIdentifier(prop.name)) continue;
            names.add(prop.defaultValue != null ? prop.name + " = " + prop.defaultValue : prop.name);
        }
        return names.isEmpty() ? "" : "{ " + String.join(", ", names) + " }";
    }

    @Override
    public String outputFileName(ComponentMeta meta) {
        if (meta != null && meta.componentName != null) return meta.componentName + fileExtension();
        return TemplateBackend.super.outputFileName(meta);
    }
}
