package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.analyzer.SyntaxHelper;
import org.dxworks.jsxforge.model.ComponentMeta;
import org.dxworks.jsxforge.model.Doctype;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.ValidationResult;
import org.dxworks.jsxforge.model.annotation.Block;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Slot;
import org.dxworks.jsxforge.model.annotation.Variable;

import java.nio.file.Path;
import java.util.List;

/**
 * A target template dialect. One render operation per annotation kind; every method receives
 * content that is already rendered. Implementations are stateless and shared between
 * compilations, anything per compilation goes through the {@link RenderContext}.
 */
public interface TemplateBackend {

    String name();

    String fileExtension();

    String description();

    BackendFeatures features();

    FilterTable filters();

    /**
     * How plain elements are written in this dialect.
     */
    MarkupRenderer markup();

    String renderLoop(Loop loop, String content, RenderContext context);

    /**
     * Folds a whole IF, ELSE_IF*, ELSE? run into one conditional.
     */
    String renderCondition(ConditionChain chain, RenderContext context);

    /**
     * The separator that starts an ELSE_IF branch ({@code condition} set) or the ELSE branch.
     */
    String renderElse(String condition);

    String renderVariable(Variable variable, RenderContext context);

    String renderSlot(Slot slot, String defaultContent, RenderContext context);

    /**
     * @param childrenContent rendered children of the include, empty when there are none
     */
    String renderInclude(Include include, String childrenContent, RenderContext context);

    String renderBlock(Block block, String content, RenderContext context);

    String renderExtends(String layout, RenderContext context);

    String renderComment(String text);

    /**
     * Composes a filter into a larger expression. Unknown filter names become a literal
     * native call.
     */
    String applyFilter(String expression, String filter, List<String> args, RenderContext context);

    /**
     * An opaque JavaScript expression spelled in this dialect, without output delimiters.
     */
    String formatExpression(String expression);

    /**
     * A dynamic value inside an attribute.
     */
    String formatAttributeExpression(String expression);

    ValidationResult validate(String output);

    default String renderText(String text) {
        return text;
    }

    default String renderDoctype(Doctype doctype) {
        return "<!DOCTYPE " + doctype.name + ">";
    }

    default String finishDocument(Root root, String body, RenderContext context) {
        return context.isPrettyPrint() ? body.strip() + "\n" : body;
    }

    default String outputFileName(ComponentMeta meta) {
        String base;
        if (meta != null && meta.componentName != null) {
            base = SyntaxHelper.kebabCase(meta.componentName);
        } else if (meta != null && meta.sourceFile != null) {
            String file = Path.of(meta.sourceFile).getFileName().toString();
            int dot = file.lastIndexOf('.');
            base = dot > 0 ? file.substring(0, dot) : file;
        } else {
            base = "template";
        }
        return base + fileExtension();
    }
}
