package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.TemplateCompilationException;
import org.dxworks.jsxforge.analyzer.dsl.DslHandlerRegistry;
import org.dxworks.jsxforge.model.ComponentMeta;
import org.dxworks.jsxforge.model.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Source text to annotated intermediate tree. Holds only read-only collaborators, so one
 * instance serves any number of concurrent compilations.
 */
public class SourceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SourceAnalyzer.class);

    static final String NO_JSX_WARNING = "No JSX found in source";

    private final SourceParser parser;
    private final DslHandlerRegistry dslHandlers;
    private final ExpressionAnalyzer expressionAnalyzer = new ExpressionAnalyzer();
    private final ComponentLocator componentLocator = new ComponentLocator();

    public SourceAnalyzer(SourceParser parser, DslHandlerRegistry dslHandlers) {
        this.parser = parser;
        this.dslHandlers = dslHandlers;
    }

    public AnalysisResult analyze(String source, AnalysisOptions options) {
        SyntaxNode program = parser.parse(source);
        LocatedComponent component = componentLocator.locate(program, options.componentName);
        List<String> warnings = new ArrayList<>();

        if (program.hasError()) {
            SyntaxNode error = SyntaxHelper.findFirstDescendant(program, SyntaxNode.ERROR);
            String where = error != null ? " near line " + error.line : "";
            if (!component.hasMarkup()) {
                throw new TemplateCompilationException(options.sourceFile, "Unparsable source: syntax error" + where);
            }
            warnings.add("Source contains syntax errors" + where + "; output may be incomplete");
        }

        ComponentMeta meta = new ComponentMeta(options.sourceFile, component.name, component.exports,
                component.props, component.imports, component.preamble, component.preambleVariables);

        if (!component.hasMarkup()) {
            warnings.add(NO_JSX_WARNING);
            return new AnalysisResult(new Root(List.of(), meta), warnings);
        }

        TemplateTreeBuilder builder = new TemplateTreeBuilder(dslHandlers, expressionAnalyzer,
                options.passthroughComponents, options.partialPrefix);
        builder.bindPropsObject(component.propsObject);
        Root root = new Root(builder.buildMarkup(component.markup), meta);
        warnings.addAll(builder.getWarnings());

        LOG.debug("Analyzed component {} in {} with {} warnings", component.name, options.sourceFile, warnings.size());
        return new AnalysisResult(root, warnings);
    }
}
