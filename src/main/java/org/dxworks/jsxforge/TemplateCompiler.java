package org.dxworks.jsxforge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.jsxforge.analyzer.AnalysisOptions;
import org.dxworks.jsxforge.analyzer.AnalysisResult;
import org.dxworks.jsxforge.analyzer.SourceAnalyzer;
import org.dxworks.jsxforge.analyzer.SourceParser;
import org.dxworks.jsxforge.analyzer.TreeSitterSourceParser;
import org.dxworks.jsxforge.analyzer.dsl.DslHandlerRegistry;
import org.dxworks.jsxforge.backend.RenderContext;
import org.dxworks.jsxforge.backend.TemplateBackend;
import org.dxworks.jsxforge.backend.TemplateOutput;
import org.dxworks.jsxforge.backend.TemplateTransformer;
import org.dxworks.jsxforge.model.CompilationResult;
import org.dxworks.jsxforge.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles one JSX source unit into one dialect. Registries and configuration are fixed at
 * construction; everything else is per call, so concurrent compilations may share an instance.
 */
public class TemplateCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateCompiler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final SourceAnalyzer analyzer;
    private final BackendRegistry backends;
    private final CompilerConfig config;
    private final TemplateTransformer transformer = new TemplateTransformer();

    public TemplateCompiler(SourceParser parser, DslHandlerRegistry dslHandlers, BackendRegistry backends,
                            CompilerConfig config) {
        this.analyzer = new SourceAnalyzer(parser, dslHandlers);
        this.backends = backends;
        this.config = config;
    }

    /**
     * Tree-sitter parsing, the built-in tags and dialects, and {@code jsxforge-config.yml}
     * from the working directory when there is one.
     */
    public static TemplateCompiler defaults() {
        return new TemplateCompiler(new TreeSitterSourceParser(), DslHandlerRegistry.defaults(),
                BackendRegistry.defaults(), CompilerConfig.load());
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public CompilationResult compile(String source, String sourceFile) {
        return compile(source, CompileOptions.forFile(sourceFile), config.getDefaultDialect());
    }

    public CompilationResult compile(String source, String sourceFile, Dialect dialect) {
        return compile(source, CompileOptions.forFile(sourceFile), dialect);
    }

    /**
     * @throws TemplateCompilationException when the source cannot be analyzed at all
     */
    public CompilationResult compile(String source, CompileOptions options, Dialect dialect) {
        TemplateBackend backend = backends.get(dialect != null ? dialect : config.getDefaultDialect());
        AnalysisResult analysis;
        try {
            analysis = analyze(source, options);
        } catch (TemplateCompilationException e) {
            LOG.warn("Compilation of {} failed: {}", options.sourceFile, e.getMessage());
            throw e;
        }

        RenderContext context = new RenderContext(analysis.root.meta, config.isPrettyPrint());
        TemplateOutput output = transformer.transform(analysis.root, backend, context);

        List<String> warnings = new ArrayList<>(analysis.warnings);
        warnings.addAll(output.warnings);
        ValidationResult validation = config.isValidateOutput()
                ? backend.validate(output.content)
                : ValidationResult.valid();
        if (!validation.valid) {
            LOG.warn("{} output for {} failed validation: {}", backend.name(), options.sourceFile, validation.errors);
        }
        LOG.debug("Compiled {} to {} with {} warnings", options.sourceFile, output.filename, warnings.size());

        return new CompilationResult(backend.name(), options.sourceFile, output.filename, output.content,
                output.variables, output.dependencies, warnings, validation);
    }

    /**
     * Reads the file as UTF-8, dropping a byte-order mark and normalizing line endings.
     */
    public CompilationResult compileFile(Path file, Dialect dialect) throws IOException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        if (source.startsWith("\uFEFF")) source = source.substring(1);
        source = source.replace("\r\n", "\n").replace('\r', '\n');
        return compile(source, CompileOptions.forFile(file.toString()), dialect);
    }

    /**
     * The annotated tree and analysis warnings, without rendering.
     */
    public AnalysisResult analyze(String source, CompileOptions options) {
        return analyzer.analyze(source, new AnalysisOptions(options.sourceFile, options.componentName,
                options.passthroughComponents != null ? options.passthroughComponents : config.getPassthroughComponents(),
                config.getPartialPrefix()));
    }

    public static String toJson(CompilationResult result) throws JsonProcessingException {
        return MAPPER.writeValueAsString(result);
    }
}
