package org.dxworks.jsxforge;

import org.dxworks.jsxforge.analyzer.AnalysisResult;
import org.dxworks.jsxforge.analyzer.TreeSitterSourceParser;
import org.dxworks.jsxforge.analyzer.dsl.DslHandlerRegistry;
import org.dxworks.jsxforge.model.CompilationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TemplateCompilerTest {

    private static final String LIST = "export function List({ items }) {\n"
            + "  return <ul>{items.map(item => <li key={item.id}>{item.name}</li>)}</ul>;\n"
            + "}\n";

    private static final String PICK = "export function Pick() {\n"
            + "  return <div>{a ? <b>A</b> : b ? <i>B</i> : <s>C</s>}</div>;\n"
            + "}\n";

    private static final String CARD = "export function Page({ title }) {\n"
            + "  return <div><Include partial=\"partials/card\" props={{ title: title, config: { a: 1 } }} /></div>;\n"
            + "}\n";

    private static TemplateCompiler compiler(CompilerConfig config) {
        return new TemplateCompiler(new TreeSitterSourceParser(), DslHandlerRegistry.defaults(),
                BackendRegistry.defaults(), config);
    }

    private final TemplateCompiler compiler = compiler(CompilerConfig.defaults());

    @Test
    void mapLoopCompilesToEachBlock() {
        CompilationResult result = compiler.compile(LIST, "List.jsx", Dialect.HANDLEBARS);

        assertEquals("handlebars", result.dialect);
        assertEquals("List.jsx", result.sourceFile);
        assertEquals("list.hbs", result.filename);
        assertEquals("<ul>{{#each items}}\n<li>{{item.name}}</li>\n{{/each}}</ul>", result.content);
        assertEquals(List.of("items"), result.variables);
        assertTrue(result.dependencies.isEmpty());
        assertFalse(result.hasWarnings());
        assertTrue(result.validation.valid);
    }

    @Test
    void configuredDefaultDialectIsUsedWhenNoneIsGiven() {
        CompilationResult result = compiler.compile(LIST, "List.jsx");

        assertEquals(CompilerConfig.defaults().getDefaultDialect().getName(), result.dialect);
    }

    @Test
    void elseIfChainIsAnImmediatelyInvokedFunctionInReact() {
        CompilationResult result = compiler.compile(PICK, "Pick.jsx", Dialect.REACT);

        assertEquals("<div>\n"
                + "  {(() => {\n"
                + "    if (a) return (<><b>A</b></>);\n"
                + "    if (b) return (<><i>B</i></>);\n"
                + "    return (<><s>C</s></>);\n"
                + "  })()}\n"
                + "</div>\n", result.content);
        assertEquals("Pick.jsx", result.filename);
    }

    @Test
    void elseIfChainIsOneIfBlockInHandlebars() {
        CompilationResult result = compiler.compile(PICK, "Pick.jsx", Dialect.HANDLEBARS);

        assertEquals("<div>{{#if a}}\n<b>A</b>\n{{else if b}}\n<i>B</i>\n{{else}}\n<s>C</s>\n{{/if}}</div>", result.content);
    }

    @Test
    void componentsAreRecordedAsDependencies() {
        String source = "export function Page({ t }) {\n  return <div><Header title={t} /><Footer /><Header /></div>;\n}\n";

        CompilationResult result = compiler.compile(source, "Page.jsx", Dialect.TWIG);

        assertEquals(List.of("partials/header", "partials/footer"), result.dependencies);
        assertTrue(result.content.contains("{% include 'partials/header.twig' with {title: t} %}"));
        assertTrue(result.content.contains("{% include 'partials/footer.twig' %}"));
    }

    @Test
    void passthroughComponentsFromOptionsStayMarkup() {
        CompileOptions options = CompileOptions.forFile("Nav.jsx").withPassthroughComponents(Set.of("Link"));

        CompilationResult result = compiler.compile("const Nav = () => <Link href=\"/\">Home</Link>;", options, Dialect.TWIG);

        assertEquals("<Link href=\"/\">Home</Link>", result.content);
        assertTrue(result.dependencies.isEmpty());
    }

    @Test
    void passthroughComponentsFromConfig() {
        CompilerConfig config = CompilerConfig.with(Set.of("Link"), null, false, true, Dialect.LIQUID);

        CompilationResult result = compiler(config).compile("const Nav = () => <Link href=\"/\">Home</Link>;", "Nav.jsx");

        assertEquals("liquid", result.dialect);
        assertEquals("<Link href=\"/\">Home</Link>", result.content);
    }

    @Test
    void prettyPrintEndsWithNewline() {
        CompilerConfig config = CompilerConfig.with(Set.of(), null, true, true, Dialect.LIQUID);

        CompilationResult result = compiler(config).compile("const Hello = () => <p>{name}</p>;", "Hello.jsx");

        assertEquals("<p>{{ name }}</p>\n", result.content);
    }

    @Test
    void validationCanBeSwitchedOff() {
        CompilerConfig config = CompilerConfig.with(Set.of(), null, false, false, Dialect.LIQUID);

        CompilationResult result = compiler(config).compile("export const answer = 42;\n", "Answer.jsx");

        assertTrue(result.validation.valid);
        assertEquals(List.of("No JSX found in source"), result.warnings);
    }

    @Test
    void emptyOutputFailsValidationButStillCompiles() {
        CompilationResult result = compiler.compile("export const answer = 42;\n", "Answer.jsx", Dialect.LIQUID);

        assertEquals("", result.content);
        assertFalse(result.validation.valid);
    }

    @Test
    void compileFileDropsByteOrderMarkAndCarriageReturns(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("Hello.jsx");
        Files.writeString(file, "\uFEFFexport const Hello = () => (\r\n  <p>{name}</p>\r\n);\r\n", StandardCharsets.UTF_8);

        CompilationResult result = compiler.compileFile(file, Dialect.LIQUID);

        assertEquals("<p>{{ name }}</p>", result.content);
        assertEquals("hello.liquid", result.filename);
        assertEquals(file.toString(), result.sourceFile);
    }

    @Test
    void unparsableSourceFailsOnlyThatUnit() {
        TemplateCompilationException e = assertThrows(TemplateCompilationException.class,
                () -> compiler.compile("const = ;", "Broken.jsx", Dialect.TWIG));

        assertEquals("Broken.jsx", e.getSourceFile());
        assertTrue(e.getMessage().startsWith("Broken.jsx: Unparsable source"));
        assertEquals("<p>{{ name }}</p>", compiler.compile("const Ok = () => <p>{name}</p>;", "Ok.jsx", Dialect.TWIG).content);
    }

    @Test
    void analyzeReturnsTheTreeWithoutRendering() {
        AnalysisResult analysis = compiler.analyze(LIST, CompileOptions.forFile("List.jsx").withComponentName("List"));

        assertEquals("List", analysis.root.meta.componentName);
        assertEquals(1, analysis.root.children.size());
    }

    @Test
    void resultSerialisesToJson() throws Exception {
        String json = TemplateCompiler.toJson(compiler.compile(LIST, "List.jsx", Dialect.REACT));

        assertTrue(json.contains("\"dialect\" : \"react\""));
        assertTrue(json.contains("\"filename\" : \"List.jsx\""));
        assertTrue(json.contains("\"variables\" : [ \"items\" ]"));
        assertTrue(json.contains("\"valid\" : true"));
    }

    @Test
    void nestedHashInTwigIncludeIsValid() {
        CompilationResult result = compiler.compile(CARD, "Page.jsx", Dialect.TWIG);

        assertTrue(result.content.contains("{% include 'partials/card.twig' with {title: title, config: { a: 1 }} %}"),
                result.content);
        assertTrue(result.validation.valid, result.validation.errors.toString());
        assertEquals(List.of("title"), result.variables);
    }

    @Test
    void objectPropInHandlebarsPartialIsMarkedAndWarned() {
        CompilationResult result = compiler.compile(CARD, "Page.jsx", Dialect.HANDLEBARS);

        assertTrue(result.content.contains("{{!-- unsupported partial arguments: config --}}{{> partials/card title=title}}"),
                result.content);
        assertFalse(result.content.contains("({ a: 1 })"));
        assertTrue(result.hasWarnings());
        assertTrue(result.validation.valid, result.validation.errors.toString());
    }
}
