package org.dxworks.jsxforge.backend.dialect;

import org.approvaltests.Approvals;
import org.dxworks.jsxforge.BackendRegistry;
import org.dxworks.jsxforge.CompilerConfig;
import org.dxworks.jsxforge.Dialect;
import org.dxworks.jsxforge.TemplateCompiler;
import org.dxworks.jsxforge.analyzer.TreeSitterSourceParser;
import org.dxworks.jsxforge.analyzer.dsl.DslHandlerRegistry;
import org.dxworks.jsxforge.model.CompilationResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class HandlebarsCompileApprovalTest {

    private static final TemplateCompiler COMPILER = new TemplateCompiler(
            new TreeSitterSourceParser(),
            DslHandlerRegistry.defaults(),
            BackendRegistry.defaults(),
            CompilerConfig.defaults());

    @Test
    void compile_Handlebars_UserList() throws IOException {
        verify(Paths.get("src/test/resources/samples/jsx/UserList.jsx"));
    }

    @Test
    void compile_Handlebars_ProductCard() throws IOException {
        verify(Paths.get("src/test/resources/samples/jsx/ProductCard.jsx"));
    }

    @Test
    void compile_Handlebars_PageLayout() throws IOException {
        verify(Paths.get("src/test/resources/samples/jsx/PageLayout.jsx"));
    }

    // template output carries no trailing newline of its own
    private static void verify(Path file) throws IOException {
        CompilationResult result = COMPILER.compileFile(file, Dialect.HANDLEBARS);
        Approvals.verify(result.content + "\n");
    }
}
