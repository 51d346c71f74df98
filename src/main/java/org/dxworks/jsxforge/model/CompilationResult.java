package org.dxworks.jsxforge.model;

import java.util.List;

/**
 * Per-unit compiler output: target text plus the free-variable set, include dependencies and
 * non-fatal warnings. Variables and dependencies are in first-occurrence order.
 */
public final class CompilationResult {
    public final String dialect;
    public final String sourceFile;
    public final String filename;
    public final String content;
    public final List<String> variables;
    public final List<String> dependencies;
    public final List<String> warnings;
    public final ValidationResult validation;

    public CompilationResult(String dialect, String sourceFile, String filename, String content,
                             List<String> variables, List<String> dependencies, List<String> warnings,
                             ValidationResult validation) {
        this.dialect = dialect;
        this.sourceFile = sourceFile;
        this.filename = filename;
        this.content = content;
        this.variables = List.copyOf(variables);
        this.dependencies = List.copyOf(dependencies);
        this.warnings = List.copyOf(warnings);
        this.validation = validation != null ? validation : ValidationResult.valid();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
