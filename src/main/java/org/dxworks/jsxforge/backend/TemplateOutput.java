package org.dxworks.jsxforge.backend;

import java.util.List;

public final class TemplateOutput {
    public final String filename;
    public final String content;
    public final List<String> variables;
    public final List<String> dependencies;
    public final List<String> warnings;

    public TemplateOutput(String filename, String content, List<String> variables, List<String> dependencies,
                          List<String> warnings) {
        this.filename = filename;
        this.content = content;
        this.variables = List.copyOf(variables);
        this.dependencies = List.copyOf(dependencies);
        this.warnings = List.copyOf(warnings);
    }
}
