package org.dxworks.jsxforge.model;

import java.util.List;

/**
 * What the analyzer learned about the compiled component besides its markup.
 */
public final class ComponentMeta {
    public final String sourceFile;
    public final String componentName;
    public final ComponentType componentType;
    public final List<String> exports;
    public final List<PropDefinition> props;
    public final List<SourceImport> imports;
    public final String preamble;
    public final List<String> preambleVariables;

    public ComponentMeta(String sourceFile, String componentName, List<String> exports,
                         List<PropDefinition> props, List<SourceImport> imports,
                         String preamble, List<String> preambleVariables) {
        this.sourceFile = sourceFile;
        this.componentName = componentName;
        this.componentType = ComponentType.fromComponentName(componentName);
        this.exports = exports == null ? List.of() : List.copyOf(exports);
        this.props = props == null ? List.of() : List.copyOf(props);
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.preamble = preamble == null ? "" : preamble;
        this.preambleVariables = preambleVariables == null ? List.of() : List.copyOf(preambleVariables);
    }

    public static ComponentMeta empty(String sourceFile) {
        return new ComponentMeta(sourceFile, null, null, null, null, null, null);
    }

    public boolean hasImports() {
        return !imports.isEmpty();
    }
}
