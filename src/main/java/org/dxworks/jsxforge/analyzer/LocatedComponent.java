package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.model.PropDefinition;
import org.dxworks.jsxforge.model.SourceImport;

import java.util.List;

public final class LocatedComponent {
    public final String name;
    public final SyntaxNode function;
    public final SyntaxNode markup;
    public final String propsObject;
    public final List<PropDefinition> props;
    public final List<SourceImport> imports;
    public final List<String> exports;
    public final String preamble;
    public final List<String> preambleVariables;

    public LocatedComponent(String name, SyntaxNode function, SyntaxNode markup, String propsObject,
                            List<PropDefinition> props, List<SourceImport> imports, List<String> exports,
                            String preamble, List<String> preambleVariables) {
        this.name = name;
        this.function = function;
        this.markup = markup;
        this.propsObject = propsObject;
        this.props = List.copyOf(props);
        this.imports = List.copyOf(imports);
        this.exports = List.copyOf(exports);
        this.preamble = preamble;
        this.preambleVariables = List.copyOf(preambleVariables);
    }

    public boolean hasMarkup() {
        return markup != null;
    }
}
