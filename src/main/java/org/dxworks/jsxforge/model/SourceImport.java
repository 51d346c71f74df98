package org.dxworks.jsxforge.model;

import java.util.List;

public final class SourceImport {
    public final String source;
    public final String defaultImport;
    public final List<String> namedImports;
    public final String namespaceImport;

    public SourceImport(String source, String defaultImport, List<String> namedImports, String namespaceImport) {
        this.source = source;
        this.defaultImport = defaultImport;
        this.namedImports = namedImports == null ? List.of() : List.copyOf(namedImports);
        this.namespaceImport = namespaceImport;
    }

    public boolean imports(String name) {
        return name.equals(defaultImport) || namedImports.contains(name) || name.equals(namespaceImport);
    }
}
