package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.model.Root;

import java.util.List;

public final class AnalysisResult {
    public final Root root;
    public final List<String> warnings;

    public AnalysisResult(Root root, List<String> warnings) {
        this.root = root;
        this.warnings = List.copyOf(warnings);
    }
}
