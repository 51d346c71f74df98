package org.dxworks.jsxforge.analyzer;

import java.util.Set;

public final class AnalysisOptions {
    public static final String DEFAULT_PARTIAL_PREFIX = "partials/";

    public final String sourceFile;
    public final String componentName;
    public final Set<String> passthroughComponents;
    public final String partialPrefix;

    public AnalysisOptions(String sourceFile, String componentName, Set<String> passthroughComponents,
                           String partialPrefix) {
        this.sourceFile = sourceFile;
        this.componentName = componentName;
        this.passthroughComponents = passthroughComponents == null ? Set.of() : Set.copyOf(passthroughComponents);
        this.partialPrefix = partialPrefix != null ? partialPrefix : DEFAULT_PARTIAL_PREFIX;
    }

    public static AnalysisOptions forFile(String sourceFile) {
        return new AnalysisOptions(sourceFile, null, Set.of(), DEFAULT_PARTIAL_PREFIX);
    }
}
