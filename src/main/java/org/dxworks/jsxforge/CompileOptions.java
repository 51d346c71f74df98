package org.dxworks.jsxforge;

import java.util.Set;

/**
 * Per-unit compile inputs. A null component name picks the component automatically; null
 * pass-through components fall back to the configured ones.
 */
public final class CompileOptions {
    public final String sourceFile;
    public final String componentName;
    public final Set<String> passthroughComponents;

    public CompileOptions(String sourceFile, String componentName, Set<String> passthroughComponents) {
        this.sourceFile = sourceFile;
        this.componentName = componentName;
        this.passthroughComponents = passthroughComponents == null ? null : Set.copyOf(passthroughComponents);
    }

    public static CompileOptions forFile(String sourceFile) {
        return new CompileOptions(sourceFile, null, null);
    }

    public CompileOptions withComponentName(String name) {
        return new CompileOptions(sourceFile, name, passthroughComponents);
    }

    public CompileOptions withPassthroughComponents(Set<String> names) {
        return new CompileOptions(sourceFile, componentName, names);
    }
}
