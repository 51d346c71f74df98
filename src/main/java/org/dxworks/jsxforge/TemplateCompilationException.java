package org.dxworks.jsxforge;

/**
 * Fatal failure of one compilation unit. Other units are unaffected.
 */
public class TemplateCompilationException extends RuntimeException {

    private final String sourceFile;

    public TemplateCompilationException(String sourceFile, String message) {
        super(sourceFile != null ? sourceFile + ": " + message : message);
        this.sourceFile = sourceFile;
    }

    public TemplateCompilationException(String sourceFile, String message, Throwable cause) {
        super(sourceFile != null ? sourceFile + ": " + message : message, cause);
        this.sourceFile = sourceFile;
    }

    public String getSourceFile() {
        return sourceFile;
    }
}
