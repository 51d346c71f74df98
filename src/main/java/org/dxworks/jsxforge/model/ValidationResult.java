package org.dxworks.jsxforge.model;

import java.util.List;

public final class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(List.of());

    public final boolean valid;
    public final List<String> errors;

    private ValidationResult(List<String> errors) {
        this.errors = List.copyOf(errors);
        this.valid = this.errors.isEmpty();
    }

    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? VALID : new ValidationResult(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    @Override
    public String toString() {
        return valid ? "valid" : "invalid" + errors;
    }
}
