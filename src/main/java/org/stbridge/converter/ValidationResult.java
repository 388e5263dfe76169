package org.stbridge.converter;

import java.util.List;

public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        String version
) {
    public ValidationResult {
        if (errors == null) {
            errors = List.of();
        }
        if (warnings == null) {
            warnings = List.of();
        }
    }
}
