package com.tool.execution.schema;

import com.tool.execution.core.error.ToolValidationException;

import java.util.List;

/**
 * Result of validating a payload against a schema document.
 */
public record ValidationReport(List<Violation> violations) {

    private static final ValidationReport OK = new ValidationReport(List.of());

    public ValidationReport {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static ValidationReport ok() {
        return OK;
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * Fields reported missing, in report order.
     */
    public List<String> missingFields() {
        return violations.stream()
                .filter(v -> v.kind() == Violation.Kind.MISSING)
                .map(Violation::field)
                .toList();
    }

    public void throwIfInvalid(String toolName) {
        if (!isValid()) {
            throw new ToolValidationException(toolName, violations);
        }
    }
}
