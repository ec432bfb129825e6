package com.tool.execution.core.model;

import com.tool.execution.core.error.ErrorCode;
import com.tool.execution.core.error.ToolException;

import java.util.Map;
import java.util.Objects;

/**
 * Caller-facing error: a stable code, a human-readable message and structured details.
 *
 * @param code    the stable error code
 * @param message human-readable description
 * @param details structured details (violations, attempt count, ...), never null
 */
public record ToolError(ErrorCode code, String message, Map<String, Object> details) {

    public ToolError {
        Objects.requireNonNull(code, "code is required");
        message = message != null ? message : code.name();
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ToolError of(ErrorCode code, String message) {
        return new ToolError(code, message, Map.of());
    }

    /**
     * Reclassifies a {@link ToolException} into its caller-facing form.
     */
    public static ToolError from(ToolException exception) {
        return new ToolError(exception.getCode(), exception.getMessage(), exception.getDetails());
    }
}
