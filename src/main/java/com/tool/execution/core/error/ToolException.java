package com.tool.execution.core.error;

import java.util.Map;
import java.util.Objects;

/**
 * Base exception for every failure the engine classifies.
 * Carries a stable {@link ErrorCode} and optional structured details for the caller.
 */
public class ToolException extends RuntimeException {

    private final ErrorCode code;

    public ToolException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code is required");
    }

    public ToolException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code is required");
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Structured details rendered next to the message. Empty by default.
     */
    public Map<String, Object> getDetails() {
        return Map.of();
    }
}
