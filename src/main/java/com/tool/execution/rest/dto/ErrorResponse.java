package com.tool.execution.rest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * HTTP-level error body, used when a request is rejected before reaching the engine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String error,
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public ErrorResponse(int status, String error, String code, String message, String path) {
        this(status, error, code, message, path, Instant.now());
    }

    public static ErrorResponse badRequest(String code, String message, String path) {
        return new ErrorResponse(400, "Bad Request", code, message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", "INTERNAL_ERROR", message, path);
    }
}
