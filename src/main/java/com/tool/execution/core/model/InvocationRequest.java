package com.tool.execution.core.model;

import com.tool.execution.logging.LogContext;

import java.util.Map;

/**
 * A single call: tool name, arguments and the caller's correlation token.
 *
 * @param toolName  the tool to invoke
 * @param arguments the argument payload, never null
 * @param requestId opaque correlation id; generated when the caller supplies none
 */
public record InvocationRequest(String toolName, ToolArguments arguments, String requestId) {

    public InvocationRequest {
        arguments = arguments != null ? arguments : ToolArguments.empty();
        requestId = requestId != null && !requestId.isBlank() ? requestId : LogContext.newRequestId();
    }

    public static InvocationRequest of(String toolName, Map<String, ?> arguments) {
        return new InvocationRequest(toolName, ToolArguments.of(arguments), null);
    }

    public static InvocationRequest of(String toolName, Map<String, ?> arguments, String requestId) {
        return new InvocationRequest(toolName, ToolArguments.of(arguments), requestId);
    }
}
