package com.tool.execution.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.tool.execution.core.error.ErrorCode;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of an invocation, returned to the caller and never persisted.
 * Exactly one of {@code value} and {@code error} is set.
 *
 * @param requestId   the caller's correlation id
 * @param toolName    the tool that was requested
 * @param value       the result on success, {@code null} on failure
 * @param error       the error on failure, {@code null} on success
 * @param fromCache   whether the value was served from the result cache
 * @param duration    time from receipt to the terminal state
 * @param attempts    handler attempts made (0 for cache hits and pre-dispatch failures)
 * @param transitions every state entered, with the elapsed time at entry
 */
public record InvocationResult(
        String requestId,
        String toolName,
        JsonNode value,
        ToolError error,
        boolean fromCache,
        Duration duration,
        int attempts,
        List<StateTransition> transitions
) {
    public InvocationResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of value and error must be set");
        }
        transitions = transitions != null ? List.copyOf(transitions) : List.of();
    }

    public static InvocationResult success(String requestId, String toolName, JsonNode value, boolean fromCache,
                                           Duration duration, int attempts, List<StateTransition> transitions) {
        return new InvocationResult(requestId, toolName, value, null, fromCache, duration, attempts, transitions);
    }

    public static InvocationResult failure(String requestId, String toolName, ToolError error,
                                           Duration duration, int attempts, List<StateTransition> transitions) {
        return new InvocationResult(requestId, toolName, null, error, false, duration, attempts, transitions);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<ErrorCode> errorCode() {
        return error == null ? Optional.empty() : Optional.of(error.code());
    }

    public InvocationState finalState() {
        return isSuccess() ? InvocationState.SUCCEEDED : InvocationState.FAILED;
    }
}
