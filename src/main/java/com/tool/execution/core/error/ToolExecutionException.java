package com.tool.execution.core.error;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final failure of a tool after every allowed attempt.
 * Carries the attempt count, the failure of each attempt, and the last cause.
 */
public class ToolExecutionException extends ToolException {

    private final String toolName;
    private final int attempts;
    private final List<Throwable> failures;

    public ToolExecutionException(String toolName, int attempts, List<Throwable> failures) {
        super(ErrorCode.EXECUTION_FAILED,
                "Tool '" + toolName + "' failed after " + attempts + " attempt(s): "
                        + describe(last(failures)),
                last(failures));
        this.toolName = toolName;
        this.attempts = attempts;
        this.failures = List.copyOf(failures);
    }

    public String getToolName() {
        return toolName;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Failures in attempt order. The last element is {@link #getCause()}.
     */
    public List<Throwable> getFailures() {
        return failures;
    }

    /**
     * Whether the attempt with the given 1-based number ended in a timeout.
     */
    public boolean timedOut(int attempt) {
        return attempt >= 1 && attempt <= failures.size()
                && failures.get(attempt - 1) instanceof ToolTimeoutException;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tool", toolName);
        details.put("attempts", attempts);
        Throwable cause = getCause();
        if (cause != null) {
            details.put("causeType", cause instanceof ToolException te
                    ? te.getCode().name() : cause.getClass().getSimpleName());
            details.put("cause", String.valueOf(cause.getMessage()));
        }
        return details;
    }

    private static Throwable last(List<Throwable> failures) {
        return failures.isEmpty() ? null : failures.get(failures.size() - 1);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
