package com.tool.execution.core.error;

import java.time.Duration;
import java.util.Map;

/**
 * A single attempt did not complete before its deadline.
 * Recovered internally by retry; callers only see it as the cause of a {@link ToolExecutionException}.
 */
public class ToolTimeoutException extends ToolException {

    private final String toolName;
    private final int attempt;
    private final Duration timeout;

    public ToolTimeoutException(String toolName, int attempt, Duration timeout) {
        super(ErrorCode.TIMEOUT, "Tool '" + toolName + "' attempt " + attempt
                + " timed out after " + timeout.toMillis() + "ms");
        this.toolName = toolName;
        this.attempt = attempt;
        this.timeout = timeout;
    }

    public String getToolName() {
        return toolName;
    }

    public int getAttempt() {
        return attempt;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("tool", toolName, "attempt", attempt, "timeoutMs", timeout.toMillis());
    }
}
