package com.tool.execution.core.error;

import com.tool.execution.schema.Violation;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when an argument payload violates the tool's input schema.
 * The violations are surfaced verbatim to the caller.
 */
public class ToolValidationException extends ToolException {

    private final String toolName;
    private final List<Violation> violations;

    public ToolValidationException(String toolName, List<Violation> violations) {
        super(ErrorCode.INVALID_ARGUMENTS, buildMessage(toolName, violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String getToolName() {
        return toolName;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    @Override
    public Map<String, Object> getDetails() {
        List<Map<String, Object>> rendered = violations.stream()
                .map(Violation::toMap)
                .toList();
        return Map.of("tool", toolName, "violations", rendered);
    }

    private static String buildMessage(String toolName, List<Violation> violations) {
        String summary = violations.stream()
                .map(v -> v.field() + ": " + v.message())
                .collect(Collectors.joining("; "));
        return "Invalid arguments for tool '" + toolName + "': " + summary;
    }
}
