package com.tool.execution.core.error;

import java.util.Map;

/**
 * Thrown when a tool is registered under a name that is already taken.
 */
public class DuplicateToolException extends ToolException {

    private final String toolName;

    public DuplicateToolException(String toolName) {
        super(ErrorCode.DUPLICATE_NAME, "Tool '" + toolName + "' is already registered");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public Map<String, Object> getDetails() {
        return Map.of("tool", toolName);
    }
}
