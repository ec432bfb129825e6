package com.tool.execution.core.error;

import java.util.Map;

/**
 * Thrown when a lookup names a tool that is not registered.
 */
public class ToolNotFoundException extends ToolException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super(ErrorCode.NOT_FOUND, "Tool '" + toolName + "' not found");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public Map<String, Object> getDetails() {
        return toolName == null ? Map.of() : Map.of("tool", toolName);
    }
}
