package com.tool.execution.core.model;

import java.util.Objects;

/**
 * A descriptor and the handler bound to it. This is the unit the registry stores and
 * returns from lookups; the handler is referenced, never copied.
 *
 * @param descriptor the tool's contract
 * @param handler    the executable logic
 */
public record ToolDefinition(ToolDescriptor descriptor, ToolHandler handler) {

    public ToolDefinition {
        Objects.requireNonNull(descriptor, "descriptor is required");
        Objects.requireNonNull(handler, "handler is required");
    }

    public String name() {
        return descriptor.getName();
    }
}
