package com.tool.execution.core.model;

/**
 * Executable logic bound to a {@link ToolDescriptor}.
 *
 * <p>Handlers receive arguments that already passed input validation. The returned value is
 * converted to JSON by the engine; any exception is captured and reclassified, it never
 * reaches the caller unwrapped. Handlers should honour thread interruption, which is how a
 * timed-out or cancelled attempt is abandoned.</p>
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(ToolArguments arguments) throws Exception;
}
