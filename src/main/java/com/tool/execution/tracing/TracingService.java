package com.tool.execution.tracing;

import java.util.Map;

/**
 * Interface for distributed tracing integration.
 * The default {@link NoOpTracingService} does nothing, so the engine runs
 * without any tracing backend configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
