package com.tool.execution.tracing;

/**
 * A unit of work in a distributed trace.
 * Implements {@link AutoCloseable}; closing ends the span.
 *
 * <pre>
 * try (Span span = tracingService.startSpan("tool.invoke")) {
 *     span.setAttribute("tool.name", "echo");
 *     span.addEvent("VALIDATED");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    /**
     * Records a timestamped event, such as a state transition.
     */
    void addEvent(String name);

    void setStatus(SpanStatus status);

    /**
     * Sets the status with a short description, typically the error code of a failed invocation.
     */
    default void setStatus(SpanStatus status, String description) {
        setStatus(status);
    }

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
