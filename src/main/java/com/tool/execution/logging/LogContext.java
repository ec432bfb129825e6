package com.tool.execution.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for the engine's log lines ({@code requestId}, {@code tool},
 * {@code sessionId}, {@code attempt}, {@code operation}).
 *
 * <pre>
 * try (LogContext ctx = LogContext.forInvocation(requestId, "echo")) {
 *     log.info("tool.invoked attempts={} fromCache={}", attempts, fromCache);
 * }
 * </pre>
 *
 * <p>Scopes nest: closing an inner scope puts back whatever the enclosing scope had set,
 * so a WebSocket callback that opens a session scope around {@link #forSession} calls
 * keeps its {@code sessionId}. Scopes are thread-bound; a worker attempt opens its own.</p>
 */
public class LogContext implements AutoCloseable {

    private record Saved(String key, String previous) {
    }

    private final Deque<Saved> saved = new ArrayDeque<>();

    private LogContext() {
    }

    public static LogContext forInvocation(String requestId, String toolName) {
        return new LogContext()
                .with("requestId", requestId)
                .with("tool", toolName)
                .with("operation", "invoke");
    }

    public static LogContext forSession(String sessionId) {
        return new LogContext()
                .with("sessionId", sessionId)
                .with("operation", "session");
    }

    public static LogContext forRegistration(String toolName) {
        return new LogContext()
                .with("tool", toolName)
                .with("operation", "register");
    }

    /**
     * Request id for invocations whose caller supplied none.
     */
    public static String newRequestId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Sets {@code key} for the lifetime of this scope. Null values leave the MDC untouched.
     */
    public LogContext with(String key, String value) {
        if (value != null) {
            saved.push(new Saved(key, MDC.get(key)));
            MDC.put(key, value);
        }
        return this;
    }

    @Override
    public void close() {
        while (!saved.isEmpty()) {
            Saved entry = saved.pop();
            if (entry.previous() == null) {
                MDC.remove(entry.key());
            } else {
                MDC.put(entry.key(), entry.previous());
            }
        }
    }
}
