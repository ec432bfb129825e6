package com.tool.execution.core.model;

/**
 * States an invocation moves through inside the engine.
 *
 * <pre>
 * RECEIVED -> VALIDATED -> CACHE_CHECK -> CACHE_HIT   -> SUCCEEDED
 *                                      -> DISPATCHING -> SUCCEEDED | FAILED
 * </pre>
 * Any non-terminal state may fail. Tools that are not cacheable go straight from
 * VALIDATED to DISPATCHING.
 */
public enum InvocationState {
    RECEIVED,
    VALIDATED,
    CACHE_CHECK,
    CACHE_HIT,
    DISPATCHING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
