package com.tool.execution.core.model;

import java.time.Duration;

/**
 * @param state   the state entered
 * @param elapsed time since the invocation was received
 */
public record StateTransition(InvocationState state, Duration elapsed) {
}
