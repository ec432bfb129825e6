package com.tool.execution.policy;

import com.tool.execution.core.model.ToolDescriptor;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-tool timeout and retry settings, resolved from the descriptor with engine-wide defaults.
 *
 * @param timeout    deadline of a single attempt, must be positive
 * @param maxRetries retries after the first attempt; 0 means exactly one attempt
 * @param retryDelay fixed wait between attempts
 */
public record RetryPolicy(Duration timeout, int maxRetries, Duration retryDelay) {

    /**
     * Longest timeout or delay the schedulers can express in nanoseconds (about 292 years).
     */
    public static final Duration MAX_DURATION = Duration.ofNanos(Long.MAX_VALUE);

    public RetryPolicy {
        Objects.requireNonNull(timeout, "timeout is required");
        Objects.requireNonNull(retryDelay, "retryDelay is required");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        if (timeout.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException("timeout must be <= " + MAX_DURATION);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0");
        }
        if (retryDelay.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException("retryDelay must be <= " + MAX_DURATION);
        }
    }

    /**
     * Takes every setting the descriptor declares and falls back to {@code defaults} for the rest.
     */
    public static RetryPolicy resolve(ToolDescriptor descriptor, RetryPolicy defaults) {
        return new RetryPolicy(
                descriptor.getTimeout().orElse(defaults.timeout()),
                descriptor.getMaxRetries().orElse(defaults.maxRetries()),
                descriptor.getRetryDelay().orElse(defaults.retryDelay()));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
