package com.tool.execution.metrics;

import java.time.Duration;

/**
 * Interface for engine metrics collection.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    /**
     * Records the end-to-end duration of an invocation.
     *
     * @param toolName the requested tool
     * @param outcome  {@code success}, {@code cache_hit} or the lower-case error code
     * @param duration time from receipt to the terminal state
     */
    void recordInvocation(String toolName, String outcome, Duration duration);

    void recordCacheHit(String toolName);

    void recordCacheMiss(String toolName);

    void incrementRetry(String toolName);

    void incrementTimeout(String toolName);

    void incrementValidationFailure(String toolName);
}
