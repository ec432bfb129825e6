package com.tool.execution.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordInvocation(String toolName, String outcome, Duration duration) {
    }

    @Override
    public void recordCacheHit(String toolName) {
    }

    @Override
    public void recordCacheMiss(String toolName) {
    }

    @Override
    public void incrementRetry(String toolName) {
    }

    @Override
    public void incrementTimeout(String toolName) {
    }

    @Override
    public void incrementValidationFailure(String toolName) {
    }
}
