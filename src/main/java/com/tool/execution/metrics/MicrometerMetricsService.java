package com.tool.execution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code tool.invocation.duration}: Timer (tags: tool, outcome)</li>
 *   <li>{@code tool.cache.hit}: Counter (tag: tool)</li>
 *   <li>{@code tool.cache.miss}: Counter (tag: tool)</li>
 *   <li>{@code tool.retry}: Counter (tag: tool)</li>
 *   <li>{@code tool.timeout}: Counter (tag: tool)</li>
 *   <li>{@code tool.validation.failure}: Counter (tag: tool)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordInvocation(String toolName, String outcome, Duration duration) {
        String key = toolName + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("tool.invocation.duration")
                        .description("Duration of tool invocations, receipt to terminal state")
                        .tag("tool", toolName)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordCacheHit(String toolName) {
        counter("tool.cache.hit", "Number of result cache hits", toolName).increment();
    }

    @Override
    public void recordCacheMiss(String toolName) {
        counter("tool.cache.miss", "Number of result cache misses", toolName).increment();
    }

    @Override
    public void incrementRetry(String toolName) {
        counter("tool.retry", "Number of handler retries", toolName).increment();
    }

    @Override
    public void incrementTimeout(String toolName) {
        counter("tool.timeout", "Number of handler attempts that timed out", toolName).increment();
    }

    @Override
    public void incrementValidationFailure(String toolName) {
        counter("tool.validation.failure", "Number of rejected argument payloads", toolName).increment();
    }

    private Counter counter(String name, String description, String toolName) {
        return counterCache.computeIfAbsent(name + ":" + toolName, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("tool", toolName)
                        .register(registry));
    }
}
