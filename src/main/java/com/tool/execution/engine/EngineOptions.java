package com.tool.execution.engine;

import com.tool.execution.cache.CacheConfig;
import com.tool.execution.policy.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine-wide settings. Per-tool descriptor values take precedence over the defaults here.
 */
public class EngineOptions {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_MAX_RETRIES = 3;
    private static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    private static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
    private static final String DEFAULT_WORKER_THREAD_PREFIX = "tool-worker";

    private final Duration defaultTimeout;
    private final int defaultMaxRetries;
    private final Duration defaultRetryDelay;
    private final CacheConfig cacheConfig;
    private final String workerThreadPrefix;
    private final Duration shutdownTimeout;

    private EngineOptions(Builder builder) {
        this.defaultTimeout = builder.defaultTimeout;
        this.defaultMaxRetries = builder.defaultMaxRetries;
        this.defaultRetryDelay = builder.defaultRetryDelay;
        this.cacheConfig = builder.cacheConfig;
        this.workerThreadPrefix = builder.workerThreadPrefix;
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration getDefaultRetryDelay() {
        return defaultRetryDelay;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public String getWorkerThreadPrefix() {
        return workerThreadPrefix;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * The retry policy applied to tools that declare no settings of their own.
     */
    public RetryPolicy defaultPolicy() {
        return new RetryPolicy(defaultTimeout, defaultMaxRetries, defaultRetryDelay);
    }

    public static EngineOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private int defaultMaxRetries = DEFAULT_MAX_RETRIES;
        private Duration defaultRetryDelay = DEFAULT_RETRY_DELAY;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private String workerThreadPrefix = DEFAULT_WORKER_THREAD_PREFIX;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        public Builder defaultTimeout(Duration defaultTimeout) {
            Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
            if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
                throw new IllegalArgumentException("defaultTimeout must be positive");
            }
            if (defaultTimeout.compareTo(RetryPolicy.MAX_DURATION) > 0) {
                throw new IllegalArgumentException("defaultTimeout must be <= " + RetryPolicy.MAX_DURATION);
            }
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder defaultMaxRetries(int defaultMaxRetries) {
            if (defaultMaxRetries < 0) {
                throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
            }
            this.defaultMaxRetries = defaultMaxRetries;
            return this;
        }

        public Builder defaultRetryDelay(Duration defaultRetryDelay) {
            Objects.requireNonNull(defaultRetryDelay, "defaultRetryDelay must not be null");
            if (defaultRetryDelay.isNegative()) {
                throw new IllegalArgumentException("defaultRetryDelay must be >= 0");
            }
            if (defaultRetryDelay.compareTo(RetryPolicy.MAX_DURATION) > 0) {
                throw new IllegalArgumentException("defaultRetryDelay must be <= " + RetryPolicy.MAX_DURATION);
            }
            this.defaultRetryDelay = defaultRetryDelay;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig must not be null");
            return this;
        }

        public Builder workerThreadPrefix(String workerThreadPrefix) {
            if (workerThreadPrefix == null || workerThreadPrefix.isBlank()) {
                throw new IllegalArgumentException("workerThreadPrefix must not be blank");
            }
            this.workerThreadPrefix = workerThreadPrefix;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout must be >= 0");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public EngineOptions build() {
            return new EngineOptions(this);
        }
    }
}
