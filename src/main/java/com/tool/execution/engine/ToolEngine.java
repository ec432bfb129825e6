package com.tool.execution.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.tool.execution.cache.CacheKeys;
import com.tool.execution.cache.CacheStats;
import com.tool.execution.cache.ResultCache;
import com.tool.execution.core.error.ErrorCode;
import com.tool.execution.core.error.InternalEngineException;
import com.tool.execution.core.error.ToolException;
import com.tool.execution.core.error.ToolExecutionException;
import com.tool.execution.core.error.ToolValidationException;
import com.tool.execution.core.model.InvocationRequest;
import com.tool.execution.core.model.InvocationResult;
import com.tool.execution.core.model.InvocationState;
import com.tool.execution.core.model.StateTransition;
import com.tool.execution.core.model.ToolArguments;
import com.tool.execution.core.model.ToolDefinition;
import com.tool.execution.core.model.ToolDescriptor;
import com.tool.execution.core.model.ToolError;
import com.tool.execution.logging.LogContext;
import com.tool.execution.metrics.MetricsService;
import com.tool.execution.metrics.NoOpMetricsService;
import com.tool.execution.policy.ExecutionOutcome;
import com.tool.execution.policy.RetryPolicy;
import com.tool.execution.policy.RetryingExecutor;
import com.tool.execution.registry.ToolRegistry;
import com.tool.execution.schema.SchemaValidator;
import com.tool.execution.schema.ValidationReport;
import com.tool.execution.tracing.NoOpTracingService;
import com.tool.execution.tracing.Span;
import com.tool.execution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs tool invocations through lookup, validation, the result cache and the retrying executor.
 *
 * <p>Every invocation moves through {@code RECEIVED -> VALIDATED -> CACHE_CHECK ->
 * (CACHE_HIT | DISPATCHING) -> (SUCCEEDED | FAILED)} and ends with an {@link InvocationResult}.
 * Failures never escape as exceptions: they are mapped to a {@link ToolError} with a stable code.</p>
 *
 * <p>Invocations are independent. Identical concurrent requests both run their handler;
 * there is no in-flight deduplication. Closing the engine finishes pending invocations as
 * {@link ErrorCode#CANCELLED} and shuts the worker pools down.</p>
 */
public class ToolEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ToolEngine.class);

    private final ToolRegistry registry;
    private final EngineOptions options;
    private final ResultCache cache;
    private final SchemaValidator validator;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService workers;
    private final ScheduledThreadPoolExecutor scheduler;
    private final RetryingExecutor retryingExecutor;
    private final Map<Invocation, Boolean> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private ToolEngine(Builder builder) {
        this.registry = builder.registry;
        this.options = builder.options;
        this.cache = builder.cache != null
                ? builder.cache
                : ResultCache.create(builder.options.getCacheConfig(), builder.clock);
        this.validator = builder.validator;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.workers = Executors.newCachedThreadPool(new NamedThreadFactory(options.getWorkerThreadPrefix()));
        this.scheduler = new ScheduledThreadPoolExecutor(1,
                new NamedThreadFactory(options.getWorkerThreadPrefix() + "-scheduler"));
        this.scheduler.setRemoveOnCancelPolicy(true);
        this.retryingExecutor = new RetryingExecutor(workers, scheduler, metricsService);
        log.info("engine.started defaultTimeoutMs={} defaultMaxRetries={} cacheEnabled={}",
                options.getDefaultTimeout().toMillis(), options.getDefaultMaxRetries(),
                options.getCacheConfig().enabled());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Invokes a tool and blocks until the invocation reaches a terminal state.
     */
    public InvocationResult invoke(String toolName, ToolArguments arguments, String requestId) {
        return invoke(new InvocationRequest(toolName, arguments, requestId));
    }

    public InvocationResult invoke(String toolName, Map<String, ?> arguments) {
        return invoke(InvocationRequest.of(toolName, arguments));
    }

    public InvocationResult invoke(InvocationRequest request) {
        return invokeAsync(request).join();
    }

    /**
     * Starts an invocation. The returned future always completes with a result, never
     * exceptionally, unless the caller cancels it. Cancelling it stops further retries
     * and interrupts the handler attempt in flight.
     */
    public CompletableFuture<InvocationResult> invokeAsync(InvocationRequest request) {
        Objects.requireNonNull(request, "request is required");
        Invocation invocation = new Invocation(request);
        if (closed.get()) {
            return CompletableFuture.completedFuture(
                    invocation.fail(new ToolException(ErrorCode.CANCELLED, "Engine is closed")));
        }
        try (LogContext ctx = LogContext.forInvocation(request.requestId(), request.toolName())) {
            return invocation.start();
        }
    }

    /**
     * Descriptors of all registered tools, as of this call.
     */
    public List<ToolDescriptor> listTools() {
        return registry.list();
    }

    public ToolRegistry getRegistry() {
        return registry;
    }

    /**
     * Drops the cached result for one tool and argument set.
     */
    public void invalidateCache(String toolName, ToolArguments arguments) {
        cache.invalidate(CacheKeys.derive(toolName, arguments));
    }

    public void clearCache() {
        cache.invalidateAll();
        log.info("engine.cache.cleared");
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public boolean isCacheEnabled() {
        return options.getCacheConfig().enabled();
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int pending = inFlight.size();
        for (Invocation invocation : new ArrayList<>(inFlight.keySet())) {
            invocation.cancel("Engine closed before the invocation completed");
        }
        workers.shutdown();
        scheduler.shutdownNow();
        try {
            if (!workers.awaitTermination(options.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("engine.closed cancelledInvocations={}", pending);
    }

    /**
     * State of a single invocation: its transitions, its span and its result future.
     */
    private final class Invocation {
        private final InvocationRequest request;
        private final long startNanos = System.nanoTime();
        private final List<StateTransition> transitions = new ArrayList<>();
        private final CompletableFuture<InvocationResult> result = new CompletableFuture<>();
        private final AtomicBoolean finished = new AtomicBoolean();
        private final Span span;
        private volatile CompletableFuture<ExecutionOutcome> execution;

        Invocation(InvocationRequest request) {
            this.request = request;
            this.span = tracingService.startSpan("tool.invoke", Map.of(
                    "tool.name", String.valueOf(request.toolName()),
                    "tool.request_id", request.requestId()));
            transition(InvocationState.RECEIVED);
        }

        CompletableFuture<InvocationResult> start() {
            try {
                ToolDefinition definition = registry.lookup(request.toolName());
                ToolDescriptor descriptor = definition.descriptor();

                ValidationReport report = validator.validateInput(descriptor, request.arguments());
                if (!report.isValid()) {
                    metricsService.incrementValidationFailure(descriptor.getName());
                    throw new ToolValidationException(descriptor.getName(), report.violations());
                }
                transition(InvocationState.VALIDATED);

                String cacheKey = null;
                if (descriptor.isCacheable()) {
                    transition(InvocationState.CACHE_CHECK);
                    cacheKey = CacheKeys.derive(descriptor.getName(), request.arguments());
                    Optional<JsonNode> cached = cache.get(cacheKey);
                    if (cached.isPresent()) {
                        metricsService.recordCacheHit(descriptor.getName());
                        transition(InvocationState.CACHE_HIT);
                        result.complete(succeed(cached.get(), true, 0));
                        return result;
                    }
                    metricsService.recordCacheMiss(descriptor.getName());
                }

                dispatch(definition, cacheKey);
            } catch (Exception e) {
                result.complete(fail(e));
            }
            return result;
        }

        private void dispatch(ToolDefinition definition, String cacheKey) {
            transition(InvocationState.DISPATCHING);
            RetryPolicy policy = RetryPolicy.resolve(definition.descriptor(), options.defaultPolicy());
            inFlight.put(this, Boolean.TRUE);
            result.whenComplete((r, error) -> {
                inFlight.remove(this);
                if (result.isCancelled()) {
                    cancelExecution();
                    fail(new CancellationException("Invocation cancelled by caller"));
                }
            });

            execution = retryingExecutor.execute(definition, request.arguments(), policy, request.requestId());
            if (result.isDone()) {
                cancelExecution();
                return;
            }
            execution.whenComplete((outcome, error) -> {
                try (LogContext ctx = LogContext.forInvocation(request.requestId(), request.toolName())) {
                    if (error != null) {
                        result.complete(fail(error));
                    } else {
                        result.complete(complete(definition.descriptor(), cacheKey, outcome));
                    }
                }
            });
        }

        private InvocationResult complete(ToolDescriptor descriptor, String cacheKey, ExecutionOutcome outcome) {
            try {
                ValidationReport report = validator.validateOutput(descriptor, outcome.value());
                if (!report.isValid()) {
                    log.warn("tool.output.invalid tool={} violations={}",
                            descriptor.getName(), report.violations().size());
                }
                if (cacheKey != null) {
                    Duration ttl = descriptor.getCacheTtl().orElse(options.getCacheConfig().defaultTtl());
                    cache.put(cacheKey, outcome.value(), ttl);
                }
                return succeed(outcome.value(), false, outcome.attempts());
            } catch (RuntimeException e) {
                return fail(new InternalEngineException("Failed to store result of '" + descriptor.getName() + "'", e));
            }
        }

        void cancel(String reason) {
            cancelExecution();
            result.complete(fail(new CancellationException(reason)));
        }

        private void cancelExecution() {
            CompletableFuture<ExecutionOutcome> current = execution;
            if (current != null) {
                current.cancel(true);
            }
        }

        private InvocationResult succeed(JsonNode value, boolean fromCache, int attempts) {
            transition(InvocationState.SUCCEEDED);
            Duration duration = elapsed();
            if (finish(fromCache ? "cache_hit" : "success", duration)) {
                span.setAttribute("tool.from_cache", fromCache);
                span.setAttribute("tool.attempts", attempts);
                span.setStatus(Span.SpanStatus.OK);
                span.close();
                log.info("tool.invoked tool={} fromCache={} attempts={} durationMs={}",
                        request.toolName(), fromCache, attempts, duration.toMillis());
            }
            return InvocationResult.success(request.requestId(), request.toolName(), value, fromCache,
                    duration, attempts, snapshot());
        }

        private InvocationResult fail(Throwable failure) {
            Throwable cause = unwrap(failure);
            ToolError error;
            int attempts = 0;
            if (cause instanceof CancellationException) {
                error = ToolError.of(ErrorCode.CANCELLED,
                        cause.getMessage() != null ? cause.getMessage() : "Invocation cancelled");
            } else if (cause instanceof ToolException toolException) {
                error = ToolError.from(toolException);
                if (toolException instanceof ToolExecutionException executionException) {
                    attempts = executionException.getAttempts();
                }
            } else {
                log.error("engine.internal_error tool={} requestId={}", request.toolName(), request.requestId(), cause);
                error = ToolError.from(new InternalEngineException("Unexpected engine fault: " + cause, cause));
            }

            transition(InvocationState.FAILED);
            Duration duration = elapsed();
            if (finish(error.code().name().toLowerCase(Locale.ROOT), duration)) {
                span.setAttribute("tool.error_code", error.code().name());
                span.recordException(cause);
                span.setStatus(Span.SpanStatus.ERROR, error.code().name());
                span.close();
                if (error.code() == ErrorCode.INTERNAL_ERROR) {
                    log.error("tool.failed tool={} code={} durationMs={} message={}",
                            request.toolName(), error.code(), duration.toMillis(), error.message());
                } else {
                    log.warn("tool.failed tool={} code={} attempts={} durationMs={} message={}",
                            request.toolName(), error.code(), attempts, duration.toMillis(), error.message());
                }
            }
            return InvocationResult.failure(request.requestId(), request.toolName(), error,
                    duration, attempts, snapshot());
        }

        private boolean finish(String outcome, Duration duration) {
            if (!finished.compareAndSet(false, true)) {
                return false;
            }
            metricsService.recordInvocation(String.valueOf(request.toolName()), outcome, duration);
            return true;
        }

        private void transition(InvocationState state) {
            synchronized (transitions) {
                if (!transitions.isEmpty() && transitions.get(transitions.size() - 1).state().isTerminal()) {
                    return;
                }
                transitions.add(new StateTransition(state, elapsed()));
            }
            span.addEvent(state.name());
        }

        private List<StateTransition> snapshot() {
            synchronized (transitions) {
                return List.copyOf(transitions);
            }
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }

        private Throwable unwrap(Throwable failure) {
            Throwable current = failure;
            while (current instanceof CompletionException && current.getCause() != null) {
                current = current.getCause();
            }
            return current;
        }
    }

    public static class Builder {
        private ToolRegistry registry;
        private EngineOptions options = EngineOptions.defaults();
        private ResultCache cache;
        private SchemaValidator validator = new SchemaValidator();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private Clock clock = Clock.systemUTC();

        public Builder registry(ToolRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder options(EngineOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        /**
         * Overrides the cache built from {@link EngineOptions#getCacheConfig()}.
         */
        public Builder cache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder validator(SchemaValidator validator) {
            this.validator = Objects.requireNonNull(validator, "validator must not be null");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService must not be null");
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = Objects.requireNonNull(tracingService, "tracingService must not be null");
            return this;
        }

        /**
         * Clock used for cache expiry.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public ToolEngine build() {
            if (registry == null) {
                throw new IllegalArgumentException("registry is required");
            }
            return new ToolEngine(this);
        }
    }
}
